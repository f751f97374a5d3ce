/***********************************************************************
 * This file is part of Monocle Gateway.
 *
 * Monocle Gateway is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Monocle Gateway is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Monocle Gateway.  If not, see <http://www.gnu.org/licenses/>.
 ************************************************************************/

package org.monocle.gateway.remote;

import io.vertx.core.Future;

import javax.annotation.Nonnull;

/**
 * A bidirectional text channel to the remote API. One transport carries at
 * most one connection at a time.
 */
public interface RemoteTransport {

    /**
     * Receives the events of the current connection.
     */
    interface Listener {
        void onOpen();

        void onMessage(@Nonnull String text);

        void onError(@Nonnull Throwable cause);

        /**
         * @param code close code of the connection, or 1006 when the
         *             connection dropped without one.
         */
        void onClose(int code);
    }

    /**
     * Open a connection authenticated with a bearer token.
     *
     * @return Future completed once the connection is open. A failed future
     * means no connection was made and {@link Listener#onClose(int)} will not
     * be called for it.
     */
    @Nonnull
    Future<Void> open(@Nonnull String uri, @Nonnull String token, @Nonnull Listener listener);

    boolean isOpen();

    /**
     * Transmit a text frame on the open connection.
     */
    void send(@Nonnull String text);

    /**
     * Close the connection with the given close code. A connection still
     * being opened is closed once it is established, without
     * {@link Listener#onOpen()}, and reported through
     * {@link Listener#onClose(int)}. Does nothing when no connection is open
     * or opening.
     */
    void close(int code);
}
