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

import com.google.gson.JsonObject;

import javax.annotation.Nonnull;

/**
 * Lifecycle notifications of a {@link RemoteSessionClient}. Messages are
 * delivered whole through {@link #onData(JsonObject)}; their keys are
 * dispatched through the handlers registered on the client.
 */
public interface RemoteSessionListener {

    default void onStarting() {
    }

    default void onConnecting() {
    }

    default void onConnected() {
    }

    default void onData(@Nonnull JsonObject data) {
    }

    default void onError(@Nonnull Throwable cause) {
    }

    default void onClosed(int code) {
    }

    /**
     * @param interval milliseconds until the next connection attempt.
     */
    default void onReconnecting(long interval) {
    }

    default void onStopping() {
    }
}
