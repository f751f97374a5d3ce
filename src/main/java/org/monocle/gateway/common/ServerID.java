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

package org.monocle.gateway.common;

import javax.annotation.Nonnull;
import java.io.Serializable;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Identifier of external servers (e.g. an ONVIF camera).
 */
public class ServerID implements Serializable {
    private static final long serialVersionUID = 2091306632553954507L;

    /**
     * Port value meaning "the default port of the protocol".
     */
    public static final int DEFAULT_PORT = -1;

    public final String host;
    public final int port;

    public ServerID(@Nonnull String host, int port) {
        this.host = host;
        this.port = port;
    }

    /**
     * Extract the server part of a URI such as rtsp://10.0.0.12:554/stream1.
     * Only the host is kept: the port of a media URI says nothing about the
     * port of the control service.
     *
     * @param uri URI of a camera resource.
     * @return Identifier of the host, on the default port.
     * @throws URISyntaxException if the URI is malformed or carries no host.
     */
    public static ServerID fromUri(@Nonnull String uri) throws URISyntaxException {
        final String host = new URI(uri.trim()).getHost();
        if (host == null) {
            throw new URISyntaxException(uri, "No host found in URI");
        }
        return new ServerID(host, DEFAULT_PORT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ServerID)) return false;
        ServerID serverID = (ServerID) o;
        return port == serverID.port && host.equals(serverID.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return port == DEFAULT_PORT ? host : host + ":" + port;
    }
}
