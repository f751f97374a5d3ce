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

/**
 * The remote API refused the connection because the API token is missing,
 * invalid or expired (HTTP 401).
 */
public class RemoteAuthenticationException extends Exception {
    private static final long serialVersionUID = -2712836097416233416L;

    public RemoteAuthenticationException(String message) {
        super(message);
    }

    public RemoteAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
