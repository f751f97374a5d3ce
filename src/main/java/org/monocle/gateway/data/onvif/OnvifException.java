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

package org.monocle.gateway.data.onvif;

/**
 * Failure of an ONVIF request: transport error, HTTP error status, SOAP fault
 * or unreadable response.
 */
public class OnvifException extends Exception {
    private static final long serialVersionUID = 5390467150347318822L;

    private final int statusCode;

    public OnvifException(String message) {
        this(message, -1);
    }

    public OnvifException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public OnvifException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * @return HTTP status of the response, or -1 if none was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isAuthenticationFailure() {
        return statusCode == 401;
    }
}
