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

package org.monocle.gateway.ptz;

/**
 * Base class of the failures reported by a {@link CameraSession}.
 */
public class CameraControlException extends Exception {
    private static final long serialVersionUID = -4403189367620153741L;

    public CameraControlException(String message) {
        super(message);
    }

    public CameraControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
