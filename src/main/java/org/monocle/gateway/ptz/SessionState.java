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
 * Lifecycle of the session held by a {@link CameraSession}.
 */
public enum SessionState {
    UNINITIALIZED,
    INITIALIZING,
    /* Connected, and the camera accepts PTZ commands. */
    READY_PTZ,
    /* Connected, but the camera has no PTZ service. */
    READY_NO_PTZ,
    /* The last initialization attempt could not reach the device. */
    FAILED
}
