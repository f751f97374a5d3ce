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

import org.monocle.gateway.entities.CameraDescriptor;
import org.monocle.gateway.entities.DeviceInfo;

/**
 * Notifications emitted by a {@link CameraSession}. Every method has an empty
 * default so observers only override what they care about.
 */
public interface CameraSessionListener {

    default void onUninitialized(CameraDescriptor descriptor) {
    }

    default void onInitialized(DeviceInfo info) {
    }

    default void onStop() {
    }

    default void onHome() {
    }

    default void onPreset(String token) {
    }

    default void onPan(double pan) {
    }

    default void onTilt(double tilt) {
    }

    default void onZoom(double zoom) {
    }

    default void onPtz(double pan, double tilt, double zoom) {
    }

    default void onError(Throwable error) {
    }
}
