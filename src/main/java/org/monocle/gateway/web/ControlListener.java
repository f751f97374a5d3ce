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

package org.monocle.gateway.web;

import javax.annotation.Nonnull;

/**
 * Notifications of a {@link LocalControlServer}. Controllers are identified
 * by their remote address.
 */
public interface ControlListener {

    default void onConnected(@Nonnull String controller) {
    }

    default void onDisconnected(@Nonnull String controller) {
    }

    default void onError(@Nonnull String controller, @Nonnull Throwable cause) {
    }

    default void onStop(@Nonnull String controller) {
    }

    default void onHome(@Nonnull String controller) {
    }

    default void onPreset(@Nonnull String controller, @Nonnull String token) {
    }

    default void onPtz(@Nonnull String controller, int pan, int tilt, int zoom) {
    }

    default void onPan(@Nonnull String controller, int pan) {
    }

    default void onTilt(@Nonnull String controller, int tilt) {
    }

    default void onZoom(@Nonnull String controller, int zoom) {
    }
}
