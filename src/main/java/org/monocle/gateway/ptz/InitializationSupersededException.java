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

/**
 * An initialization finished after a newer one had started. Its result was
 * dropped.
 */
public class InitializationSupersededException extends CameraControlException {
    private static final long serialVersionUID = -8853937301465902166L;

    public InitializationSupersededException(CameraDescriptor descriptor) {
        super("Initialization of camera " + descriptor.getName() + " was superseded by a newer one");
    }
}
