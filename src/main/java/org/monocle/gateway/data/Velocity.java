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

package org.monocle.gateway.data;

import java.io.Serializable;

/**
 * Per-axis speed of a PTZ movement, each component in [-1.0, 1.0].
 * x pans, y tilts and z zooms.
 */
public final class Velocity implements Serializable {
    private static final long serialVersionUID = 3468210749321655101L;

    public static final Velocity FULL_SPEED = new Velocity(1, 1, 1);
    public static final Velocity STILL = new Velocity(0, 0, 0);

    public final double x;
    public final double y;
    public final double z;

    public Velocity(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Velocity)) return false;
        Velocity velocity = (Velocity) o;
        return Double.compare(velocity.x, x) == 0
                && Double.compare(velocity.y, y) == 0
                && Double.compare(velocity.z, z) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(x);
        result = 31 * result + Double.hashCode(y);
        result = 31 * result + Double.hashCode(z);
        return result;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ", " + z + ")";
    }
}
