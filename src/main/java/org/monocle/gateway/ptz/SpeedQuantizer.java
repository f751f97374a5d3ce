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

import java.util.EnumMap;
import java.util.Map;

/**
 * The SpeedQuantizer maps the discrete speed levels sent by controllers
 * (-3..+3) to the fractional velocities understood by cameras (-1.0..+1.0).
 * <pre>
 *   3 = high speed
 *   2 = medium speed
 *   1 = low speed
 *   0 = stop
 * </pre>
 * Negative levels move the axis the other way (left, down, out).
 * Each axis owns its speed table.
 */
public class SpeedQuantizer {

    public static final int HIGH_SPEED = 3;
    public static final int MEDIUM_SPEED = 2;
    public static final int LOW_SPEED = 1;

    /**
     * Magnitudes of the three speed levels of one axis.
     */
    public static class SpeedTable {
        public final double high;
        public final double medium;
        public final double low;

        public SpeedTable(double high, double medium, double low) {
            if (!(0 < low && low < medium && medium < high && high <= 1)) {
                throw new IllegalArgumentException("Speed table must satisfy 0 < low < medium < high <= 1, got "
                        + high + "/" + medium + "/" + low);
            }
            this.high = high;
            this.medium = medium;
            this.low = low;
        }
    }

    public static final SpeedTable DEFAULT_PAN_SPEEDS = new SpeedTable(1, .5, .2);
    public static final SpeedTable DEFAULT_TILT_SPEEDS = new SpeedTable(1, .5, .2);
    public static final SpeedTable DEFAULT_ZOOM_SPEEDS = new SpeedTable(1, .5, .2);

    private final Map<Axis, SpeedTable> tables = new EnumMap<>(Axis.class);

    public SpeedQuantizer() {
        this(DEFAULT_PAN_SPEEDS, DEFAULT_TILT_SPEEDS, DEFAULT_ZOOM_SPEEDS);
    }

    public SpeedQuantizer(SpeedTable pan, SpeedTable tilt, SpeedTable zoom) {
        tables.put(Axis.PAN, pan);
        tables.put(Axis.TILT, tilt);
        tables.put(Axis.ZOOM, zoom);
    }

    /**
     * Scale a speed level to a camera velocity for an axis.
     *
     * @param axis  the axis to move.
     * @param level a number between -3 and +3.
     * @return a velocity between -1 and +1; exactly 0 for any level outside
     * {-3, -2, -1, 1, 2, 3}.
     */
    public double quantize(Axis axis, int level) {
        final SpeedTable table = tables.get(axis);
        switch (level) {
            case -HIGH_SPEED:
                return -table.high;
            case -MEDIUM_SPEED:
                return -table.medium;
            case -LOW_SPEED:
                return -table.low;
            case LOW_SPEED:
                return table.low;
            case MEDIUM_SPEED:
                return table.medium;
            case HIGH_SPEED:
                return table.high;
            default:
                return 0;
        }
    }
}
