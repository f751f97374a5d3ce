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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SpeedQuantizerTest {

    private final SpeedQuantizer quantizer = new SpeedQuantizer();

    @Test
    public void outOfRangeLevelsAreStill() {
        for (Axis axis : Axis.values()) {
            for (int level : new int[]{0, 4, -4, 100, Integer.MIN_VALUE, Integer.MAX_VALUE}) {
                assertEquals(0.0, quantizer.quantize(axis, level), 0.0);
            }
        }
    }

    @Test
    public void defaultTable() {
        assertEquals(1.0, quantizer.quantize(Axis.PAN, 3), 0.0);
        assertEquals(0.5, quantizer.quantize(Axis.PAN, 2), 0.0);
        assertEquals(0.2, quantizer.quantize(Axis.PAN, 1), 0.0);
        assertEquals(-0.2, quantizer.quantize(Axis.TILT, -1), 0.0);
        assertEquals(-0.5, quantizer.quantize(Axis.TILT, -2), 0.0);
        assertEquals(-1.0, quantizer.quantize(Axis.ZOOM, -3), 0.0);
    }

    @Test
    public void signPreservedAndMonotonic() {
        for (Axis axis : Axis.values()) {
            double previous = 0;
            for (int level = 1; level <= 3; ++level) {
                final double forward = quantizer.quantize(axis, level);
                final double backward = quantizer.quantize(axis, -level);
                assertTrue(forward > previous);
                assertEquals(-forward, backward, 0.0);
                previous = forward;
            }
        }
    }

    @Test
    public void customTablesPerAxis() {
        final SpeedQuantizer custom = new SpeedQuantizer(
                new SpeedQuantizer.SpeedTable(0.9, 0.6, 0.3),
                SpeedQuantizer.DEFAULT_TILT_SPEEDS,
                new SpeedQuantizer.SpeedTable(0.8, 0.4, 0.1));
        assertEquals(0.6, custom.quantize(Axis.PAN, 2), 0.0);
        assertEquals(0.5, custom.quantize(Axis.TILT, 2), 0.0);
        assertEquals(-0.1, custom.quantize(Axis.ZOOM, -1), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void unorderedTableRejected() {
        new SpeedQuantizer.SpeedTable(0.5, 0.6, 0.1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void tableAboveFullSpeedRejected() {
        new SpeedQuantizer.SpeedTable(1.5, 0.6, 0.1);
    }
}
