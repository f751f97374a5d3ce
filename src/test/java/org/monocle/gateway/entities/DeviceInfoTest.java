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

package org.monocle.gateway.entities;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class DeviceInfoTest {

    @Test
    public void capitalizedKeys() {
        Map<String, String> props = new HashMap<>();
        props.put("Manufacturer", "Acme");
        props.put("Model", "PTZ-9000");
        props.put("FirmwareVersion", "2.1.4");
        props.put("SerialNumber", "SN123");
        props.put("HardwareId", "HW1");

        DeviceInfo info = DeviceInfo.fromProperties(props);

        assertEquals("Acme", info.getManufacturer());
        assertEquals("PTZ-9000", info.getModel());
        assertEquals("2.1.4", info.getFirmwareVersion());
        assertEquals("SN123", info.getSerialNumber());
        assertEquals("HW1", info.getHardwareId());
    }

    @Test
    public void lowerCamelKeyWins() {
        Map<String, String> props = new HashMap<>();
        props.put("model", "lower");
        props.put("Model", "upper");
        props.put("firmwareVersion", "");
        props.put("FirmwareVersion", "1.0");

        DeviceInfo info = DeviceInfo.fromProperties(props);

        assertEquals("lower", info.getModel());
        assertEquals("1.0", info.getFirmwareVersion());
        assertNull(info.getManufacturer());
    }
}
