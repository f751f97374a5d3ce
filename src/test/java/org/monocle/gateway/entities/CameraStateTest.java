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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class CameraStateTest {

    private static final DeviceInfo INFO = new DeviceInfo("Acme", "PTZ-9000", "2.1.4", "SN123", "HW1");

    @Test
    public void dtoHoldsPublicFieldsOnly() {
        CameraDescriptor source = CameraDescriptor.fromJson(JsonParser.parseString(
                "{\"uuid\":\"cam1\",\"name\":\"Porch\",\"uri\":\"rtsp://10.0.0.5/live\","
                        + "\"username\":\"admin\",\"password\":\"hunter2\"}"));
        CameraState state = CameraState.initialized(source, INFO, true,
                Arrays.asList(new Preset("1", "Door"), new Preset("2", "Gate")));

        JsonObject dto = state.toDTO();

        assertEquals("cam1", dto.get("uuid").getAsString());
        assertEquals("Porch", dto.get("name").getAsString());
        assertEquals("Acme", dto.get("manufacturer").getAsString());
        assertEquals("PTZ-9000", dto.get("model").getAsString());
        assertEquals("2.1.4", dto.get("firmwareVersion").getAsString());
        assertEquals("SN123", dto.get("serialNumber").getAsString());
        assertTrue(dto.get("ptz").getAsBoolean());
        assertEquals(2, dto.getAsJsonArray("presets").size());
        assertEquals("Gate", dto.getAsJsonArray("presets").get(1).getAsJsonObject().get("name").getAsString());
        assertFalse(dto.has("source"));
        assertFalse(dto.has("info"));
        assertFalse(state.toJson().contains("hunter2"));
    }

    @Test
    public void nameFallsBackToDeviceModel() {
        CameraDescriptor source = new CameraDescriptor.Builder().uuid("cam1").uri("rtsp://10.0.0.5/").build();

        CameraState state = CameraState.initialized(source, INFO, false, Collections.emptyList());

        assertEquals("PTZ-9000", state.getName());
        assertFalse(state.isPtz());
    }

    @Test
    public void descriptorFieldsWin() {
        CameraDescriptor source = new CameraDescriptor.Builder()
                .uuid("cam1").name("Garage").manufacturer("Other").model("M1").build();

        CameraState state = CameraState.initialized(source, INFO, true, Collections.emptyList());

        assertEquals("Garage", state.getName());
        assertEquals("Other", state.getManufacturer());
        assertEquals("M1", state.getModel());
    }

    @Test
    public void failedStateCarriesError() {
        CameraDescriptor source = new CameraDescriptor.Builder().uuid("cam1").name("Garage").build();

        CameraState state = CameraState.failed(source, "Unable to initialize camera Garage: timeout");

        assertFalse(state.isPtz());
        assertTrue(state.getPresets().isEmpty());
        assertNull(state.getFirmwareVersion());
        assertEquals("Unable to initialize camera Garage: timeout", state.toDTO().get("error").getAsString());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void presetsAreImmutable() {
        CameraDescriptor source = new CameraDescriptor.Builder().uuid("cam1").build();
        CameraState.initialized(source, INFO, true, Arrays.asList(new Preset("1", "Door")))
                .getPresets().add(new Preset("2", "Gate"));
    }
}
