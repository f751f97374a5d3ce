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

package org.monocle.gateway.data.onvif;

import org.junit.Test;
import org.monocle.gateway.entities.DeviceInfo;
import org.monocle.gateway.entities.Preset;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class SoapResponseTest {

    static String envelope(String body) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<env:Envelope xmlns:env=\"http://www.w3.org/2003/05/soap-envelope\""
                + " xmlns:tt=\"http://www.onvif.org/ver10/schema\""
                + " xmlns:tds=\"http://www.onvif.org/ver10/device/wsdl\""
                + " xmlns:trt=\"http://www.onvif.org/ver10/media/wsdl\""
                + " xmlns:tptz=\"http://www.onvif.org/ver20/ptz/wsdl\">"
                + "<env:Body>" + body + "</env:Body></env:Envelope>";
    }

    static final String DEVICE_INFORMATION = envelope("<tds:GetDeviceInformationResponse>"
            + "<tds:Manufacturer>Acme</tds:Manufacturer>"
            + "<tds:Model>PTZ-9000</tds:Model>"
            + "<tds:FirmwareVersion>2.1.4</tds:FirmwareVersion>"
            + "<tds:SerialNumber>SN123</tds:SerialNumber>"
            + "<tds:HardwareId>HW1</tds:HardwareId>"
            + "</tds:GetDeviceInformationResponse>");

    static String capabilities(String ptzAddress) {
        return envelope("<tds:GetCapabilitiesResponse><tds:Capabilities>"
                + "<tt:Device><tt:XAddr>http://cam/onvif/device_service</tt:XAddr></tt:Device>"
                + "<tt:Media><tt:XAddr>" + ptzAddress.replace("ptz", "media") + "</tt:XAddr></tt:Media>"
                + "<tt:PTZ><tt:XAddr>" + ptzAddress + "</tt:XAddr></tt:PTZ>"
                + "</tds:Capabilities></tds:GetCapabilitiesResponse>");
    }

    static final String PROFILES = envelope("<trt:GetProfilesResponse>"
            + "<trt:Profiles token=\"Profile_1\" fixed=\"true\"><tt:Name>main</tt:Name></trt:Profiles>"
            + "<trt:Profiles token=\"Profile_2\" fixed=\"true\"><tt:Name>sub</tt:Name></trt:Profiles>"
            + "</trt:GetProfilesResponse>");

    static final String PRESETS = envelope("<tptz:GetPresetsResponse>"
            + "<tptz:Preset token=\"1\"><tt:Name>Door</tt:Name></tptz:Preset>"
            + "<tptz:Preset token=\"2\"><tt:Name>Gate</tt:Name></tptz:Preset>"
            + "<tptz:Preset token=\"7\"><tt:Name>Yard</tt:Name></tptz:Preset>"
            + "</tptz:GetPresetsResponse>");

    @Test
    public void deviceInformation() throws Exception {
        DeviceInfo info = DeviceInfo.fromProperties(
                SoapResponse.parse(DEVICE_INFORMATION).childTexts("GetDeviceInformationResponse"));

        assertEquals("Acme", info.getManufacturer());
        assertEquals("PTZ-9000", info.getModel());
        assertEquals("2.1.4", info.getFirmwareVersion());
        assertEquals("SN123", info.getSerialNumber());
        assertEquals("HW1", info.getHardwareId());
    }

    @Test
    public void serviceAddresses() throws Exception {
        SoapResponse response = SoapResponse.parse(capabilities("http://cam/onvif/ptz_service"));

        assertEquals("http://cam/onvif/ptz_service", response.serviceAddress("PTZ"));
        assertEquals("http://cam/onvif/media_service", response.serviceAddress("Media"));
        assertNull(response.serviceAddress("Imaging"));
    }

    @Test
    public void firstProfileToken() throws Exception {
        assertEquals("Profile_1", SoapResponse.parse(PROFILES).firstProfileToken());
        assertNull(SoapResponse.parse(envelope("<trt:GetProfilesResponse/>")).firstProfileToken());
    }

    @Test
    public void presetsInDeviceOrder() throws Exception {
        assertEquals(Arrays.asList(new Preset("1", "Door"), new Preset("2", "Gate"), new Preset("7", "Yard")),
                SoapResponse.parse(PRESETS).presets());
    }

    @Test
    public void singlePreset() throws Exception {
        String single = envelope("<tptz:GetPresetsResponse>"
                + "<tptz:Preset token=\"home\"><tt:Name>Home</tt:Name></tptz:Preset>"
                + "</tptz:GetPresetsResponse>");

        assertEquals(Collections.singletonList(new Preset("home", "Home")), SoapResponse.parse(single).presets());
    }

    @Test
    public void noPresets() throws Exception {
        assertTrue(SoapResponse.parse(envelope("<tptz:GetPresetsResponse/>")).presets().isEmpty());
    }

    @Test
    public void faultFails() {
        String fault = envelope("<env:Fault><env:Code><env:Value>env:Sender</env:Value></env:Code>"
                + "<env:Reason><env:Text xml:lang=\"en\">Sender not Authorized</env:Text></env:Reason>"
                + "</env:Fault>");
        try {
            SoapResponse.parse(fault);
            fail("A SOAP fault must fail the response");
        } catch (OnvifException e) {
            assertEquals("SOAP fault: Sender not Authorized", e.getMessage());
        }
    }

    @Test(expected = OnvifException.class)
    public void malformedFails() throws Exception {
        SoapResponse.parse("<html><body>Not found");
    }
}
