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

import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.Serializable;
import java.util.Map;

/**
 * Facts reported by the device itself once connected.
 */
public class DeviceInfo implements Serializable {
    private static final long serialVersionUID = -1150734245123780436L;

    private final String manufacturer;
    private final String model;
    private final String firmwareVersion;
    private final String serialNumber;
    private final String hardwareId;

    public DeviceInfo(String manufacturer,
                      String model,
                      String firmwareVersion,
                      String serialNumber,
                      String hardwareId) {
        this.manufacturer = manufacturer;
        this.model = model;
        this.firmwareVersion = firmwareVersion;
        this.serialNumber = serialNumber;
        this.hardwareId = hardwareId;
    }

    /**
     * Build device info from the properties of a device response. Devices
     * answer with either "Manufacturer" or "manufacturer"; the lower-camel
     * form wins when both are present.
     *
     * @param props properties of the response, keyed by element name.
     * @return the normalized device info.
     */
    @Nonnull
    public static DeviceInfo fromProperties(@Nonnull Map<String, String> props) {
        return new DeviceInfo(
                lookup(props, "manufacturer"),
                lookup(props, "model"),
                lookup(props, "firmwareVersion"),
                lookup(props, "serialNumber"),
                lookup(props, "hardwareId"));
    }

    @Nullable
    private static String lookup(Map<String, String> props, String key) {
        String value = props.get(key);
        if (StringUtils.isEmpty(value)) {
            value = props.get(StringUtils.capitalize(key));
        }
        return StringUtils.isEmpty(value) ? null : value;
    }

    @Nullable
    public String getManufacturer() {
        return manufacturer;
    }

    @Nullable
    public String getModel() {
        return model;
    }

    @Nullable
    public String getFirmwareVersion() {
        return firmwareVersion;
    }

    @Nullable
    public String getSerialNumber() {
        return serialNumber;
    }

    @Nullable
    public String getHardwareId() {
        return hardwareId;
    }

    @Override
    public String toString() {
        return manufacturer + " " + model + " (firmware " + firmwareVersion
                + ", serial " + serialNumber + ", hardware " + hardwareId + ")";
    }
}
