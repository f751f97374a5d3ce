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

import com.google.gson.Gson;
import com.google.gson.JsonObject;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only snapshot of the controlled camera, as shown to local controllers.
 * <p>
 * Descriptor values take precedence over the values reported by the device.
 * The descriptor and the device info themselves are kept as transient fields,
 * so they never appear in the data transfer object.
 */
public final class CameraState implements Serializable {
    private static final long serialVersionUID = 7702262346619946531L;

    private static final Gson GSON = new Gson();

    private final transient CameraDescriptor source;
    private final transient DeviceInfo info;

    private final String uuid;
    private final String name;
    private final String manufacturer;
    private final String model;
    private final String firmwareVersion;
    private final String serialNumber;
    private final boolean ptz;
    private final List<Preset> presets;
    private final String error;

    private CameraState(@Nonnull CameraDescriptor source,
                        @Nullable DeviceInfo info,
                        boolean ptz,
                        @Nonnull List<Preset> presets,
                        @Nullable String error) {
        this.source = source;
        this.info = info;
        this.ptz = ptz;
        this.presets = Collections.unmodifiableList(new ArrayList<>(presets));
        this.error = error;

        this.uuid = source.getUuid();
        this.serialNumber = info == null ? null : info.getSerialNumber();
        this.firmwareVersion = info == null ? null : info.getFirmwareVersion();
        this.name = firstNonNull(source.getName(), info == null ? null : info.getModel());
        this.manufacturer = firstNonNull(source.getManufacturer(), info == null ? null : info.getManufacturer());
        this.model = firstNonNull(source.getModel(), info == null ? null : info.getModel());
    }

    /**
     * State of a camera whose initialization succeeded.
     */
    @Nonnull
    public static CameraState initialized(@Nonnull CameraDescriptor source,
                                          @Nonnull DeviceInfo info,
                                          boolean ptz,
                                          @Nonnull List<Preset> presets) {
        return new CameraState(source, info, ptz, presets, null);
    }

    /**
     * Degraded state of a camera whose initialization failed, for display only.
     */
    @Nonnull
    public static CameraState failed(@Nonnull CameraDescriptor source, @Nonnull String error) {
        return new CameraState(source, null, false, Collections.emptyList(), error);
    }

    @Nullable
    private static String firstNonNull(@Nullable String preferred, @Nullable String fallback) {
        return preferred != null ? preferred : fallback;
    }

    @Nonnull
    public CameraDescriptor getSource() {
        return source;
    }

    @Nullable
    public DeviceInfo getInfo() {
        return info;
    }

    @Nullable
    public String getUuid() {
        return uuid;
    }

    @Nullable
    public String getName() {
        return name;
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

    public boolean isPtz() {
        return ptz;
    }

    @Nonnull
    public List<Preset> getPresets() {
        return presets;
    }

    @Nullable
    public String getError() {
        return error;
    }

    /**
     * @return the public fields of this state as a JSON object.
     */
    @Nonnull
    public JsonObject toDTO() {
        return GSON.toJsonTree(this).getAsJsonObject();
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    @Override
    public String toString() {
        return "CameraState{name=" + name + ", ptz=" + ptz + ", presets=" + presets
                + (error == null ? "" : ", error=" + error) + "}";
    }
}
