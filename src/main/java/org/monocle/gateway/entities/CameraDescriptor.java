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
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.Serializable;

/**
 * Identity and connection facts of a camera as known by the Monocle platform.
 * It arrives as the payload of an "alexa.source" event and is never modified
 * afterwards.
 */
public class CameraDescriptor implements Serializable {
    private static final long serialVersionUID = 6152781938466129373L;

    private static final Gson GSON = new Gson();

    private String uuid;
    private String created;
    private String modified;
    private String owner;
    private String name;
    private String description;
    private String manufacturer;
    private String model;
    private String protocol;
    private String videoCodec;
    private String audioCodec;
    private Resolution resolution;
    private String uri;
    private String authenticationType;
    private String username;
    private transient String password;
    private Integer timeout;
    private String lastViewTimestamp;

    private CameraDescriptor() {
    }

    /**
     * Decode a descriptor from the JSON payload sent by the platform.
     *
     * @param json payload of the event.
     * @return the decoded descriptor.
     * @throws JsonParseException if the payload is not a JSON object.
     */
    @Nonnull
    public static CameraDescriptor fromJson(@Nonnull JsonElement json) {
        if (!json.isJsonObject()) {
            throw new JsonParseException("Camera source must be a JSON object: " + json);
        }
        final CameraDescriptor descriptor = GSON.fromJson(json, CameraDescriptor.class);
        // Transient fields are skipped by Gson.
        if (json.getAsJsonObject().has("password")
                && json.getAsJsonObject().get("password").isJsonPrimitive()) {
            descriptor.password = json.getAsJsonObject().get("password").getAsString();
        }
        return descriptor;
    }

    @Nullable
    public String getUuid() {
        return uuid;
    }

    @Nullable
    public String getCreated() {
        return created;
    }

    @Nullable
    public String getModified() {
        return modified;
    }

    @Nullable
    public String getOwner() {
        return owner;
    }

    @Nullable
    public String getName() {
        return name;
    }

    @Nullable
    public String getDescription() {
        return description;
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
    public String getProtocol() {
        return protocol;
    }

    @Nullable
    public String getVideoCodec() {
        return videoCodec;
    }

    @Nullable
    public String getAudioCodec() {
        return audioCodec;
    }

    @Nullable
    public Resolution getResolution() {
        return resolution;
    }

    @Nullable
    public String getUri() {
        return uri;
    }

    @Nullable
    public String getAuthenticationType() {
        return authenticationType;
    }

    @Nullable
    public String getUsername() {
        return username;
    }

    @Nullable
    public String getPassword() {
        return password;
    }

    /**
     * @return timeout (ms) the platform suggests for reaching the camera, or null.
     */
    @Nullable
    public Integer getTimeout() {
        return timeout;
    }

    @Nullable
    public String getLastViewTimestamp() {
        return lastViewTimestamp;
    }

    @Override
    public String toString() {
        return "CameraDescriptor{uuid=" + uuid + ", name=" + name + ", uri=" + uri + "}";
    }

    /**
     * Builder for descriptors created locally (tests and the debug connector).
     */
    public static class Builder {
        private final CameraDescriptor descriptor = new CameraDescriptor();

        public Builder uuid(String uuid) {
            descriptor.uuid = uuid;
            return this;
        }

        public Builder name(String name) {
            descriptor.name = name;
            return this;
        }

        public Builder manufacturer(String manufacturer) {
            descriptor.manufacturer = manufacturer;
            return this;
        }

        public Builder model(String model) {
            descriptor.model = model;
            return this;
        }

        public Builder uri(String uri) {
            descriptor.uri = uri;
            return this;
        }

        public Builder credentials(String username, String password) {
            descriptor.username = username;
            descriptor.password = password;
            return this;
        }

        public Builder resolution(Resolution resolution) {
            descriptor.resolution = resolution;
            return this;
        }

        public Builder timeout(Integer timeout) {
            descriptor.timeout = timeout;
            return this;
        }

        public CameraDescriptor build() {
            final CameraDescriptor built = new CameraDescriptor();
            built.uuid = descriptor.uuid;
            built.name = descriptor.name;
            built.manufacturer = descriptor.manufacturer;
            built.model = descriptor.model;
            built.uri = descriptor.uri;
            built.username = descriptor.username;
            built.password = descriptor.password;
            built.resolution = descriptor.resolution;
            built.timeout = descriptor.timeout;
            return built;
        }
    }
}
