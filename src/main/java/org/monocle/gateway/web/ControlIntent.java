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

package org.monocle.gateway.web;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * A control command sent by a local controller, once parsed.
 */
public final class ControlIntent {

    public enum Type {
        STOP,
        HOME,
        PRESET,
        PTZ,
        PAN,
        TILT,
        ZOOM
    }

    private final Type type;
    private final String preset;
    private final int pan;
    private final int tilt;
    private final int zoom;

    private ControlIntent(Type type, String preset, int pan, int tilt, int zoom) {
        this.type = type;
        this.preset = preset;
        this.pan = pan;
        this.tilt = tilt;
        this.zoom = zoom;
    }

    public static ControlIntent stop() {
        return new ControlIntent(Type.STOP, null, 0, 0, 0);
    }

    public static ControlIntent home() {
        return new ControlIntent(Type.HOME, null, 0, 0, 0);
    }

    public static ControlIntent preset(@Nonnull String token) {
        return new ControlIntent(Type.PRESET, token, 0, 0, 0);
    }

    public static ControlIntent ptz(int pan, int tilt, int zoom) {
        return new ControlIntent(Type.PTZ, null, pan, tilt, zoom);
    }

    public static ControlIntent pan(int pan) {
        return new ControlIntent(Type.PAN, null, pan, 0, 0);
    }

    public static ControlIntent tilt(int tilt) {
        return new ControlIntent(Type.TILT, null, 0, tilt, 0);
    }

    public static ControlIntent zoom(int zoom) {
        return new ControlIntent(Type.ZOOM, null, 0, 0, zoom);
    }

    @Nonnull
    public Type getType() {
        return type;
    }

    @Nullable
    public String getPreset() {
        return preset;
    }

    public int getPan() {
        return pan;
    }

    public int getTilt() {
        return tilt;
    }

    public int getZoom() {
        return zoom;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ControlIntent)) return false;
        ControlIntent that = (ControlIntent) o;
        return type == that.type && pan == that.pan && tilt == that.tilt && zoom == that.zoom
                && (preset == null ? that.preset == null : preset.equals(that.preset));
    }

    @Override
    public int hashCode() {
        int result = type.hashCode();
        result = 31 * result + (preset != null ? preset.hashCode() : 0);
        result = 31 * result + pan;
        result = 31 * result + tilt;
        result = 31 * result + zoom;
        return result;
    }

    @Override
    public String toString() {
        switch (type) {
            case PRESET:
                return "preset:" + preset;
            case PTZ:
                return "ptz:" + pan + ":" + tilt + ":" + zoom;
            case PAN:
                return "pan:" + pan;
            case TILT:
                return "tilt:" + tilt;
            case ZOOM:
                return "zoom:" + zoom;
            default:
                return type.name().toLowerCase(Locale.ROOT);
        }
    }
}
