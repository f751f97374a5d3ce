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

import java.io.Serializable;
import java.util.Objects;

/**
 * Display resolution of a camera source.
 */
public class Resolution implements Serializable {
    private static final long serialVersionUID = 4329815307417431207L;

    public static final Resolution R_1920x1080 = new Resolution(1920, 1080);
    public static final Resolution R_1280x720 = new Resolution(1280, 720);
    public static final Resolution R_1600x1200 = new Resolution(1600, 1200);
    public static final Resolution R_1024x768 = new Resolution(1024, 768);
    public static final Resolution R_800x600 = new Resolution(800, 600);
    public static final Resolution R_640x480 = new Resolution(640, 480);
    public static final Resolution R_320x240 = new Resolution(320, 240);

    /* Number of pixels */
    private int width;
    private int height;

    public Resolution(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Resolution)) return false;
        Resolution that = (Resolution) o;
        return width == that.width && height == that.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
