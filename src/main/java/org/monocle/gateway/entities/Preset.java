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

import javax.annotation.Nonnull;
import java.io.Serializable;
import java.util.Objects;

/**
 * A position stored on the device, recallable by its token.
 */
public class Preset implements Serializable {
    private static final long serialVersionUID = -2385309836421190556L;

    private final String token;
    private final String name;

    public Preset(@Nonnull String token, String name) {
        this.token = token;
        this.name = name;
    }

    @Nonnull
    public String getToken() {
        return token;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Preset)) return false;
        Preset preset = (Preset) o;
        return token.equals(preset.token) && Objects.equals(name, preset.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(token, name);
    }

    @Override
    public String toString() {
        return name + "<" + token + ">";
    }
}
