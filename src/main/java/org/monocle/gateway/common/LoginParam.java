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

package org.monocle.gateway.common;

import com.google.gson.annotations.SerializedName;

import javax.annotation.Nonnull;
import java.io.Serializable;

/**
 * Parameters for server login (e.g. web camera), including camera host,
 * port, username and password.
 */
public class LoginParam implements Serializable {
    private static final long serialVersionUID = -3831767044437766754L;
    @SerializedName("server-id")
    public final ServerID serverID;
    public final String username;
    public final transient String password;

    public LoginParam(@Nonnull String host, int port, String username, String password) {
        this(new ServerID(host, port), username, password);
    }

    public LoginParam(@Nonnull ServerID serverID, String username, String password) {
        this.serverID = serverID;
        this.username = username;
        this.password = password;
    }

    @Override
    public String toString() {
        return username + "@" + serverID;
    }
}
