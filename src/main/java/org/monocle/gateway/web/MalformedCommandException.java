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

/**
 * A control message that does not form a valid command.
 */
public class MalformedCommandException extends Exception {
    private static final long serialVersionUID = 3020170432981755262L;

    private final String command;

    public MalformedCommandException(String command, String message) {
        super(message);
        this.command = command;
    }

    public MalformedCommandException(String command, String message, Throwable cause) {
        super(message, cause);
        this.command = command;
    }

    /**
     * @return the raw message that failed to parse.
     */
    public String getCommand() {
        return command;
    }
}
