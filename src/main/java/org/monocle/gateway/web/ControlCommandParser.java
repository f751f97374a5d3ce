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
import java.util.Locale;

/**
 * Parses the text commands of local controllers. A command is a keyword,
 * matched regardless of case, followed by colon-separated arguments:
 * <pre>
 *   stop | home | preset:&lt;token&gt; | ptz:&lt;p&gt;:&lt;t&gt;:&lt;z&gt;
 *   | pan:&lt;p&gt; | tilt:&lt;t&gt; | zoom:&lt;z&gt;
 * </pre>
 * A preset token keeps its case and may itself contain colons. Arguments
 * beyond those a command takes are ignored.
 */
public final class ControlCommandParser {

    private ControlCommandParser() {
    }

    @Nonnull
    public static ControlIntent parse(@Nonnull String message) throws MalformedCommandException {
        final String text = message.trim();
        if (text.isEmpty()) {
            throw new MalformedCommandException(message, "Empty control command");
        }
        final int colon = text.indexOf(':');
        final String keyword = (colon < 0 ? text : text.substring(0, colon)).trim().toLowerCase(Locale.ROOT);
        final String rest = colon < 0 ? null : text.substring(colon + 1);
        final String[] args = rest == null ? new String[0] : rest.split(":", -1);

        switch (keyword) {
            case "stop":
                return ControlIntent.stop();
            case "home":
                return ControlIntent.home();
            case "preset":
                if (rest == null || rest.trim().isEmpty()) {
                    throw new MalformedCommandException(message,
                            "Invalid control command; missing preset token: " + text);
                }
                return ControlIntent.preset(rest.trim());
            case "ptz":
                requireArgs(message, args, 3);
                return ControlIntent.ptz(level(message, args[0]), level(message, args[1]), level(message, args[2]));
            case "pan":
                requireArgs(message, args, 1);
                return ControlIntent.pan(level(message, args[0]));
            case "tilt":
                requireArgs(message, args, 1);
                return ControlIntent.tilt(level(message, args[0]));
            case "zoom":
                requireArgs(message, args, 1);
                return ControlIntent.zoom(level(message, args[0]));
            default:
                throw new MalformedCommandException(message, "Unsupported control command: " + text);
        }
    }

    private static void requireArgs(String message, String[] args, int count) throws MalformedCommandException {
        if (args.length < count) {
            throw new MalformedCommandException(message, "Invalid control command; expected "
                    + count + " argument(s) but received " + args.length + ": " + message.trim());
        }
    }

    private static int level(String message, String arg) throws MalformedCommandException {
        try {
            return Integer.parseInt(arg.trim());
        } catch (NumberFormatException e) {
            throw new MalformedCommandException(message,
                    "Invalid control command; not an integer: \"" + arg + "\" in " + message.trim(), e);
        }
    }
}
