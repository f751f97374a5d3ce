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


package org.monocle.gateway.util.logging;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.apache.log4j.Level;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * A simple logger for output logs to the console only. Warnings and worse go
 * to the standard error stream.
 */
public class ConsoleLogger extends Logger {

    private static final String HOST_NAME = hostName();

    public ConsoleLogger() {
        super(Level.INFO);
    }

    public ConsoleLogger(@Nonnull Level level) {
        super(level);
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "Unknown Host";
        }
    }

    @Override
    protected void write(@Nonnull Level messageLevel,
                         @Nonnull Object message,
                         @Nullable Throwable t) {
        final PrintStream stream = messageLevel.isGreaterOrEqual(Level.WARN) ? System.err : System.out;
        final StringBuilder line = new StringBuilder()
                .append('|').append(messageLevel).append('|')
                .append(HOST_NAME).append('\t').append(message);
        if (t != null) {
            line.append(System.lineSeparator()).append(ExceptionUtils.getStackTrace(t));
        }
        stream.println(line);
    }
}
