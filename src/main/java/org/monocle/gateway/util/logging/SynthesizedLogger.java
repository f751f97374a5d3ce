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

import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.PropertyConfigurator;
import org.monocle.gateway.ctrl.GatewayPropertyCenter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.File;
import java.net.URL;

/**
 * The SynthesizedLogger class synthesizes the logging methods of the gateway:
 * messages go both to a log4j logger named after the component and to the
 * console.
 */
public class SynthesizedLogger extends Logger {

    private static volatile boolean log4jConfigured = false;

    private final String component;
    private final org.apache.log4j.Logger log4jLogger;
    private final ConsoleLogger consoleLogger;

    /**
     * Load the log4j configuration once per process. An explicit file wins over
     * the log4j.properties on the classpath.
     *
     * @param log4jPropFilePath path of a log4j property file, or null.
     */
    public static void configureLog4j(@Nullable String log4jPropFilePath) {
        synchronized (SynthesizedLogger.class) {
            if (log4jConfigured) {
                return;
            }
            if (log4jPropFilePath != null && new File(log4jPropFilePath).exists()) {
                PropertyConfigurator.configure(log4jPropFilePath);
            } else {
                URL url = SynthesizedLogger.class.getResource("/log4j.properties");
                if (url != null) {
                    PropertyConfigurator.configure(url);
                }
            }
            log4jConfigured = true;
        }
    }

    /**
     * Create a synthesized logger. Logs will be printed to console and
     * transferred to the log4j logger named after the component.
     *
     * @param component  Name of the component using the logger.
     * @param propCenter Properties of the gateway.
     */
    public SynthesizedLogger(@Nonnull String component,
                             @Nonnull GatewayPropertyCenter propCenter) {
        this(component, propCenter.verbose ? Level.DEBUG : Level.INFO, propCenter.log4jPropFilePath);
    }

    public SynthesizedLogger(@Nonnull String component,
                             @Nonnull Level level,
                             @Nullable String log4jPropFilePath) {
        super(level);
        this.component = component;

        configureLog4j(log4jPropFilePath);
        log4jLogger = LogManager.getLogger(component);
        log4jLogger.setLevel(level);

        consoleLogger = new ConsoleLogger(level);
    }

    @Override
    public void setLevel(@Nonnull Level level) {
        super.setLevel(level);
        log4jLogger.setLevel(level);
        consoleLogger.setLevel(level);
    }

    @Override
    protected void write(@Nonnull Level messageLevel,
                         @Nonnull Object message,
                         @Nullable Throwable t) {
        log4jLogger.log(messageLevel, message, t);
        consoleLogger.write(messageLevel, "[" + component + "] " + message, t);
    }
}
