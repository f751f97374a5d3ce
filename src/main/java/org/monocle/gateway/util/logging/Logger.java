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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class of the loggers used across the gateway. Every component receives
 * its logger through its constructor, so tests can hand in a quiet one.
 * <p>
 * Messages below the level of the logger are dropped here; subclasses only
 * decide where the remaining ones are written.
 */
public abstract class Logger {

    private volatile Level level;

    public Logger(@Nonnull Level level) {
        this.level = level;
    }

    public void setLevel(@Nonnull Level level) {
        this.level = level;
    }

    @Nonnull
    public Level getLevel() {
        return level;
    }

    public boolean isEnabledFor(@Nonnull Level messageLevel) {
        return messageLevel.isGreaterOrEqual(level);
    }

    public boolean isDebugEnabled() {
        return isEnabledFor(Level.DEBUG);
    }

    /**
     * Write a message that passed the level filter.
     *
     * @param messageLevel level of the message.
     * @param message      the message.
     * @param t            attached error, or null.
     */
    protected abstract void write(@Nonnull Level messageLevel,
                                  @Nonnull Object message,
                                  @Nullable Throwable t);

    private void log(Level messageLevel, Object message, Throwable t) {
        if (isEnabledFor(messageLevel)) {
            write(messageLevel, message, t);
        }
    }

    public void debug(@Nonnull Object message) {
        log(Level.DEBUG, message, null);
    }

    public void debug(@Nonnull Object message, @Nonnull Throwable t) {
        log(Level.DEBUG, message, t);
    }

    public void info(@Nonnull Object message) {
        log(Level.INFO, message, null);
    }

    public void info(@Nonnull Object message, @Nonnull Throwable t) {
        log(Level.INFO, message, t);
    }

    public void warn(@Nonnull Object message) {
        log(Level.WARN, message, null);
    }

    public void warn(@Nonnull Object message, @Nonnull Throwable t) {
        log(Level.WARN, message, t);
    }

    public void error(@Nonnull Object message) {
        log(Level.ERROR, message, null);
    }

    public void error(@Nonnull Object message, @Nonnull Throwable t) {
        log(Level.ERROR, message, t);
    }

    public void fatal(@Nonnull Object message) {
        log(Level.FATAL, message, null);
    }

    public void fatal(@Nonnull Object message, @Nonnull Throwable t) {
        log(Level.FATAL, message, t);
    }
}
