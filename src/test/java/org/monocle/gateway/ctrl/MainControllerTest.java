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

package org.monocle.gateway.ctrl;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.apache.log4j.Level;
import org.junit.Test;
import org.monocle.gateway.util.logging.ConsoleLogger;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class MainControllerTest {

    private final ConsoleLogger quiet = new ConsoleLogger(Level.OFF);

    @Test
    public void interruptedShutdownKeepsInterruptFlag() {
        Thread.currentThread().interrupt();

        MainController.awaitShutdown(Promise.promise().future(), 1000, quiet);

        assertTrue(Thread.interrupted());
    }

    @Test
    public void failedOrSlowShutdownReturns() {
        MainController.awaitShutdown(Future.failedFuture("server did not close"), 1000, quiet);
        MainController.awaitShutdown(Promise.promise().future(), 50, quiet);
        MainController.awaitShutdown(Future.succeededFuture(), 1000, quiet);

        assertFalse(Thread.currentThread().isInterrupted());
    }
}
