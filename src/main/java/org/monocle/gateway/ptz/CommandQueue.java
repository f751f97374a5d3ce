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

package org.monocle.gateway.ptz;

import io.vertx.core.Future;
import io.vertx.core.Promise;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * Runs asynchronous tasks one after another: a task starts only once the
 * future of the previous task completed, whatever its outcome.
 */
class CommandQueue {

    private Future<?> tail = Future.succeededFuture();

    @Nonnull
    synchronized <T> Future<T> submit(@Nonnull Supplier<Future<T>> task) {
        final Promise<T> promise = Promise.promise();
        tail.onComplete(ignored -> {
            Future<T> future;
            try {
                future = task.get();
            } catch (RuntimeException e) {
                future = Future.failedFuture(e);
            }
            future.onComplete(promise);
        });
        tail = promise.future();
        return promise.future();
    }
}
