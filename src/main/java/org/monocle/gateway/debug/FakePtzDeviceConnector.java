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

package org.monocle.gateway.debug;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.monocle.gateway.common.LoginParam;
import org.monocle.gateway.data.PtzDeviceConnector;
import org.monocle.gateway.data.Velocity;
import org.monocle.gateway.entities.DeviceInfo;
import org.monocle.gateway.entities.Preset;
import org.monocle.gateway.util.logging.ConsoleLogger;
import org.monocle.gateway.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A PTZ device connector that talks to no device. It answers from the
 * settings of its factory and records the commands it receives, so the
 * gateway can be run and tested without a camera.
 */
public class FakePtzDeviceConnector extends PtzDeviceConnector {

    public static class FakePtzDeviceConnectorFactory implements Factory {
        private volatile boolean ptzSupported = true;
        private volatile List<Preset> presets = Collections.emptyList();
        private volatile DeviceInfo info = new DeviceInfo("Monocle", "Fake PTZ", "1.0", "0000", null);
        private volatile Throwable initFailure = null;
        private volatile Throwable presetsFailure = null;
        private volatile Throwable commandFailure = null;
        private volatile boolean holdInit = false;
        private volatile boolean holdCommands = false;
        private final Logger logger;
        private final List<FakePtzDeviceConnector> produced = new CopyOnWriteArrayList<>();

        public FakePtzDeviceConnectorFactory() {
            this(new ConsoleLogger());
        }

        public FakePtzDeviceConnectorFactory(@Nonnull Logger logger) {
            this.logger = logger;
        }

        public FakePtzDeviceConnectorFactory ptzSupported(boolean ptzSupported) {
            this.ptzSupported = ptzSupported;
            return this;
        }

        public FakePtzDeviceConnectorFactory presets(Preset... presets) {
            this.presets = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(presets)));
            return this;
        }

        public FakePtzDeviceConnectorFactory info(@Nonnull DeviceInfo info) {
            this.info = info;
            return this;
        }

        public FakePtzDeviceConnectorFactory failInit(@Nullable Throwable cause) {
            this.initFailure = cause;
            return this;
        }

        public FakePtzDeviceConnectorFactory failPresets(@Nullable Throwable cause) {
            this.presetsFailure = cause;
            return this;
        }

        public FakePtzDeviceConnectorFactory failCommands(@Nullable Throwable cause) {
            this.commandFailure = cause;
            return this;
        }

        /**
         * Keep the init of the connectors produced from now on pending until
         * {@link FakePtzDeviceConnector#releaseInit()} is called.
         */
        public FakePtzDeviceConnectorFactory holdInit(boolean holdInit) {
            this.holdInit = holdInit;
            return this;
        }

        /**
         * Keep every command pending until {@link FakePtzDeviceConnector#releaseCommand()}
         * or {@link FakePtzDeviceConnector#failCommand(Throwable)} completes it.
         */
        public FakePtzDeviceConnectorFactory holdCommands(boolean holdCommands) {
            this.holdCommands = holdCommands;
            return this;
        }

        /**
         * @return all connectors produced so far, oldest first.
         */
        public List<FakePtzDeviceConnector> getProduced() {
            return produced;
        }

        /**
         * @return the most recently produced connector, or null.
         */
        @Nullable
        public FakePtzDeviceConnector last() {
            return produced.isEmpty() ? null : produced.get(produced.size() - 1);
        }

        @Nonnull
        @Override
        public PtzDeviceConnector produce(@Nonnull LoginParam loginParam) {
            final FakePtzDeviceConnector connector = new FakePtzDeviceConnector(loginParam, this);
            produced.add(connector);
            return connector;
        }
    }

    private final FakePtzDeviceConnectorFactory settings;
    private final Promise<DeviceInfo> initPromise = Promise.promise();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final List<Velocity> moves = new CopyOnWriteArrayList<>();
    private final Deque<Promise<Void>> held = new ConcurrentLinkedDeque<>();
    private volatile boolean closed = false;

    private FakePtzDeviceConnector(@Nonnull LoginParam loginParam,
                                   @Nonnull FakePtzDeviceConnectorFactory settings) {
        super(loginParam);
        this.settings = settings;
    }

    private Future<Void> command(String call) {
        calls.add(call);
        settings.logger.info("Fake device " + loginParam.serverID + ": " + call);
        if (settings.holdCommands) {
            final Promise<Void> promise = Promise.promise();
            held.add(promise);
            return promise.future();
        }
        return settings.commandFailure == null
                ? Future.succeededFuture()
                : Future.failedFuture(settings.commandFailure);
    }

    /**
     * Complete the oldest held command successfully.
     */
    public void releaseCommand() {
        final Promise<Void> promise = held.poll();
        if (promise == null) {
            throw new IllegalStateException("No command is held");
        }
        promise.complete();
    }

    /**
     * Fail the oldest held command.
     */
    public void failCommand(@Nonnull Throwable cause) {
        final Promise<Void> promise = held.poll();
        if (promise == null) {
            throw new IllegalStateException("No command is held");
        }
        promise.fail(cause);
    }

    /**
     * @return the number of commands received and not completed yet.
     */
    public int getHeldCommandCount() {
        return held.size();
    }

    @Override
    public Future<DeviceInfo> init() {
        calls.add("init");
        if (!settings.holdInit) {
            releaseInit();
        }
        return initPromise.future();
    }

    /**
     * Complete a held init with the settings of the factory.
     */
    public void releaseInit() {
        if (settings.initFailure != null) {
            initPromise.tryFail(settings.initFailure);
        } else {
            initPromise.tryComplete(settings.info);
        }
    }

    @Override
    public boolean isPtzSupported() {
        return settings.ptzSupported;
    }

    @Override
    public Future<List<Preset>> getPresets() {
        calls.add("getPresets");
        return settings.presetsFailure == null
                ? Future.succeededFuture(settings.presets)
                : Future.failedFuture(settings.presetsFailure);
    }

    @Override
    public Future<Void> continuousMove(@Nonnull Velocity velocity, int timeoutSeconds) {
        moves.add(velocity);
        return command("continuousMove " + velocity + " " + timeoutSeconds + "s");
    }

    @Override
    public Future<Void> gotoPreset(@Nonnull String presetToken, @Nonnull Velocity speed) {
        return command("gotoPreset " + presetToken);
    }

    @Override
    public Future<Void> gotoHomePosition() {
        return command("gotoHomePosition");
    }

    @Override
    public Future<Void> stop() {
        return command("stop");
    }

    @Override
    public void close() {
        closed = true;
    }

    /**
     * @return every call received, in order, as a short description.
     */
    public List<String> getCalls() {
        return calls;
    }

    /**
     * @return the velocities of the continuous moves received, in order.
     */
    public List<Velocity> getMoves() {
        return moves;
    }

    public boolean isClosed() {
        return closed;
    }
}
