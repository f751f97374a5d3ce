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
import org.apache.commons.lang3.StringUtils;
import org.monocle.gateway.common.LoginParam;
import org.monocle.gateway.common.ServerID;
import org.monocle.gateway.ctrl.GatewayPropertyCenter;
import org.monocle.gateway.data.PtzDeviceConnector;
import org.monocle.gateway.data.Velocity;
import org.monocle.gateway.entities.CameraDescriptor;
import org.monocle.gateway.entities.CameraState;
import org.monocle.gateway.entities.DeviceInfo;
import org.monocle.gateway.entities.Preset;
import org.monocle.gateway.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * The CameraSession class owns the camera currently under control. It
 * initializes a device connection for a camera descriptor, detects the PTZ
 * capability, caches the presets of the camera, and translates control
 * commands into device operations.
 * <p>
 * Every command checks, at the moment it runs, that the session is initialized
 * and that the camera supports PTZ. Commands are executed one at a time. An
 * initialization always starts over, and the result of an initialization that
 * was overtaken by a newer one is dropped.
 */
public class CameraSession {

    /**
     * Idle timeout (seconds) after which the device stops a continuous move.
     */
    public static final int CONTINUOUS_MOVE_TIMEOUT = 10;

    private final PtzDeviceConnector.Factory connectorFactory;
    private final SpeedQuantizer quantizer;
    private final String defaultUsername;
    private final String defaultPassword;
    private final Logger logger;

    private final List<CameraSessionListener> listeners = new CopyOnWriteArrayList<>();
    private final CommandQueue commandQueue = new CommandQueue();

    /* Session state. Guarded by this. */
    private long generation = 0;
    private boolean initialized = false;
    private SessionState state = SessionState.UNINITIALIZED;
    private PtzDeviceConnector device = null;
    private CameraState activeCamera = null;

    /**
     * Create a camera session.
     *
     * @param connectorFactory produces device connectors.
     * @param quantizer        maps speed levels to velocities.
     * @param defaultUsername  username used when a descriptor carries none.
     * @param defaultPassword  password used when a descriptor carries none.
     * @param logger           logger of the session.
     */
    public CameraSession(@Nonnull PtzDeviceConnector.Factory connectorFactory,
                         @Nonnull SpeedQuantizer quantizer,
                         @Nullable String defaultUsername,
                         @Nullable String defaultPassword,
                         @Nonnull Logger logger) {
        this.connectorFactory = connectorFactory;
        this.quantizer = quantizer;
        this.defaultUsername = defaultUsername;
        this.defaultPassword = defaultPassword;
        this.logger = logger;
    }

    public CameraSession(@Nonnull PtzDeviceConnector.Factory connectorFactory,
                         @Nonnull GatewayPropertyCenter propCenter,
                         @Nonnull Logger logger) {
        this(connectorFactory, new SpeedQuantizer(),
                propCenter.deviceUsername, propCenter.devicePassword, logger);
    }

    public void addListener(@Nonnull CameraSessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(@Nonnull CameraSessionListener listener) {
        listeners.remove(listener);
    }

    private void emit(Consumer<CameraSessionListener> event) {
        for (CameraSessionListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.error("Camera session listener failed", e);
            }
        }
    }

    /**
     * @return the initialization status of the active camera.
     */
    public synchronized boolean isInitialized() {
        return initialized;
    }

    /**
     * @return the PTZ supported status of the active camera.
     */
    public synchronized boolean isPtzSupported() {
        return activeCamera != null && activeCamera.isPtz();
    }

    @Nonnull
    public synchronized SessionState getState() {
        return state;
    }

    @Nullable
    public synchronized CameraState getActiveCamera() {
        return activeCamera;
    }

    private synchronized boolean isCurrent(long myGeneration) {
        return myGeneration == generation;
    }

    private LoginParam loginParamOf(CameraDescriptor descriptor) throws Exception {
        if (descriptor.getUri() == null) {
            throw new IllegalArgumentException("Camera source has no URI");
        }
        final ServerID serverID = ServerID.fromUri(descriptor.getUri());
        if (StringUtils.isNotEmpty(descriptor.getUsername())) {
            return new LoginParam(serverID, descriptor.getUsername(), descriptor.getPassword());
        }
        return new LoginParam(serverID, defaultUsername, defaultPassword);
    }

    /**
     * Initialize the camera to control. Any previous device connection is
     * dropped immediately.
     *
     * @param descriptor camera source to control.
     * @return Future of the new camera state. Fails with
     * {@link DeviceConnectionException} when the device cannot be initialized,
     * or with {@link InitializationSupersededException} when a newer
     * initialization started in the meantime.
     */
    @Nonnull
    public Future<CameraState> initialize(@Nonnull CameraDescriptor descriptor) {
        final long myGeneration;
        final PtzDeviceConnector previous;
        synchronized (this) {
            myGeneration = ++generation;
            previous = device;
            device = null;
            activeCamera = null;
            initialized = false;
            state = SessionState.INITIALIZING;
        }
        if (previous != null) {
            previous.close();
        }
        logger.debug("Initializing camera " + descriptor + " (generation " + myGeneration + ")");
        emit(listener -> listener.onUninitialized(descriptor));

        final PtzDeviceConnector connector;
        try {
            connector = connectorFactory.produce(loginParamOf(descriptor));
        } catch (Exception e) {
            return Future.failedFuture(connectionFailed(myGeneration, descriptor, e));
        }

        final Promise<CameraState> promise = Promise.promise();
        connector.init()
                .compose(info -> interrogate(myGeneration, descriptor, connector, info))
                .onComplete(ar -> {
                    if (ar.succeeded()) {
                        final CameraState camera = ar.result();
                        boolean superseded;
                        synchronized (this) {
                            superseded = myGeneration != generation;
                            if (!superseded) {
                                device = connector;
                                activeCamera = camera;
                                initialized = true;
                                state = camera.isPtz() ? SessionState.READY_PTZ : SessionState.READY_NO_PTZ;
                            }
                        }
                        if (superseded) {
                            connector.close();
                            promise.fail(new InitializationSupersededException(descriptor));
                        } else {
                            logger.info("Camera " + camera.getName() + " initialized; PTZ "
                                    + (camera.isPtz() ? "supported with " + camera.getPresets().size() + " presets"
                                    : "not supported"));
                            promise.complete(camera);
                        }
                    } else {
                        connector.close();
                        if (ar.cause() instanceof InitializationSupersededException) {
                            promise.fail(ar.cause());
                        } else if (!isCurrent(myGeneration)) {
                            logger.debug("Dropping failure of superseded initialization: " + ar.cause());
                            promise.fail(new InitializationSupersededException(descriptor));
                        } else {
                            promise.fail(connectionFailed(myGeneration, descriptor, ar.cause()));
                        }
                    }
                });
        return promise.future();
    }

    private Future<CameraState> interrogate(long myGeneration,
                                            CameraDescriptor descriptor,
                                            PtzDeviceConnector connector,
                                            DeviceInfo info) {
        if (!isCurrent(myGeneration)) {
            return Future.failedFuture(new InitializationSupersededException(descriptor));
        }
        emit(listener -> listener.onInitialized(info));
        if (!connector.isPtzSupported()) {
            return Future.succeededFuture(CameraState.initialized(descriptor, info, false, Collections.emptyList()));
        }
        return connector.getPresets()
                .recover(err -> {
                    final DeviceCommandException error =
                            new DeviceCommandException("Unable to retrieve camera presets", err);
                    logger.warn(error.getMessage() + "; continuing without presets", err);
                    emit(listener -> listener.onError(error));
                    return Future.succeededFuture(Collections.emptyList());
                })
                .map(presets -> CameraState.initialized(descriptor, info, true, presets));
    }

    private DeviceConnectionException connectionFailed(long myGeneration,
                                                       CameraDescriptor descriptor,
                                                       Throwable cause) {
        synchronized (this) {
            if (myGeneration == generation) {
                state = SessionState.FAILED;
            }
        }
        final DeviceConnectionException error = new DeviceConnectionException(descriptor, cause);
        logger.error(error.getMessage(), cause);
        emit(listener -> listener.onError(error));
        return error;
    }

    /**
     * Run a device command once the commands before it are done.
     *
     * @param action    description of the command, used in error messages.
     * @param command   operation to perform on the device, given the active camera.
     * @param onSuccess notification to emit once the device accepted the command.
     */
    private Future<Void> execute(String action,
                                 CommandFunction command,
                                 Runnable onSuccess) {
        return commandQueue.submit(() -> {
            final PtzDeviceConnector connector;
            final CameraState camera;
            synchronized (this) {
                connector = device;
                camera = activeCamera;
                if (!initialized || connector == null) {
                    return reject(new NotReadyException(
                            "Unable to " + action + "; the camera is not initialized."));
                }
                if (camera == null || !camera.isPtz()) {
                    return reject(new PtzUnsupportedException(
                            "Unable to " + action + "; the camera does not support PTZ."));
                }
            }
            final Future<Void> sent;
            try {
                sent = command.apply(connector, camera);
            } catch (InvalidPresetException e) {
                return reject(e);
            }
            return sent.transform(ar -> {
                if (ar.succeeded()) {
                    onSuccess.run();
                    return Future.<Void>succeededFuture();
                }
                return reject(new DeviceCommandException(
                        "Unable to " + action + "; " + ar.cause().getMessage(), ar.cause()));
            });
        });
    }

    @FunctionalInterface
    private interface CommandFunction {
        Future<Void> apply(PtzDeviceConnector connector, CameraState camera) throws InvalidPresetException;
    }

    private Future<Void> reject(CameraControlException error) {
        logger.debug(error.getMessage());
        emit(listener -> listener.onError(error));
        return Future.failedFuture(error);
    }

    /**
     * Stop all movement on the camera immediately.
     */
    @Nonnull
    public Future<Void> stop() {
        return execute("stop camera movement",
                (connector, camera) -> connector.stop(),
                () -> emit(CameraSessionListener::onStop));
    }

    /**
     * Move the camera to its preconfigured HOME position.
     */
    @Nonnull
    public Future<Void> gotoHome() {
        return execute("recall camera home",
                (connector, camera) -> connector.gotoHomePosition(),
                () -> emit(CameraSessionListener::onHome));
    }

    /**
     * Move the camera to a preconfigured preset.
     *
     * @param token token of the preset, or "#n" for the n-th cached preset
     *              (counting from 0).
     */
    @Nonnull
    public Future<Void> gotoPreset(@Nonnull String token) {
        final AtomicReference<String> resolved = new AtomicReference<>(token);
        return execute("recall camera preset",
                (connector, camera) -> {
                    resolved.set(resolvePreset(token, camera.getPresets()));
                    return connector.gotoPreset(resolved.get(), Velocity.FULL_SPEED);
                },
                () -> emit(listener -> listener.onPreset(resolved.get())));
    }

    /**
     * Turn a preset reference into a device token.
     *
     * @param token   raw token, or "#n".
     * @param presets presets cached at initialization.
     * @return the token to send to the device.
     * @throws InvalidPresetException if an index does not point into the cache.
     */
    static String resolvePreset(@Nonnull String token, @Nonnull List<Preset> presets)
            throws InvalidPresetException {
        if (!token.startsWith("#")) {
            return token;
        }
        final int index;
        try {
            index = Integer.parseInt(token.substring(1).trim());
        } catch (NumberFormatException e) {
            throw new InvalidPresetException(token,
                    "Unable to recall camera preset; invalid preset index: " + token);
        }
        if (index < 0 || index >= presets.size()) {
            throw new InvalidPresetException(token,
                    "Unable to recall camera preset; invalid preset index: " + token);
        }
        return presets.get(index).getToken();
    }

    /**
     * Pan the camera left or right.
     *
     * @param level value between -3 and +3 (negative is left; positive is right).
     */
    @Nonnull
    public Future<Void> pan(int level) {
        final double pan = quantizer.quantize(Axis.PAN, level);
        return move("pan camera", new Velocity(pan, 0, 0), () -> emit(listener -> listener.onPan(pan)));
    }

    /**
     * Tilt the camera up or down.
     *
     * @param level value between -3 and +3 (negative is down; positive is up).
     */
    @Nonnull
    public Future<Void> tilt(int level) {
        final double tilt = quantizer.quantize(Axis.TILT, level);
        return move("tilt camera", new Velocity(0, tilt, 0), () -> emit(listener -> listener.onTilt(tilt)));
    }

    /**
     * Zoom the camera in or out.
     *
     * @param level value between -3 and +3 (negative is out; positive is in).
     */
    @Nonnull
    public Future<Void> zoom(int level) {
        final double zoom = quantizer.quantize(Axis.ZOOM, level);
        return move("zoom camera", new Velocity(0, 0, zoom), () -> emit(listener -> listener.onZoom(zoom)));
    }

    /**
     * Move the camera on its three axes at once.
     */
    @Nonnull
    public Future<Void> ptz(int panLevel, int tiltLevel, int zoomLevel) {
        final double pan = quantizer.quantize(Axis.PAN, panLevel);
        final double tilt = quantizer.quantize(Axis.TILT, tiltLevel);
        final double zoom = quantizer.quantize(Axis.ZOOM, zoomLevel);
        return move("move camera", new Velocity(pan, tilt, zoom),
                () -> emit(listener -> listener.onPtz(pan, tilt, zoom)));
    }

    private Future<Void> move(String action, Velocity velocity, Runnable onSuccess) {
        return execute(action,
                (connector, camera) -> connector.continuousMove(velocity, CONTINUOUS_MOVE_TIMEOUT),
                onSuccess);
    }

    /**
     * Drop the device connection. The session goes back to uninitialized.
     */
    public void close() {
        final PtzDeviceConnector previous;
        synchronized (this) {
            ++generation;
            previous = device;
            device = null;
            activeCamera = null;
            initialized = false;
            state = SessionState.UNINITIALIZED;
        }
        if (previous != null) {
            previous.close();
        }
    }
}
