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

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import io.vertx.core.Future;
import org.monocle.gateway.entities.CameraDescriptor;
import org.monocle.gateway.entities.CameraState;
import org.monocle.gateway.ptz.CameraSession;
import org.monocle.gateway.ptz.InitializationSupersededException;
import org.monocle.gateway.remote.RemoteSessionClient;
import org.monocle.gateway.remote.RemoteSessionListener;
import org.monocle.gateway.util.logging.Logger;
import org.monocle.gateway.web.ControlListener;
import org.monocle.gateway.web.LocalControlServer;

import javax.annotation.Nonnull;

/**
 * The GatewayController class wires the gateway together. Camera sources
 * pushed by the remote API are initialized in the camera session and their
 * state is published to the local controllers; commands of the local
 * controllers are carried out by the camera session.
 */
public class GatewayController {

    /**
     * Remote channel announcing the camera to control.
     */
    public static final String SOURCE_CHANNEL = "alexa.source";

    private final CameraSession session;
    private final RemoteSessionClient remote;
    private final LocalControlServer server;
    private final Logger logger;

    public GatewayController(@Nonnull CameraSession session,
                             @Nonnull RemoteSessionClient remote,
                             @Nonnull LocalControlServer server,
                             @Nonnull Logger logger) {
        this.session = session;
        this.remote = remote;
        this.server = server;
        this.logger = logger;

        remote.addListener(new RemoteSessionListener() {
            @Override
            public void onConnected() {
                remote.subscribe(SOURCE_CHANNEL);
            }
        });
        remote.on(SOURCE_CHANNEL, this::onSource);
        server.addListener(new Commands());
    }

    /**
     * Start serving local controllers, then connect to the remote API.
     *
     * @return Future of the port the local control server listens on.
     */
    @Nonnull
    public Future<Integer> start() {
        return server.listen().map(port -> {
            remote.start();
            return port;
        });
    }

    /**
     * Disconnect from the remote API, stop serving local controllers and drop
     * the camera.
     */
    @Nonnull
    public Future<Void> stop() {
        remote.stop();
        session.close();
        return server.close();
    }

    /**
     * Take control of a camera source announced by the remote API.
     */
    void onSource(@Nonnull JsonElement payload) {
        final CameraDescriptor descriptor;
        try {
            descriptor = CameraDescriptor.fromJson(payload);
        } catch (JsonParseException e) {
            logger.error("Ignoring unreadable camera source: " + e.getMessage());
            return;
        }
        logger.info("Received camera source " + descriptor);
        session.initialize(descriptor).onComplete(ar -> {
            if (ar.succeeded()) {
                server.publish(ar.result());
            } else if (ar.cause() instanceof InitializationSupersededException) {
                logger.debug(ar.cause().getMessage());
            } else {
                server.publish(CameraState.failed(descriptor, ar.cause().getMessage()));
            }
        });
    }

    private void report(String controller, String action, Future<Void> outcome) {
        outcome.onComplete(ar -> {
            if (ar.succeeded()) {
                logger.info("Controller " + controller + ": " + action);
            } else {
                logger.warn("Controller " + controller + ": " + ar.cause().getMessage());
            }
        });
    }

    private class Commands implements ControlListener {
        @Override
        public void onStop(@Nonnull String controller) {
            report(controller, "camera stopped", session.stop());
        }

        @Override
        public void onHome(@Nonnull String controller) {
            report(controller, "camera moved home", session.gotoHome());
        }

        @Override
        public void onPreset(@Nonnull String controller, @Nonnull String token) {
            report(controller, "camera moved to preset " + token, session.gotoPreset(token));
        }

        @Override
        public void onPtz(@Nonnull String controller, int pan, int tilt, int zoom) {
            report(controller, "camera moving (pan " + pan + ", tilt " + tilt + ", zoom " + zoom + ")",
                    session.ptz(pan, tilt, zoom));
        }

        @Override
        public void onPan(@Nonnull String controller, int pan) {
            report(controller, "camera panning " + pan, session.pan(pan));
        }

        @Override
        public void onTilt(@Nonnull String controller, int tilt) {
            report(controller, "camera tilting " + tilt, session.tilt(tilt));
        }

        @Override
        public void onZoom(@Nonnull String controller, int zoom) {
            report(controller, "camera zooming " + zoom, session.zoom(zoom));
        }
    }
}
