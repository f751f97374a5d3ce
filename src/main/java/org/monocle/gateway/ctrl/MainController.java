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
import io.vertx.core.Vertx;
import org.apache.commons.cli.ParseException;
import org.monocle.gateway.data.PtzDeviceConnector;
import org.monocle.gateway.data.onvif.OnvifDeviceConnector;
import org.monocle.gateway.debug.FakePtzDeviceConnector;
import org.monocle.gateway.entities.Preset;
import org.monocle.gateway.ptz.CameraSession;
import org.monocle.gateway.remote.RemoteSessionClient;
import org.monocle.gateway.remote.VertxWebSocketTransport;
import org.monocle.gateway.util.logging.ConsoleLogger;
import org.monocle.gateway.util.logging.Logger;
import org.monocle.gateway.util.logging.SynthesizedLogger;
import org.monocle.gateway.web.LocalControlServer;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The MainController class provides an entrance to run the gateway.
 */
public class MainController {

    private static final long SHUTDOWN_TIMEOUT_MS = 5000;

    public static void main(String[] args) {
        // Analyze the command line and store the options into a property center.
        final GatewayPropertyCenter propCenter;
        try {
            propCenter = new GatewayPropertyCenter(args);
        } catch (ParseException | IOException | IllegalArgumentException e) {
            final Logger logger = new ConsoleLogger();
            logger.fatal(e.getMessage());
            logger.fatal("Try using '-h' for more information.");
            System.exit(1);
            return;
        }
        if (propCenter.helpRequested) {
            System.out.print(GatewayPropertyCenter.getHelp());
            return;
        }

        final Logger logger = new SynthesizedLogger("MonocleGateway", propCenter);
        logger.info("*********************************************************************");
        logger.info("Monocle Gateway");
        logger.info("Configuration: " + propCenter.configFilePath);
        logger.info("*********************************************************************");

        final Vertx vertx = Vertx.vertx();

        final PtzDeviceConnector.Factory connectorFactory;
        if (propCenter.fakeDevice) {
            logger.warn("Controlling an in-memory fake device; no camera will move.");
            connectorFactory = new FakePtzDeviceConnector.FakePtzDeviceConnectorFactory(
                    new SynthesizedLogger("FakeDevice", propCenter))
                    .presets(new Preset("1", "Door"), new Preset("2", "Window"));
        } else {
            connectorFactory = OnvifDeviceConnector.factory(vertx, propCenter.deviceRequestTimeout,
                    new SynthesizedLogger("OnvifDevice", propCenter));
        }

        final CameraSession session = new CameraSession(connectorFactory, propCenter,
                new SynthesizedLogger("CameraSession", propCenter));
        final RemoteSessionClient remote = new RemoteSessionClient(vertx,
                new VertxWebSocketTransport(vertx),
                propCenter.apiUri,
                propCenter.apiToken,
                propCenter.reconnectInterval,
                new SynthesizedLogger("RemoteSession", propCenter));
        final LocalControlServer server = new LocalControlServer(vertx, propCenter.port,
                new SynthesizedLogger("LocalControlServer", propCenter));
        final GatewayController controller = new GatewayController(session, remote, server, logger);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down...");
            awaitShutdown(controller.stop().compose(v -> vertx.close()), SHUTDOWN_TIMEOUT_MS, logger);
        }, "gateway-shutdown"));

        controller.start().onFailure(err -> {
            logger.fatal("Unable to start the gateway: " + err.getMessage(), err);
            System.exit(1);
        });
    }

    /**
     * Block until the shutdown sequence completes or the timeout elapses.
     */
    static void awaitShutdown(@Nonnull Future<?> shutdown, long timeoutMs, @Nonnull Logger logger) {
        try {
            shutdown.toCompletionStage().toCompletableFuture().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            logger.warn("Interrupted while shutting down the gateway");
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Gateway did not shut down cleanly: " + e);
        }
    }
}
