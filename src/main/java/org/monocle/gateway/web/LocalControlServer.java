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

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.ServerWebSocket;
import org.monocle.gateway.entities.CameraState;
import org.monocle.gateway.util.logging.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * The LocalControlServer class accepts WebSocket connections from controllers
 * on the local network. It turns their text commands into
 * {@link ControlListener} notifications, and pushes the state of the active
 * camera to them as <code>{"source": state}</code>. A controller connecting
 * after a state was published receives that state first.
 */
public class LocalControlServer {

    public static final int DEFAULT_PORT = 8080;

    private final int port;
    private final Logger logger;
    private final HttpServer server;
    private final Gson gson = new Gson();

    private final List<ControlListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, ServerWebSocket> controllers = new ConcurrentHashMap<>();
    /* Orders the initial state of a new controller with the broadcasts of publish. */
    private final Object publishLock = new Object();
    private volatile CameraState published = null;

    /**
     * Create a server.
     *
     * @param vertx  Vert.x instance to run the server on.
     * @param port   port to listen on; 0 picks a free port.
     * @param logger logger of the server.
     */
    public LocalControlServer(@Nonnull Vertx vertx, int port, @Nonnull Logger logger) {
        this.port = port;
        this.logger = logger;
        this.server = vertx.createHttpServer();
        server.webSocketHandler(this::accept);
    }

    public void addListener(@Nonnull ControlListener listener) {
        listeners.add(listener);
    }

    public void removeListener(@Nonnull ControlListener listener) {
        listeners.remove(listener);
    }

    private void emit(Consumer<ControlListener> event) {
        for (ControlListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.error("Control listener failed", e);
            }
        }
    }

    private void accept(ServerWebSocket ws) {
        final String controller = ws.remoteAddress().host() + ":" + ws.remoteAddress().port();
        logger.info("Controller " + controller + " connected");

        ws.textMessageHandler(text -> receive(controller, text));
        ws.exceptionHandler(err -> {
            logger.warn("Connection error with controller " + controller + ": " + err.getMessage());
            emit(listener -> listener.onError(controller, err));
        });
        ws.closeHandler(v -> {
            controllers.remove(controller, ws);
            logger.info("Controller " + controller + " disconnected");
            emit(listener -> listener.onDisconnected(controller));
        });

        emit(listener -> listener.onConnected(controller));
        synchronized (publishLock) {
            controllers.put(controller, ws);
            final CameraState state = published;
            if (state != null) {
                ws.writeTextMessage(sourceMessage(state));
            }
        }
    }

    private void receive(String controller, String text) {
        final ControlIntent intent;
        try {
            intent = ControlCommandParser.parse(text);
        } catch (MalformedCommandException e) {
            logger.warn("Controller " + controller + ": " + e.getMessage());
            emit(listener -> listener.onError(controller, e));
            return;
        }
        logger.debug("Controller " + controller + " requested " + intent);
        switch (intent.getType()) {
            case STOP:
                emit(listener -> listener.onStop(controller));
                break;
            case HOME:
                emit(listener -> listener.onHome(controller));
                break;
            case PRESET:
                emit(listener -> listener.onPreset(controller, intent.getPreset()));
                break;
            case PTZ:
                emit(listener -> listener.onPtz(controller, intent.getPan(), intent.getTilt(), intent.getZoom()));
                break;
            case PAN:
                emit(listener -> listener.onPan(controller, intent.getPan()));
                break;
            case TILT:
                emit(listener -> listener.onTilt(controller, intent.getTilt()));
                break;
            case ZOOM:
                emit(listener -> listener.onZoom(controller, intent.getZoom()));
                break;
        }
    }

    private String sourceMessage(CameraState state) {
        final JsonObject message = new JsonObject();
        message.add("source", state.toDTO());
        return gson.toJson(message);
    }

    /**
     * Replace the published camera state and push it to all controllers.
     */
    public void publish(@Nonnull CameraState state) {
        final String text = sourceMessage(state);
        synchronized (publishLock) {
            published = state;
            broadcastText(text);
        }
    }

    @Nullable
    public CameraState getPublished() {
        return published;
    }

    /**
     * Send a JSON object to all connected controllers.
     */
    public void broadcast(@Nonnull JsonObject message) {
        broadcastText(gson.toJson(message));
    }

    private void broadcastText(String text) {
        for (Map.Entry<String, ServerWebSocket> entry : controllers.entrySet()) {
            entry.getValue().writeTextMessage(text).onFailure(err ->
                    logger.warn("Unable to send to controller " + entry.getKey() + ": " + err.getMessage()));
        }
    }

    /**
     * @return the number of connected controllers.
     */
    public int getControllerCount() {
        return controllers.size();
    }

    /**
     * Start listening.
     *
     * @return Future of the port actually listened on.
     */
    @Nonnull
    public Future<Integer> listen() {
        return server.listen(port)
                .map(s -> {
                    logger.info("Local control server listening on port " + s.actualPort());
                    return s.actualPort();
                });
    }

    /**
     * Stop listening and drop all controllers.
     */
    @Nonnull
    public Future<Void> close() {
        controllers.clear();
        return server.close();
    }
}
