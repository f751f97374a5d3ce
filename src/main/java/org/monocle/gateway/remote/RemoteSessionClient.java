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

package org.monocle.gateway.remote;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.vertx.core.Vertx;
import org.monocle.gateway.util.logging.Logger;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * The RemoteSessionClient class keeps an authenticated session with the
 * remote API. Inbound JSON objects are delivered whole to the listeners, then
 * key by key to the handler registered for each key. Unless the session was
 * stopped, any close of the connection is followed by a new connection attempt
 * after a fixed interval.
 */
public class RemoteSessionClient {

    /**
     * Close code used when the gateway itself ends the session.
     */
    public static final int CLOSED_BY_CONSUMER = 4000;

    private static final int ABNORMAL_CLOSURE = 1006;

    private final Vertx vertx;
    private final RemoteTransport transport;
    private final String uri;
    private final String token;
    private final long reconnectInterval;
    private final Logger logger;
    private final Gson gson = new Gson();

    private final List<RemoteSessionListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, Consumer<JsonElement>> handlers = new ConcurrentHashMap<>();
    private volatile BiConsumer<String, JsonElement> unhandled;

    /* Guarded by this. */
    private boolean stopped = true;
    private Long reconnectTimer = null;

    /**
     * Create a remote session client.
     *
     * @param vertx             Vert.x instance used for the reconnect timer.
     * @param transport         channel to the remote API.
     * @param uri               address of the remote API.
     * @param token             API token sent as bearer credentials.
     * @param reconnectInterval delay between a close and the next attempt, in milliseconds.
     * @param logger            logger of the client.
     */
    public RemoteSessionClient(@Nonnull Vertx vertx,
                               @Nonnull RemoteTransport transport,
                               @Nonnull String uri,
                               @Nonnull String token,
                               long reconnectInterval,
                               @Nonnull Logger logger) {
        this.vertx = vertx;
        this.transport = transport;
        this.uri = uri;
        this.token = token;
        this.reconnectInterval = reconnectInterval;
        this.logger = logger;
        this.unhandled = (key, value) -> logger.debug("No handler for remote event \"" + key + "\"");
    }

    public void addListener(@Nonnull RemoteSessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(@Nonnull RemoteSessionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Register the handler of a top-level message key. A later registration
     * for the same key replaces the earlier one.
     */
    public void on(@Nonnull String key, @Nonnull Consumer<JsonElement> handler) {
        handlers.put(key, handler);
    }

    /**
     * Set the handler of the keys no handler was registered for.
     */
    public void onUnhandled(@Nonnull BiConsumer<String, JsonElement> handler) {
        this.unhandled = handler;
    }

    private void emit(Consumer<RemoteSessionListener> event) {
        for (RemoteSessionListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                logger.error("Remote session listener failed", e);
            }
        }
    }

    public boolean isConnected() {
        return transport.isOpen();
    }

    /**
     * Connect to the remote API.
     */
    public void start() {
        synchronized (this) {
            stopped = false;
            cancelReconnect();
        }
        emit(RemoteSessionListener::onStarting);
        if (transport.isOpen()) {
            logger.debug("Remote session already connected");
            return;
        }
        logger.info("Connecting to " + uri);
        emit(RemoteSessionListener::onConnecting);
        transport.open(uri, token, new RemoteTransport.Listener() {
            @Override
            public void onOpen() {
                final boolean late;
                synchronized (RemoteSessionClient.this) {
                    late = stopped;
                }
                if (late) {
                    logger.debug("Connection to " + uri + " opened after stop; closing it");
                    transport.close(CLOSED_BY_CONSUMER);
                    return;
                }
                logger.info("Connected to " + uri);
                emit(RemoteSessionListener::onConnected);
            }

            @Override
            public void onMessage(@Nonnull String text) {
                dispatch(text);
            }

            @Override
            public void onError(@Nonnull Throwable cause) {
                reportError(cause);
            }

            @Override
            public void onClose(int code) {
                closed(code);
            }
        }).onFailure(err -> {
            reportError(err);
            closed(ABNORMAL_CLOSURE);
        });
    }

    /**
     * End the session. No reconnection follows.
     */
    public void stop() {
        synchronized (this) {
            stopped = true;
            cancelReconnect();
        }
        logger.info("Disconnecting from " + uri);
        emit(RemoteSessionListener::onStopping);
        transport.close(CLOSED_BY_CONSUMER);
    }

    private synchronized void cancelReconnect() {
        if (reconnectTimer != null) {
            vertx.cancelTimer(reconnectTimer);
            reconnectTimer = null;
        }
    }

    private void reportError(Throwable cause) {
        if (cause instanceof RemoteAuthenticationException) {
            logger.error("Authentication with the remote API failed; check the API token: "
                    + cause.getMessage());
        } else {
            logger.error("Remote session error: " + cause.getMessage(), cause);
        }
        emit(listener -> listener.onError(cause));
    }

    private void closed(int code) {
        logger.info("Remote session closed (" + code + ")");
        emit(listener -> listener.onClosed(code));
        synchronized (this) {
            if (stopped || code == CLOSED_BY_CONSUMER) {
                return;
            }
            cancelReconnect();
            reconnectTimer = vertx.setTimer(reconnectInterval, id -> {
                synchronized (this) {
                    reconnectTimer = null;
                }
                start();
            });
        }
        logger.info("Reconnecting to " + uri + " in " + reconnectInterval + " ms");
        emit(listener -> listener.onReconnecting(reconnectInterval));
    }

    private void dispatch(String text) {
        final JsonObject data;
        try {
            final JsonElement element = JsonParser.parseString(text);
            if (!element.isJsonObject()) {
                throw new JsonParseException("Expected a JSON object");
            }
            data = element.getAsJsonObject();
        } catch (JsonParseException e) {
            reportError(new JsonParseException("Unreadable remote message: " + text, e));
            return;
        }
        logger.debug("Remote message: " + text);
        emit(listener -> listener.onData(data));
        for (Map.Entry<String, JsonElement> entry : data.entrySet()) {
            final Consumer<JsonElement> handler = handlers.get(entry.getKey());
            try {
                if (handler != null) {
                    handler.accept(entry.getValue());
                } else {
                    unhandled.accept(entry.getKey(), entry.getValue());
                }
            } catch (RuntimeException e) {
                logger.error("Handler of remote event \"" + entry.getKey() + "\" failed", e);
            }
        }
    }

    /**
     * Send a request to the remote API, serialized as JSON.
     *
     * @return whether the request was transmitted. Nothing is queued while
     * the connection is down.
     */
    public boolean send(@Nonnull Object request) {
        if (!transport.isOpen()) {
            logger.debug("Remote session not connected; dropping request");
            return false;
        }
        final String text = request instanceof JsonElement
                ? gson.toJson((JsonElement) request)
                : gson.toJson(request);
        transport.send(text);
        return true;
    }

    /**
     * Subscribe to remote event channels.
     */
    public boolean subscribe(@Nonnull String... ids) {
        final JsonObject request = new JsonObject();
        if (ids.length == 1) {
            request.add("sub", new JsonPrimitive(ids[0]));
        } else {
            final JsonArray array = new JsonArray();
            for (String id : ids) {
                array.add(id);
            }
            request.add("sub", array);
        }
        return send(request);
    }
}
