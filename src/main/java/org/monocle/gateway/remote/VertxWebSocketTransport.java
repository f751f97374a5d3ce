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

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.UpgradeRejectedException;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketConnectOptions;

import javax.annotation.Nonnull;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * A {@link RemoteTransport} over a Vert.x WebSocket client. A rejected
 * upgrade with HTTP 401 fails the open with a
 * {@link RemoteAuthenticationException}. A close requested while the
 * handshake is in progress closes the socket as soon as it is produced.
 */
public class VertxWebSocketTransport implements RemoteTransport {

    private static final int ABNORMAL_CLOSURE = 1006;

    private final WebSocketClient client;
    private volatile WebSocket webSocket = null;

    /* Guarded by this. */
    private boolean connecting = false;
    private Integer abortCode = null;

    public VertxWebSocketTransport(@Nonnull Vertx vertx) {
        this.client = vertx.createWebSocketClient();
    }

    static WebSocketConnectOptions connectOptions(@Nonnull String uri, @Nonnull String token)
            throws URISyntaxException {
        final URI parsed = new URI(uri);
        final boolean ssl = "wss".equalsIgnoreCase(parsed.getScheme())
                || "https".equalsIgnoreCase(parsed.getScheme());
        if (parsed.getHost() == null) {
            throw new URISyntaxException(uri, "No host in remote API URI");
        }
        final int port = parsed.getPort() > 0 ? parsed.getPort() : (ssl ? 443 : 80);
        String path = parsed.getRawPath() == null || parsed.getRawPath().isEmpty() ? "/" : parsed.getRawPath();
        if (parsed.getRawQuery() != null) {
            path += "?" + parsed.getRawQuery();
        }
        return new WebSocketConnectOptions()
                .setHost(parsed.getHost())
                .setPort(port)
                .setSsl(ssl)
                .setURI(path)
                .addHeader(HttpHeaders.AUTHORIZATION.toString(), "Bearer " + token);
    }

    @Nonnull
    @Override
    public Future<Void> open(@Nonnull String uri, @Nonnull String token, @Nonnull Listener listener) {
        final WebSocketConnectOptions options;
        try {
            options = connectOptions(uri, token);
        } catch (URISyntaxException e) {
            return Future.failedFuture(e);
        }
        synchronized (this) {
            connecting = true;
            abortCode = null;
        }
        return client.connect(options)
                .recover(err -> {
                    synchronized (this) {
                        connecting = false;
                        abortCode = null;
                    }
                    if (err instanceof UpgradeRejectedException
                            && ((UpgradeRejectedException) err).getStatus() == 401) {
                        return Future.failedFuture(new RemoteAuthenticationException(
                                "Remote API rejected the API token (HTTP 401)", err));
                    }
                    return Future.failedFuture(err);
                })
                .map(ws -> {
                    final Integer aborted;
                    synchronized (this) {
                        connecting = false;
                        aborted = abortCode;
                        abortCode = null;
                        if (aborted == null) {
                            webSocket = ws;
                        }
                    }
                    if (aborted != null) {
                        ws.close(aborted.shortValue());
                        listener.onClose(aborted);
                        return null;
                    }
                    ws.textMessageHandler(listener::onMessage);
                    ws.exceptionHandler(listener::onError);
                    ws.closeHandler(v -> {
                        if (webSocket == ws) {
                            webSocket = null;
                        }
                        final Short code = ws.closeStatusCode();
                        listener.onClose(code == null ? ABNORMAL_CLOSURE : code);
                    });
                    listener.onOpen();
                    return null;
                });
    }

    @Override
    public boolean isOpen() {
        final WebSocket ws = webSocket;
        return ws != null && !ws.isClosed();
    }

    @Override
    public void send(@Nonnull String text) {
        final WebSocket ws = webSocket;
        if (ws != null) {
            ws.writeTextMessage(text);
        }
    }

    @Override
    public void close(int code) {
        final WebSocket ws;
        synchronized (this) {
            ws = webSocket;
            if (ws == null && connecting) {
                abortCode = code;
                return;
            }
        }
        if (ws != null) {
            ws.close((short) code);
        }
    }
}
