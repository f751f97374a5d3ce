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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.vertx.core.Vertx;
import org.apache.log4j.Level;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.monocle.gateway.util.logging.ConsoleLogger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class RemoteSessionClientTest {

    private static final long INTERVAL = 50;

    private Vertx vertx;
    private FakeRemoteTransport transport;
    private RemoteSessionClient client;
    private final List<String> events = new CopyOnWriteArrayList<>();

    @Before
    public void setUp() {
        vertx = Vertx.vertx();
        transport = new FakeRemoteTransport();
        client = new RemoteSessionClient(vertx, transport, "wss://api.example.test/v1", "secret-token",
                INTERVAL, new ConsoleLogger(Level.OFF));
        client.addListener(new RemoteSessionListener() {
            @Override
            public void onStarting() {
                events.add("starting");
            }

            @Override
            public void onConnecting() {
                events.add("connecting");
            }

            @Override
            public void onConnected() {
                events.add("connected");
            }

            @Override
            public void onData(JsonObject data) {
                events.add("data " + data);
            }

            @Override
            public void onError(Throwable cause) {
                events.add("error " + cause.getClass().getSimpleName());
            }

            @Override
            public void onClosed(int code) {
                events.add("closed " + code);
            }

            @Override
            public void onReconnecting(long interval) {
                events.add("reconnecting " + interval);
            }

            @Override
            public void onStopping() {
                events.add("stopping");
            }
        });
    }

    @After
    public void tearDown() throws Exception {
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    @Test
    public void startConnectsWithToken() {
        client.start();

        assertEquals(Arrays.asList("starting", "connecting", "connected"), events);
        assertEquals("wss://api.example.test/v1", transport.lastUri);
        assertEquals("secret-token", transport.lastToken);
        assertTrue(client.isConnected());
    }

    @Test
    public void messagesAreDemultiplexedByKey() {
        final List<String> handled = new ArrayList<>();
        final List<String> unhandled = new ArrayList<>();
        client.on("alexa.source", payload -> handled.add(payload.toString()));
        client.onUnhandled((key, payload) -> unhandled.add(key));
        client.start();
        events.clear();

        transport.receive("{\"alexa.source\":{\"id\":\"cam1\"},\"hello\":1}");

        assertEquals(Collections.singletonList("data {\"alexa.source\":{\"id\":\"cam1\"},\"hello\":1}"), events);
        assertEquals(Collections.singletonList("{\"id\":\"cam1\"}"), handled);
        assertEquals(Collections.singletonList("hello"), unhandled);
    }

    @Test
    public void unreadableMessageIsAnError() {
        client.start();
        events.clear();

        transport.receive("[1,2");
        transport.receive("42");

        assertEquals(Arrays.asList("error JsonParseException", "error JsonParseException"), events);
    }

    @Test
    public void failingHandlerDoesNotStopDispatch() {
        final List<JsonElement> handled = new ArrayList<>();
        client.on("a", payload -> {
            throw new IllegalStateException("boom");
        });
        client.on("b", handled::add);
        client.start();

        transport.receive("{\"a\":1,\"b\":2}");

        assertEquals(1, handled.size());
    }

    @Test
    public void sendOnlyWhileOpen() {
        JsonObject request = new JsonObject();
        request.addProperty("cmd", "ping");

        assertFalse(client.send(request));
        client.start();
        assertTrue(client.send(request));

        assertEquals(Collections.singletonList("{\"cmd\":\"ping\"}"), transport.sent);
    }

    @Test
    public void subscribe() {
        client.start();

        client.subscribe("alexa.source");
        client.subscribe("a", "b");

        assertEquals(Arrays.asList("{\"sub\":\"alexa.source\"}", "{\"sub\":[\"a\",\"b\"]}"), transport.sent);
    }

    @Test
    public void abnormalCloseReconnectsAfterInterval() throws Exception {
        final CountDownLatch reconnected = new CountDownLatch(1);
        client.start();
        client.addListener(new RemoteSessionListener() {
            @Override
            public void onConnected() {
                reconnected.countDown();
            }
        });
        events.clear();

        final long droppedAt = System.nanoTime();
        transport.dropWith(1006);

        assertEquals(Arrays.asList("closed 1006", "reconnecting " + INTERVAL), events);
        assertEquals(1, transport.opens.get());
        assertTrue(reconnected.await(5, TimeUnit.SECONDS));
        assertTrue(System.nanoTime() - droppedAt >= TimeUnit.MILLISECONDS.toNanos(INTERVAL));
        assertEquals(2, transport.opens.get());
        assertEquals("starting", events.get(2));
    }

    @Test
    public void failedOpenReconnects() throws Exception {
        transport.openFailure = new RemoteAuthenticationException("rejected");

        client.start();

        assertEquals(Arrays.asList("starting", "connecting", "error RemoteAuthenticationException",
                "closed 1006", "reconnecting " + INTERVAL), events);
        client.stop();
    }

    @Test
    public void stopDoesNotReconnect() throws Exception {
        client.start();
        events.clear();

        client.stop();

        assertEquals(Arrays.asList("stopping", "closed " + RemoteSessionClient.CLOSED_BY_CONSUMER), events);
        assertEquals(Collections.singletonList(RemoteSessionClient.CLOSED_BY_CONSUMER), transport.closes);
        Thread.sleep(INTERVAL * 4);
        assertEquals(1, transport.opens.get());
    }

    @Test
    public void stopCancelsPendingReconnect() throws Exception {
        client.start();
        transport.dropWith(1011);

        client.stop();
        Thread.sleep(INTERVAL * 4);

        assertEquals(1, transport.opens.get());
        assertEquals(events.indexOf("starting"), events.lastIndexOf("starting"));
    }

    @Test
    public void connectionOpenedAfterStopIsClosed() throws Exception {
        transport.holdOpen = true;
        client.start();
        client.stop();
        events.clear();

        transport.completeOpen();

        assertFalse(events.contains("connected"));
        assertEquals(Collections.singletonList("closed " + RemoteSessionClient.CLOSED_BY_CONSUMER), events);
        assertFalse(client.isConnected());
        Thread.sleep(INTERVAL * 4);
        assertEquals(1, transport.opens.get());
    }
}
