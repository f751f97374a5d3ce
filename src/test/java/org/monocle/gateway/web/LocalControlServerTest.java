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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import org.apache.log4j.Level;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.monocle.gateway.entities.CameraDescriptor;
import org.monocle.gateway.entities.CameraState;
import org.monocle.gateway.entities.DeviceInfo;
import org.monocle.gateway.entities.Preset;
import org.monocle.gateway.util.logging.ConsoleLogger;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class LocalControlServerTest {

    private Vertx vertx;
    private LocalControlServer server;
    private WebSocketClient client;
    private int port;
    private final BlockingQueue<String> notifications = new LinkedBlockingQueue<>();
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();

    private static final CameraState PORCH = CameraState.initialized(
            new CameraDescriptor.Builder().uuid("cam1").name("Porch").build(),
            new DeviceInfo("Acme", "PTZ-9000", "2.1.4", "SN123", null),
            true,
            Collections.singletonList(new Preset("1", "Door")));

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    @Before
    public void setUp() throws Exception {
        vertx = Vertx.vertx();
        server = new LocalControlServer(vertx, 0, new ConsoleLogger(Level.OFF));
        server.addListener(new ControlListener() {
            @Override
            public void onConnected(String controller) {
                notifications.add("connected");
            }

            @Override
            public void onDisconnected(String controller) {
                notifications.add("disconnected");
            }

            @Override
            public void onError(String controller, Throwable cause) {
                errors.add(cause);
                notifications.add("error");
            }

            @Override
            public void onStop(String controller) {
                notifications.add("stop");
            }

            @Override
            public void onHome(String controller) {
                notifications.add("home");
            }

            @Override
            public void onPreset(String controller, String token) {
                notifications.add("preset " + token);
            }

            @Override
            public void onPtz(String controller, int pan, int tilt, int zoom) {
                notifications.add("ptz " + pan + " " + tilt + " " + zoom);
            }

            @Override
            public void onPan(String controller, int pan) {
                notifications.add("pan " + pan);
            }

            @Override
            public void onTilt(String controller, int tilt) {
                notifications.add("tilt " + tilt);
            }

            @Override
            public void onZoom(String controller, int zoom) {
                notifications.add("zoom " + zoom);
            }
        });
        port = await(server.listen());
        client = vertx.createWebSocketClient();
    }

    @After
    public void tearDown() throws Exception {
        await(server.close());
        await(vertx.close());
    }

    private WebSocket connect(BlockingQueue<String> inbox) throws Exception {
        WebSocket ws = await(client.connect(port, "localhost", "/").map(connected -> {
            connected.textMessageHandler(inbox::add);
            return connected;
        }));
        assertEquals("connected", notifications.poll(5, TimeUnit.SECONDS));
        return ws;
    }

    @Test
    public void commandsBecomeNotifications() throws Exception {
        WebSocket ws = connect(new LinkedBlockingQueue<>());

        for (String command : new String[]{"stop", "HOME", "preset:Door", "ptz:1:-2:0", "pan:3", "tilt:-1", "zoom:2"}) {
            ws.writeTextMessage(command);
        }

        assertEquals("stop", notifications.poll(5, TimeUnit.SECONDS));
        assertEquals("home", notifications.poll(5, TimeUnit.SECONDS));
        assertEquals("preset Door", notifications.poll(5, TimeUnit.SECONDS));
        assertEquals("ptz 1 -2 0", notifications.poll(5, TimeUnit.SECONDS));
        assertEquals("pan 3", notifications.poll(5, TimeUnit.SECONDS));
        assertEquals("tilt -1", notifications.poll(5, TimeUnit.SECONDS));
        assertEquals("zoom 2", notifications.poll(5, TimeUnit.SECONDS));
    }

    @Test
    public void malformedCommandOnlyReportsError() throws Exception {
        BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
        WebSocket ws = connect(inbox);

        ws.writeTextMessage("ptz:1:2");
        ws.writeTextMessage("stop");

        assertEquals("error", notifications.poll(5, TimeUnit.SECONDS));
        assertEquals("stop", notifications.poll(5, TimeUnit.SECONDS));
        assertTrue(errors.get(0) instanceof MalformedCommandException);
        assertTrue(inbox.isEmpty());
        assertFalse(ws.isClosed());
    }

    @Test
    public void lateJoinerReceivesPublishedStateOnce() throws Exception {
        server.publish(PORCH);
        BlockingQueue<String> inbox = new LinkedBlockingQueue<>();

        connect(inbox);

        String first = inbox.poll(5, TimeUnit.SECONDS);
        assertNotNull(first);
        JsonObject message = JsonParser.parseString(first).getAsJsonObject();
        assertEquals(Collections.singleton("source"), message.keySet());
        assertEquals("cam1", message.getAsJsonObject("source").get("uuid").getAsString());
        assertTrue(message.getAsJsonObject("source").get("ptz").getAsBoolean());
        assertNull(inbox.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    public void publishAndBroadcastReachEveryController() throws Exception {
        BlockingQueue<String> first = new LinkedBlockingQueue<>();
        BlockingQueue<String> second = new LinkedBlockingQueue<>();
        connect(first);
        connect(second);
        assertEquals(2, server.getControllerCount());

        server.publish(PORCH);
        JsonObject ping = new JsonObject();
        ping.addProperty("ping", 1);
        server.broadcast(ping);

        for (BlockingQueue<String> inbox : Arrays.asList(first, second)) {
            assertTrue(inbox.poll(5, TimeUnit.SECONDS).startsWith("{\"source\":"));
            assertEquals("{\"ping\":1}", inbox.poll(5, TimeUnit.SECONDS));
        }
        assertSame(PORCH, server.getPublished());
    }

    @Test
    public void disconnectIsReported() throws Exception {
        WebSocket ws = connect(new LinkedBlockingQueue<>());

        await(ws.close());

        assertEquals("disconnected", notifications.poll(5, TimeUnit.SECONDS));
        assertEquals(0, server.getControllerCount());
    }

    @Test
    public void controllersJoiningDuringPublishEndOnLatestState() throws Exception {
        final int states = 300;
        Thread publisher = new Thread(() -> {
            for (int i = 0; i < states; ++i) {
                server.publish(CameraState.failed(
                        new CameraDescriptor.Builder().uuid("cam" + i).name("Camera " + i).build(), "offline"));
                try {
                    Thread.sleep(1);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        });
        List<BlockingQueue<String>> inboxes = new CopyOnWriteArrayList<>();

        publisher.start();
        for (int i = 0; i < 8; ++i) {
            BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
            inboxes.add(inbox);
            connect(inbox);
        }
        publisher.join(10000);

        for (BlockingQueue<String> inbox : inboxes) {
            String last = null;
            for (String message = inbox.poll(5, TimeUnit.SECONDS); message != null;
                 message = inbox.poll(300, TimeUnit.MILLISECONDS)) {
                last = message;
            }
            assertNotNull(last);
            assertEquals("cam" + (states - 1),
                    JsonParser.parseString(last).getAsJsonObject()
                            .getAsJsonObject("source").get("uuid").getAsString());
        }
    }
}
