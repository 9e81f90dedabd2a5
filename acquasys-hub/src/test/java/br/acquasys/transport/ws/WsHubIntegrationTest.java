package br.acquasys.transport.ws;

import br.acquasys.application.port.input.HubControl;
import br.acquasys.domain.common.EventType;
import br.acquasys.domain.common.HubEvent;
import br.acquasys.domain.config.ConfigSnapshot;
import br.acquasys.domain.control.CommandResult;
import br.acquasys.domain.control.RemoteCommand;
import br.acquasys.infrastructure.metrics.HubMetrics;
import br.acquasys.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static br.acquasys.support.TestReadings.T0;
import static br.acquasys.support.TestReadings.reading;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Integration test for the dashboard WebSocket endpoint.
 *
 * Tests:
 * - Initial state pushed on connect
 * - Broadcast delivery
 * - Pump control and ping round trips
 * - Token enforcement
 */
@ExtendWith(MockitoExtension.class)
public class WsHubIntegrationTest {

    private static final int TEST_PORT = 19192;
    private static final String TOKEN = "s3cret";

    @Mock
    private HubControl control;
    @Mock
    private HubMetrics metrics;

    private WsHub hub;
    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        lenient().when(control.configSnapshot()).thenReturn(new ConfigSnapshot(true, 20.0, 95.0, "auto"));
        lenient().when(control.latestReading()).thenReturn(Optional.empty());

        hub = new WsHub(TOKEN, metrics, new MutableClock(T0));
        hub.attach(control);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path().addPrefixPath("/ws", hub.websocketHandler()))
            .build();
        server.start();

        httpClient = HttpClient.newHttpClient();
    }

    @AfterEach
    public void tearDown() {
        hub.stop();
        if (server != null) {
            server.stop();
        }
    }

    /**
     * Collects whole text frames and records when the server ends the session.
     */
    private static final class Collector implements WebSocket.Listener {
        final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        final CompletableFuture<Void> closed = new CompletableFuture<>();
        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                messages.add(partial.toString());
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            closed.complete(null);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            closed.complete(null);
        }

        JsonNode next() throws Exception {
            String raw = messages.poll(5, TimeUnit.SECONDS);
            assertNotNull(raw, "expected a message from the hub");
            return WsHub.MAPPER.readTree(raw);
        }
    }

    private WebSocket connect(String token, Collector collector) throws Exception {
        String query = token == null ? "" : "?token=" + token;
        return httpClient.newWebSocketBuilder()
            .buildAsync(URI.create("ws://localhost:" + TEST_PORT + "/ws" + query), collector)
            .get(5, TimeUnit.SECONDS);
    }

    @Test
    public void testInitialConfigPushedOnConnect() throws Exception {
        Collector collector = new Collector();
        connect(TOKEN, collector);

        JsonNode first = collector.next();
        assertEquals("systemConfig", first.path("type").asText());
        assertTrue(first.path("data").path("autoMode").asBoolean());
        assertEquals(20.0, first.path("data").path("lowThreshold").asDouble());
        assertEquals("2025-01-15T13:30:45Z", first.path("timestamp").asText());
    }

    @Test
    public void testBroadcastReachesSubscriber() throws Exception {
        Collector collector = new Collector();
        connect(TOKEN, collector);
        collector.next();
        assertEquals(1, hub.subscriberCount());

        hub.broadcast(HubEvent.of(EventType.SENSOR_DATA, reading(72.5, true), T0));

        JsonNode event = collector.next();
        assertEquals("sensorData", event.path("type").asText());
        assertEquals(72.5, event.path("data").path("level").asDouble());
        assertEquals("esp32-01", event.path("data").path("device").asText());
        assertTrue(event.path("data").path("pump").asBoolean());
        assertFalse(event.path("data").has("pumpOn"));
        verify(metrics).updateSubscriberCount(1);
    }

    @Test
    public void testControlPumpAnsweredWithCommandResult() throws Exception {
        when(control.submitCommand(any())).thenReturn(CompletableFuture.completedFuture(
            CommandResult.rejected("⚠️ The system is in automatic mode. Use /manual before controlling the pump.")));
        Collector collector = new Collector();
        WebSocket ws = connect(TOKEN, collector);
        collector.next();

        ws.sendText("{\"type\":\"controlPump\",\"action\":\"on\"}", true);

        JsonNode result = collector.next();
        assertEquals("commandResult", result.path("type").asText());
        assertFalse(result.path("data").path("success").asBoolean(true));

        ArgumentCaptor<RemoteCommand> captor = ArgumentCaptor.forClass(RemoteCommand.class);
        verify(control).submitCommand(captor.capture());
        assertEquals(RemoteCommand.Kind.PUMP_ON, captor.getValue().kind());
        assertEquals(RemoteCommand.Origin.DASHBOARD, captor.getValue().origin());
    }

    @Test
    public void testPingAndUnknownMessages() throws Exception {
        Collector collector = new Collector();
        WebSocket ws = connect(TOKEN, collector);
        collector.next();

        ws.sendText("{\"type\":\"ping\"}", true).get(5, TimeUnit.SECONDS);
        JsonNode pong = collector.next();
        assertEquals("ping", pong.path("type").asText());
        assertTrue(pong.path("data").path("pong").asBoolean());

        ws.sendText("{\"type\":\"reboot\"}", true).get(5, TimeUnit.SECONDS);
        JsonNode rejected = collector.next();
        assertEquals("commandResult", rejected.path("type").asText());
        assertTrue(rejected.path("data").path("message").asText().contains("reboot"));
        verify(control, never()).submitCommand(any());
    }

    @Test
    public void testConnectionWithoutTokenIsClosed() throws Exception {
        Collector collector = new Collector();
        connect("wrong", collector);

        collector.closed.get(5, TimeUnit.SECONDS);
        assertEquals(0, hub.subscriberCount());
        assertTrue(collector.messages.isEmpty());
    }

    @Test
    public void testExtractToken() {
        assertEquals("abc", WsHub.extractToken("foo=1&token=abc"));
        assertNull(WsHub.extractToken("foo=1"));
        assertNull(WsHub.extractToken(null));
    }
}
