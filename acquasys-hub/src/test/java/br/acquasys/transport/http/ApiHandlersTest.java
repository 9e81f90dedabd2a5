package br.acquasys.transport.http;

import br.acquasys.application.port.input.HubControl;
import br.acquasys.application.port.output.DeviceGateway;
import br.acquasys.application.port.output.FanoutGateway;
import br.acquasys.application.port.output.TelemetrySink;
import br.acquasys.domain.common.ConnectionState;
import br.acquasys.domain.control.CommandResult;
import br.acquasys.domain.control.RemoteCommand;
import br.acquasys.infrastructure.telegram.TelegramNotificationChannel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static br.acquasys.support.TestReadings.reading;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Integration test for the REST endpoints, served by Undertow on a test port.
 */
@ExtendWith(MockitoExtension.class)
public class ApiHandlersTest {

    private static final int TEST_PORT = 19193;
    private static final ObjectMapper JSON = new ObjectMapper();

    @Mock
    private HubControl control;
    @Mock
    private TelemetrySink sink;
    @Mock
    private DeviceGateway device;
    @Mock
    private FanoutGateway fanout;
    @Mock
    private TelegramNotificationChannel telegram;

    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        ApiHandlers api = new ApiHandlers(control, sink, device, fanout, telegram);
        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing()
                .get("/api/health", api::health)
                .get("/api/sensor-data/latest", api::latestReading)
                .get("/api/sensor-data/history", api::history)
                .post("/api/pump/control", api::pumpControl)
                .post("/api/telegram/test", api::telegramTest))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testHealthReportsAdapterState() throws Exception {
        when(device.connectionState()).thenReturn(ConnectionState.RECONNECTING);
        when(sink.isDegraded()).thenReturn(true);
        when(telegram.isEnabled()).thenReturn(false);
        when(fanout.subscriberCount()).thenReturn(2);
        when(control.latestReading()).thenReturn(Optional.empty());

        HttpResponse<String> response = get("/api/health");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        JsonNode body = JSON.readTree(response.body());
        assertEquals("ok", body.path("status").asText());
        assertEquals("RECONNECTING", body.path("transport").asText());
        assertTrue(body.path("storeDegraded").asBoolean());
        assertEquals(2, body.path("wsClients").asInt());
        assertFalse(body.path("hasData").asBoolean());
    }

    @Test
    public void testLatestReadingNotFoundBeforeFirstReading() throws Exception {
        when(control.latestReading()).thenReturn(Optional.empty());
        when(sink.latest()).thenReturn(Optional.empty());

        HttpResponse<String> response = get("/api/sensor-data/latest");

        assertEquals(404, response.statusCode());
        assertTrue(JSON.readTree(response.body()).has("error"));
    }

    @Test
    public void testHistoryUsesDefaults() throws Exception {
        when(sink.recent(Duration.ofHours(24), 50)).thenReturn(List.of(reading(70.0, true)));

        HttpResponse<String> response = get("/api/sensor-data/history");

        assertEquals(200, response.statusCode());
        JsonNode body = JSON.readTree(response.body());
        assertEquals(1, body.size());
        assertEquals(70.0, body.get(0).path("level").asDouble());
        assertTrue(body.get(0).path("pump").asBoolean());
        assertFalse(body.get(0).has("pumpOn"));
        assertEquals("2025-01-15T13:30:45Z", body.get(0).path("timestamp").asText());
    }

    @Test
    public void testHistoryRejectsBadParameters() throws Exception {
        assertEquals(400, get("/api/sensor-data/history?hours=abc").statusCode());
        assertEquals(400, get("/api/sensor-data/history?limit=0").statusCode());
        verifyNoInteractions(sink);
    }

    @Test
    public void testPumpControlForwardsToCore() throws Exception {
        when(control.submitCommand(any()))
            .thenReturn(CompletableFuture.completedFuture(CommandResult.ok("✅ Pump OFF command sent.")));

        HttpResponse<String> response = post("/api/pump/control", "{\"action\":\"OFF\"}");

        assertEquals(200, response.statusCode());
        JsonNode body = JSON.readTree(response.body());
        assertTrue(body.path("success").asBoolean());
        assertEquals("✅ Pump OFF command sent.", body.path("message").asText());

        ArgumentCaptor<RemoteCommand> captor = ArgumentCaptor.forClass(RemoteCommand.class);
        verify(control).submitCommand(captor.capture());
        assertEquals(RemoteCommand.Kind.PUMP_OFF, captor.getValue().kind());
        assertEquals(RemoteCommand.Origin.HTTP, captor.getValue().origin());
    }

    @Test
    public void testPumpControlRejectsUnknownAction() throws Exception {
        HttpResponse<String> unknown = post("/api/pump/control", "{\"action\":\"drain\"}");
        HttpResponse<String> invalid = post("/api/pump/control", "{oops");

        assertEquals(400, unknown.statusCode());
        assertFalse(JSON.readTree(unknown.body()).path("success").asBoolean(true));
        assertEquals(400, invalid.statusCode());
        verifyNoInteractions(control);
    }

    @Test
    public void testTelegramTestReportsDelivery() throws Exception {
        when(telegram.sendTestNotification()).thenReturn(CompletableFuture.completedFuture(true));

        HttpResponse<String> response = post("/api/telegram/test", "");

        assertEquals(200, response.statusCode());
        assertTrue(JSON.readTree(response.body()).path("success").asBoolean());
    }
}
