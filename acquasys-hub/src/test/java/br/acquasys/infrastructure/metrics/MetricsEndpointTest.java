package br.acquasys.infrastructure.metrics;

import br.acquasys.domain.common.ConnectionState;
import br.acquasys.domain.control.CommandSource;
import br.acquasys.domain.control.PumpAction;
import br.acquasys.domain.control.PumpCommand;
import br.acquasys.domain.control.RemoteCommand;
import br.acquasys.domain.monitoring.AlertKind;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static br.acquasys.support.TestReadings.reading;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 *
 * Tests:
 * - Endpoint accessibility and content type
 * - Metric registration
 * - Recorded values exported with their labels
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19191;
    private Undertow server;
    private PrometheusHubMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        metrics = new PrometheusHubMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path()
                .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
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

    private HttpResponse<String> scrape() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"), "Prometheus text format expected");
        assertTrue(response.body().contains("# TYPE acquasys_readings_total counter"));
        assertTrue(response.body().contains("# TYPE acquasys_ws_subscribers gauge"));
    }

    @Test
    public void testRecordedValuesExported() throws Exception {
        metrics.recordReading(reading(42.5, false).withEfficiency(88.0));
        metrics.recordAlert(AlertKind.HIGH_CURRENT, true);
        metrics.recordPumpCommand(new PumpCommand(PumpAction.ON, CommandSource.REMOTE, "esp32-01"), true);
        metrics.recordRemoteCommand(RemoteCommand.of(RemoteCommand.Kind.STATUS, RemoteCommand.Origin.CHAT), true);
        metrics.recordStepFailure("sink");
        metrics.updateTransportState(ConnectionState.CONNECTED);
        metrics.updateSubscriberCount(3);

        String body = scrape().body();

        assertTrue(body.contains("acquasys_readings_total 1.0"), body);
        assertTrue(body.contains("acquasys_water_level_percent 42.5"));
        assertTrue(body.contains("acquasys_efficiency_percent 88.0"));
        assertTrue(body.contains("acquasys_alerts_total{kind=\"high_current\",outcome=\"suppressed\",} 1.0"));
        assertTrue(body.contains(
            "acquasys_pump_commands_total{action=\"ON\",source=\"remote\",result=\"published\",} 1.0"));
        assertTrue(body.contains(
            "acquasys_remote_commands_total{origin=\"chat\",kind=\"status\",result=\"success\",} 1.0"));
        assertTrue(body.contains("acquasys_pipeline_failures_total{step=\"sink\",} 1.0"));
        assertTrue(body.contains("acquasys_transport_connected 1.0"));
        assertTrue(body.contains("acquasys_ws_subscribers 3.0"));
    }
}
