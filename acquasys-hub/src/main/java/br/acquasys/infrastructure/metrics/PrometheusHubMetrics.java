package br.acquasys.infrastructure.metrics;

import br.acquasys.domain.common.ConnectionState;
import br.acquasys.domain.control.PumpCommand;
import br.acquasys.domain.control.RemoteCommand;
import br.acquasys.domain.monitoring.AlertKind;
import br.acquasys.domain.telemetry.SensorReading;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus implementation of HubMetrics.
 *
 * Key Metrics:
 * - acquasys_readings_total - Readings processed
 * - acquasys_malformed_payloads_total - Telemetry payloads dropped by the parser
 * - acquasys_alerts_total{kind, outcome} - Alerts dispatched or suppressed
 * - acquasys_pipeline_failures_total{step} - Isolated pipeline step failures
 * - acquasys_pump_commands_total{action, source, result} - Device commands
 * - acquasys_remote_commands_total{origin, kind, result} - Operator commands
 * - acquasys_water_level_percent / acquasys_efficiency_percent - Last reading
 * - acquasys_transport_connected, acquasys_store_available, acquasys_ws_subscribers
 *
 * Usage:
 * <pre>
 * PrometheusHubMetrics metrics = new PrometheusHubMetrics();
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusHubMetrics implements HubMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusHubMetrics.class);

    private final CollectorRegistry registry;

    // Pipeline
    private final Counter readingCounter;
    private final Counter malformedCounter;
    private final Counter stepFailureCounter;
    private final Gauge waterLevel;
    private final Gauge efficiency;

    // Alerts and notifications
    private final Counter alertCounter;
    private final Counter notificationCounter;

    // Commands
    private final Counter pumpCommandCounter;
    private final Counter remoteCommandCounter;

    // Adapters
    private final Counter deviceStatusCounter;
    private final Gauge transportConnected;
    private final Gauge storeAvailable;
    private final Gauge subscribers;

    public PrometheusHubMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusHubMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.readingCounter = Counter.build()
            .name("acquasys_readings_total")
            .help("Telemetry readings processed by the pipeline")
            .register(registry);

        this.malformedCounter = Counter.build()
            .name("acquasys_malformed_payloads_total")
            .help("Telemetry payloads dropped as malformed")
            .register(registry);

        this.stepFailureCounter = Counter.build()
            .name("acquasys_pipeline_failures_total")
            .help("Failures of isolated pipeline steps")
            .labelNames("step")
            .register(registry);

        this.waterLevel = Gauge.build()
            .name("acquasys_water_level_percent")
            .help("Water level of the last reading")
            .register(registry);

        this.efficiency = Gauge.build()
            .name("acquasys_efficiency_percent")
            .help("Averaged pump efficiency of the last reading")
            .register(registry);

        this.alertCounter = Counter.build()
            .name("acquasys_alerts_total")
            .help("Alert decisions by kind and outcome")
            .labelNames("kind", "outcome")
            .register(registry);

        this.notificationCounter = Counter.build()
            .name("acquasys_notifications_total")
            .help("Chat notifications by delivery result")
            .labelNames("result")
            .register(registry);

        this.pumpCommandCounter = Counter.build()
            .name("acquasys_pump_commands_total")
            .help("Pump commands sent to the device")
            .labelNames("action", "source", "result")
            .register(registry);

        this.remoteCommandCounter = Counter.build()
            .name("acquasys_remote_commands_total")
            .help("Operator commands handled by the hub")
            .labelNames("origin", "kind", "result")
            .register(registry);

        this.deviceStatusCounter = Counter.build()
            .name("acquasys_device_status_messages_total")
            .help("Status messages received from the device")
            .labelNames("topic")
            .register(registry);

        this.transportConnected = Gauge.build()
            .name("acquasys_transport_connected")
            .help("Device transport connection (1=connected, 0=not connected)")
            .register(registry);

        this.storeAvailable = Gauge.build()
            .name("acquasys_store_available")
            .help("Durable store availability (1=available, 0=degraded)")
            .register(registry);

        this.subscribers = Gauge.build()
            .name("acquasys_ws_subscribers")
            .help("Connected dashboard subscribers")
            .register(registry);

        log.info("[METRICS] Prometheus hub metrics initialized");
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordReading(SensorReading reading) {
        readingCounter.inc();
        waterLevel.set(reading.level());
        if (reading.efficiency() != null) {
            efficiency.set(reading.efficiency());
        }
    }

    @Override
    public void recordMalformedPayload() {
        malformedCounter.inc();
    }

    @Override
    public void recordAlert(AlertKind kind, boolean suppressed) {
        alertCounter.labels(kind.key(), suppressed ? "suppressed" : "dispatched").inc();
    }

    @Override
    public void recordStepFailure(String step) {
        stepFailureCounter.labels(step).inc();
    }

    @Override
    public void recordPumpCommand(PumpCommand command, boolean published) {
        pumpCommandCounter.labels(
            command.action().wireToken(),
            command.source().label(),
            published ? "published" : "failed").inc();
    }

    @Override
    public void recordRemoteCommand(RemoteCommand command, boolean success) {
        remoteCommandCounter.labels(
            command.origin().name().toLowerCase(),
            command.kind().name().toLowerCase(),
            success ? "success" : "rejected").inc();
    }

    @Override
    public void recordNotification(boolean delivered) {
        notificationCounter.labels(delivered ? "delivered" : "failed").inc();
    }

    @Override
    public void recordDeviceStatusMessage(String topic) {
        deviceStatusCounter.labels(topic).inc();
    }

    @Override
    public void updateTransportState(ConnectionState state) {
        transportConnected.set(state == ConnectionState.CONNECTED ? 1 : 0);
    }

    @Override
    public void updateStoreAvailable(boolean available) {
        storeAvailable.set(available ? 1 : 0);
    }

    @Override
    public void updateSubscriberCount(int count) {
        subscribers.set(count);
    }
}
