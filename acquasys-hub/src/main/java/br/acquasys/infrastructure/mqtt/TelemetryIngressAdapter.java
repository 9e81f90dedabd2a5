package br.acquasys.infrastructure.mqtt;

import br.acquasys.application.port.input.HubControl;
import br.acquasys.application.port.output.DeviceGateway;
import br.acquasys.domain.common.ConnectionState;
import br.acquasys.domain.control.PumpCommand;
import br.acquasys.domain.telemetry.SensorReading;
import br.acquasys.infrastructure.common.ReconnectionPolicy;
import br.acquasys.infrastructure.metrics.HubMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Device side of the hub: feeds sensor telemetry into the core and publishes pump commands.
 *
 * Connection handling:
 * - Connects on a dedicated scheduler thread, subscribes to all topics on every connect
 * - Lost connections are retried with {@link ReconnectionPolicy} backoff
 * - When the circuit opens the adapter waits the policy's maximum delay, resets the circuit and
 *   keeps trying; the hub never gives up on the device
 */
public final class TelemetryIngressAdapter implements DeviceGateway, DeviceTransport.Listener {
    private static final Logger log = LoggerFactory.getLogger(TelemetryIngressAdapter.class);

    private static final int COMMAND_QOS = 1;

    private final DeviceTransport transport;
    private final MqttTopics topics;
    private final TelemetryParser parser;
    private final ReconnectionPolicy policy;
    private final HubMetrics metrics;
    private final ScheduledExecutorService scheduler;

    private volatile HubControl control;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean stopped = false;

    public TelemetryIngressAdapter(DeviceTransport transport, MqttTopics topics, TelemetryParser parser,
                                   ReconnectionPolicy policy, HubMetrics metrics) {
        this(transport, topics, parser, policy, metrics, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mqtt-connector");
            t.setDaemon(true);
            return t;
        }));
    }

    TelemetryIngressAdapter(DeviceTransport transport, MqttTopics topics, TelemetryParser parser,
                            ReconnectionPolicy policy, HubMetrics metrics, ScheduledExecutorService scheduler) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.topics = Objects.requireNonNull(topics, "topics");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.scheduler = scheduler;
        transport.setListener(this);
    }

    /**
     * Wire the core that receives parsed readings. Must be called before {@link #start()}.
     */
    public void attach(HubControl control) {
        this.control = Objects.requireNonNull(control, "control");
    }

    public void start() {
        if (control == null) {
            throw new IllegalStateException("HubControl not attached");
        }
        stopped = false;
        setState(ConnectionState.CONNECTING);
        scheduler.execute(this::connectOnce);
        log.info("[MQTT] Ingress starting against {}", transport.describe());
    }

    public void stop() {
        stopped = true;
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        transport.close();
        setState(ConnectionState.DISCONNECTED);
        log.info("[MQTT] Ingress stopped");
    }

    void connectOnce() {
        if (stopped) {
            return;
        }
        try {
            transport.connect();
            transport.subscribe(topics.subscriptions());
            policy.recordSuccess();
            setState(ConnectionState.CONNECTED);
            log.info("[MQTT] Subscribed to {}", topics.subscriptions());
        } catch (TransportConnectionException e) {
            log.warn("[MQTT] {}", e.getMessage());
            scheduleReconnect();
        } catch (RuntimeException e) {
            log.error("[MQTT] Unexpected failure while connecting: {}", e.getMessage(), e);
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        if (stopped) {
            return;
        }
        Duration delay = policy.recordFailure();
        if (!policy.shouldRetry()) {
            delay = policy.getMaxDelay();
            log.error("[MQTT] {} consecutive failures, cooling down for {}s before retrying",
                policy.getFailureCount(), delay.toSeconds());
            policy.reset();
        }
        setState(ConnectionState.RECONNECTING);
        log.info("[MQTT] Reconnecting in {} ms", delay.toMillis());
        scheduler.schedule(this::connectOnce, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    // ═══════════════════════════════════════════════════════════════
    // DeviceTransport.Listener
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void onConnectionLost(Throwable cause) {
        log.warn("[MQTT] Connection lost: {}", cause == null ? "unknown" : cause.getMessage());
        if (!stopped) {
            setState(ConnectionState.RECONNECTING);
            scheduler.execute(this::scheduleReconnect);
        }
    }

    @Override
    public void onMessage(String topic, String payload) {
        try {
            if (topic.equals(topics.sensors())) {
                handleTelemetry(payload);
            } else if (topic.equals(topics.pumpStatus()) || topic.equals(topics.systemStatus())) {
                metrics.recordDeviceStatusMessage(topic);
                log.info("[MQTT] {} -> {}", topic, payload);
            } else {
                log.debug("[MQTT] Ignoring message on {}", topic);
            }
        } catch (RuntimeException e) {
            log.error("[MQTT] Failed to handle message on {}: {}", topic, e.getMessage(), e);
        }
    }

    private void handleTelemetry(String payload) {
        SensorReading reading;
        try {
            reading = parser.parse(payload);
        } catch (TelemetryParseException e) {
            metrics.recordMalformedPayload();
            log.warn("[MQTT] Dropping malformed telemetry: {}", e.getMessage());
            return;
        }
        control.submitReading(reading);
    }

    // ═══════════════════════════════════════════════════════════════
    // DeviceGateway
    // ═══════════════════════════════════════════════════════════════

    @Override
    public boolean sendPumpCommand(PumpCommand command) {
        if (!transport.isConnected()) {
            log.warn("[MQTT] Cannot send {} ({}): transport not connected",
                command.action(), command.source().label());
            return false;
        }
        try {
            transport.publish(topics.pumpControl(), command.action().wireToken(), COMMAND_QOS);
            log.info("[MQTT] Sent {} to {} (source={})", command.action().wireToken(),
                topics.pumpControl(), command.source().label());
            return true;
        } catch (TransportConnectionException e) {
            log.error("[MQTT] {}", e.getMessage());
            return false;
        }
    }

    @Override
    public ConnectionState connectionState() {
        return state;
    }

    private void setState(ConnectionState next) {
        state = next;
        metrics.updateTransportState(next);
    }
}
