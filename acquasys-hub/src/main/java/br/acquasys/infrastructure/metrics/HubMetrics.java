package br.acquasys.infrastructure.metrics;

import br.acquasys.domain.common.ConnectionState;
import br.acquasys.domain.control.PumpCommand;
import br.acquasys.domain.control.RemoteCommand;
import br.acquasys.domain.monitoring.AlertKind;
import br.acquasys.domain.telemetry.SensorReading;

/**
 * Hub metrics for monitoring the ingestion pipeline and its adapters.
 *
 * Key metrics:
 * - Readings processed and malformed payloads dropped
 * - Alerts dispatched and suppressed by cooldown
 * - Pipeline step failures per step
 * - Pump and remote commands with their outcome
 * - Transport, store and subscriber state
 */
public interface HubMetrics {

    /**
     * Record a reading that went through the pipeline.
     *
     * @param reading Reading with efficiency attached
     */
    void recordReading(SensorReading reading);

    void recordMalformedPayload();

    /**
     * Record an alert decision.
     *
     * @param kind Alert kind
     * @param suppressed true if the cooldown held the alert back
     */
    void recordAlert(AlertKind kind, boolean suppressed);

    /**
     * Record a failed pipeline step (e.g. "auto_control", "alerts", "sink", "fanout").
     */
    void recordStepFailure(String step);

    void recordPumpCommand(PumpCommand command, boolean published);

    void recordRemoteCommand(RemoteCommand command, boolean success);

    void recordNotification(boolean delivered);

    void recordDeviceStatusMessage(String topic);

    void updateTransportState(ConnectionState state);

    void updateStoreAvailable(boolean available);

    void updateSubscriberCount(int count);
}
