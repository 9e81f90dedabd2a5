package br.acquasys.application.port.input;

import br.acquasys.application.orchestration.StatusSnapshot;
import br.acquasys.domain.config.ConfigSnapshot;
import br.acquasys.domain.control.CommandResult;
import br.acquasys.domain.control.RemoteCommand;
import br.acquasys.domain.telemetry.SensorReading;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry points of the hub core used by the adapters.
 *
 * Mutating calls are queued on the orchestration loop and complete once the loop has handled
 * them. Read-only projections may be called from any thread.
 */
public interface HubControl {

    /**
     * Queue a telemetry sample for the ingestion pipeline. Samples are handled in submission order.
     */
    CompletableFuture<Void> submitReading(SensorReading reading);

    /**
     * Queue an operator command. The future never completes exceptionally; failures are reported
     * through {@link CommandResult#success()}.
     */
    CompletableFuture<CommandResult> submitCommand(RemoteCommand command);

    /**
     * Human-readable status report (HTML markup for chat).
     */
    String statusReport();

    /**
     * Structured status; {@link StatusSnapshot#online()} is false before the first reading.
     */
    StatusSnapshot statusSnapshot();

    ConfigSnapshot configSnapshot();

    Optional<SensorReading> latestReading();
}
