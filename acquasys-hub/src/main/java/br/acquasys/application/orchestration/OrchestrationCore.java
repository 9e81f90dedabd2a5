package br.acquasys.application.orchestration;

import br.acquasys.application.port.input.HubControl;
import br.acquasys.application.port.output.DeviceGateway;
import br.acquasys.application.port.output.FanoutGateway;
import br.acquasys.application.port.output.NotificationChannel;
import br.acquasys.application.port.output.TelemetrySink;
import br.acquasys.domain.common.EventType;
import br.acquasys.domain.common.HubEvent;
import br.acquasys.domain.config.AlertThresholds;
import br.acquasys.domain.config.ConfigSnapshot;
import br.acquasys.domain.config.EfficiencyModel;
import br.acquasys.domain.config.SystemOperatingConfig;
import br.acquasys.domain.control.CommandResult;
import br.acquasys.domain.control.CommandSource;
import br.acquasys.domain.control.PumpAction;
import br.acquasys.domain.control.PumpCommand;
import br.acquasys.domain.control.RemoteCommand;
import br.acquasys.domain.monitoring.Alert;
import br.acquasys.domain.telemetry.SensorReading;
import br.acquasys.infrastructure.metrics.HubMetrics;
import br.acquasys.util.Html;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Hub core: runs the ingestion pipeline for every reading and executes operator commands.
 *
 * All mutating work runs on the single-threaded {@code eventLoop}, so pipeline state
 * (previous level, efficiency history, alert cooldowns) needs no locking. Each pipeline step is
 * guarded on its own; a failing sink never skips the remaining steps.
 *
 * Pipeline per reading:
 * 1. automatic pump control
 * 2. alert rules with cooldown
 * 3. efficiency estimate averaged over the recent history
 * 4. durable write
 * 5. dashboard broadcast
 * 6. remember level and reading for the next round
 */
public final class OrchestrationCore implements HubControl {
    private static final Logger log = LoggerFactory.getLogger(OrchestrationCore.class);

    static final String DEFAULT_DEVICE = "acquasys";

    private final DeviceGateway device;
    private final TelemetrySink sink;
    private final NotificationChannel notifications;
    private final FanoutGateway fanout;
    private final SystemOperatingConfig config;
    private final HubMetrics metrics;
    private final Clock clock;
    private final Executor eventLoop;

    private final AutoPumpPolicy autoPolicy = new AutoPumpPolicy();
    private final AlertEvaluator alertEvaluator;
    private final AlertCooldownTable cooldowns;
    private final EfficiencyEstimator efficiencyEstimator;
    private final EfficiencyHistory efficiencyHistory = new EfficiencyHistory();
    private final StatusReportFormatter statusFormatter;

    // Loop-owned
    private Double previousLevel;

    // Published to readers on other threads
    private volatile SensorReading latest;
    private volatile double currentEfficiency = 100.0;

    public OrchestrationCore(DeviceGateway device,
                             TelemetrySink sink,
                             NotificationChannel notifications,
                             FanoutGateway fanout,
                             SystemOperatingConfig config,
                             AlertThresholds thresholds,
                             EfficiencyModel efficiencyModel,
                             HubMetrics metrics,
                             Clock clock,
                             ZoneId zone,
                             Executor eventLoop) {
        this.device = Objects.requireNonNull(device, "device");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.notifications = Objects.requireNonNull(notifications, "notifications");
        this.fanout = Objects.requireNonNull(fanout, "fanout");
        this.config = Objects.requireNonNull(config, "config");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.alertEvaluator = new AlertEvaluator(thresholds);
        this.cooldowns = new AlertCooldownTable(thresholds.cooldown());
        this.efficiencyEstimator = new EfficiencyEstimator(efficiencyModel);
        this.statusFormatter = new StatusReportFormatter(zone);
    }

    // ═══════════════════════════════════════════════════════════════
    // HubControl
    // ═══════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<Void> submitReading(SensorReading reading) {
        return CompletableFuture.runAsync(() -> onSensorReading(reading), eventLoop)
            .exceptionally(e -> {
                log.error("[CORE] Reading from {} not processed: {}", reading.device(), e.toString(), e);
                return null;
            });
    }

    @Override
    public CompletableFuture<CommandResult> submitCommand(RemoteCommand command) {
        return CompletableFuture.supplyAsync(() -> onRemoteCommand(command), eventLoop)
            .exceptionally(e -> {
                log.error("[CORE] Command {} from {} failed: {}", command.kind(), command.origin(), e.toString(), e);
                return CommandResult.rejected("Internal error while handling the command.");
            });
    }

    @Override
    public String statusReport() {
        return statusFormatter.render(statusSnapshot());
    }

    @Override
    public StatusSnapshot statusSnapshot() {
        return statusFormatter.snapshot(latest, device.connectionState(), sink.isDegraded(),
            config.isAutoMode(), currentEfficiency, clock.instant());
    }

    @Override
    public ConfigSnapshot configSnapshot() {
        return config.snapshot();
    }

    @Override
    public Optional<SensorReading> latestReading() {
        return Optional.ofNullable(latest);
    }

    // ═══════════════════════════════════════════════════════════════
    // Ingestion pipeline (event loop)
    // ═══════════════════════════════════════════════════════════════

    void onSensorReading(SensorReading reading) {
        Instant now = clock.instant();
        log.debug("[CORE] Reading from {}: level={} pump={} current={}",
            reading.device(), reading.level(), reading.pumpOn(), reading.current());

        guard("auto_control", () -> applyAutoControl(reading));
        guard("alerts", () -> evaluateAlerts(reading, now));

        SensorReading enriched = reading;
        try {
            enriched = attachEfficiency(reading);
        } catch (RuntimeException e) {
            metrics.recordStepFailure("efficiency");
            log.error("[CORE] Efficiency estimate failed: {}", e.getMessage(), e);
        }

        SensorReading toPublish = enriched;
        guard("sink", () -> sink.write(toPublish));
        guard("fanout", () -> fanout.broadcast(HubEvent.of(EventType.SENSOR_DATA, toPublish, now)));

        previousLevel = reading.level();
        latest = toPublish;
        metrics.recordReading(toPublish);
    }

    private void applyAutoControl(SensorReading reading) {
        autoPolicy.decide(reading, config).ifPresent(action -> {
            log.info("[CORE] Auto control: level {}% -> pump {}", reading.level(), action);
            config.setLastCommandSource(CommandSource.AUTO);
            issue(new PumpCommand(action, CommandSource.AUTO, reading.device()));
        });
    }

    private void evaluateAlerts(SensorReading reading, Instant now) {
        for (AlertEvaluator.Candidate candidate : alertEvaluator.evaluate(reading, previousLevel, config)) {
            if (!cooldowns.tryFire(candidate.kind(), now)) {
                metrics.recordAlert(candidate.kind(), true);
                log.debug("[CORE] Alert {} suppressed by cooldown", candidate.kind().key());
                continue;
            }

            Alert alert = Alert.builder()
                .kind(candidate.kind())
                .message(candidate.message())
                .reading(reading)
                .timestamp(now)
                .build();
            metrics.recordAlert(candidate.kind(), false);
            log.warn("[CORE] {}", alert);

            guard("notification", () -> notifications.sendAlert(alert));
            guard("fanout", () -> fanout.broadcast(HubEvent.of(EventType.SYSTEM_ALERT, alert, now)));
        }
    }

    private SensorReading attachEfficiency(SensorReading reading) {
        efficiencyHistory.push(efficiencyEstimator.instantaneous(reading));
        double average = efficiencyHistory.average();
        currentEfficiency = average;
        return reading.withEfficiency(average);
    }

    // ═══════════════════════════════════════════════════════════════
    // Operator commands (event loop)
    // ═══════════════════════════════════════════════════════════════

    CommandResult onRemoteCommand(RemoteCommand command) {
        log.info("[CORE] Command {} from {} ({})", command.kind(), command.origin(), command.requester());

        CommandResult result = switch (command.kind()) {
            case STATUS -> CommandResult.ok(statusReport());
            case HELP -> CommandResult.ok(helpText(command));
            case SET_AUTO -> changeMode(true, command);
            case SET_MANUAL -> changeMode(false, command);
            case PUMP_ON -> togglePump(PumpAction.ON, command);
            case PUMP_OFF -> togglePump(PumpAction.OFF, command);
        };

        metrics.recordRemoteCommand(command, result.success());
        return result;
    }

    private CommandResult changeMode(boolean autoMode, RemoteCommand command) {
        config.setAutoMode(autoMode);
        PumpAction action = autoMode ? PumpAction.AUTO : PumpAction.MANUAL;
        if (!issue(new PumpCommand(action, command.origin().commandSource(), targetDevice()))) {
            log.warn("[CORE] Mode changed to {} but the device was not notified", action);
        }
        guard("fanout", () -> fanout.broadcast(HubEvent.of(EventType.SYSTEM_CONFIG, config.snapshot(), clock.instant())));

        if (autoMode) {
            return CommandResult.ok("🤖 Automatic mode enabled. The pump follows the level thresholds.");
        }
        return CommandResult.ok(fromChat(command)
            ? "👤 Manual mode enabled. Use /ligar or /desligar to control the pump."
            : "👤 Manual mode enabled. The pump now follows operator commands.");
    }

    private CommandResult togglePump(PumpAction action, RemoteCommand command) {
        if (config.isAutoMode()) {
            return CommandResult.rejected(fromChat(command)
                ? "⚠️ The system is in automatic mode. Use /manual before controlling the pump."
                : "⚠️ The system is in automatic mode. Switch to manual mode before controlling the pump.");
        }

        CommandSource source = command.origin().commandSource();
        String target = targetDevice();
        config.setLastCommandSource(source);
        boolean published = issue(new PumpCommand(action, source, target));

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("action", action.wireToken());
        status.put("source", source.label());
        status.put("device", target);
        status.put("success", published);
        guard("fanout", () -> fanout.broadcast(HubEvent.of(EventType.PUMP_STATUS, status, clock.instant())));

        if (!published) {
            return CommandResult.rejected("❌ Could not send the command to the pump controller.");
        }
        return CommandResult.ok(action == PumpAction.ON
            ? "✅ Pump ON command sent."
            : "✅ Pump OFF command sent.");
    }

    private boolean issue(PumpCommand command) {
        boolean published;
        try {
            published = device.sendPumpCommand(command);
        } catch (RuntimeException e) {
            log.error("[CORE] Device gateway failed on {}: {}", command.action(), e.getMessage(), e);
            published = false;
        }
        metrics.recordPumpCommand(command, published);
        return published;
    }

    private String targetDevice() {
        SensorReading current = latest;
        return current != null ? current.device() : DEFAULT_DEVICE;
    }

    private static boolean fromChat(RemoteCommand command) {
        return command.origin() == RemoteCommand.Origin.CHAT;
    }

    private static String helpText(RemoteCommand command) {
        StringBuilder sb = new StringBuilder("🤖 <b>AcquaSys commands</b>\n\n");
        if (fromChat(command)) {
            sb.append("Hello, ").append(Html.escape(command.requester())).append("!\n\n");
        }
        sb.append("/status - full system status\n");
        sb.append("/auto - enable automatic mode\n");
        sb.append("/manual - enable manual mode\n");
        sb.append("/ligar or /on - turn the pump on (manual mode)\n");
        sb.append("/desligar or /off - turn the pump off (manual mode)\n");
        sb.append("/help - show this message");
        return sb.toString();
    }

    private void guard(String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            metrics.recordStepFailure(step);
            log.error("[CORE] Step '{}' failed: {}", step, e.getMessage(), e);
        }
    }
}
