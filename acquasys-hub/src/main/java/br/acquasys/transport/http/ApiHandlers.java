package br.acquasys.transport.http;

import br.acquasys.application.port.input.HubControl;
import br.acquasys.application.port.output.DeviceGateway;
import br.acquasys.application.port.output.FanoutGateway;
import br.acquasys.application.port.output.TelemetrySink;
import br.acquasys.domain.control.CommandResult;
import br.acquasys.domain.control.RemoteCommand;
import br.acquasys.domain.telemetry.SensorReading;
import br.acquasys.infrastructure.telegram.TelegramNotificationChannel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * REST endpoints for the dashboard:
 * - GET  /api/health - transport, store, chat and subscriber status
 * - GET  /api/sensor-data/latest - latest reading (404 when none)
 * - GET  /api/sensor-data/history?hours=24&limit=50 - recent readings, newest first
 * - GET  /api/system-config - operating config
 * - GET  /api/status - structured status
 * - POST /api/pump/control {action} - pump and mode control
 * - POST /api/telegram/test - test notification
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final long COMMAND_TIMEOUT_SECONDS = 10;
    private static final int MAX_HISTORY_LIMIT = 1000;

    private final HubControl control;
    private final TelemetrySink sink;
    private final DeviceGateway device;
    private final FanoutGateway fanout;
    private final TelegramNotificationChannel telegram;

    public ApiHandlers(HubControl control, TelemetrySink sink, DeviceGateway device,
                       FanoutGateway fanout, TelegramNotificationChannel telegram) {
        this.control = control;
        this.sink = sink;
        this.device = device;
        this.fanout = fanout;
        this.telegram = telegram;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) throws Exception {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "ok");
        health.put("transport", device.connectionState().name());
        health.put("storeDegraded", sink.isDegraded());
        health.put("telegramEnabled", telegram.isEnabled());
        health.put("wsClients", fanout.subscriberCount());
        health.put("hasData", control.latestReading().isPresent());
        sendJson(exchange, StatusCodes.OK, health);
    }

    /**
     * GET /api/sensor-data/latest
     */
    public void latestReading(HttpServerExchange exchange) throws Exception {
        Optional<SensorReading> latest = control.latestReading().or(sink::latest);
        if (latest.isEmpty()) {
            sendJson(exchange, StatusCodes.NOT_FOUND, Map.of("error", "No sensor data received yet"));
            return;
        }
        sendJson(exchange, StatusCodes.OK, latest.get());
    }

    /**
     * GET /api/sensor-data/history?hours=24&limit=50
     */
    public void history(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::history);
            return;
        }
        int hours;
        int limit;
        try {
            hours = intParam(exchange, "hours", 24);
            limit = intParam(exchange, "limit", 50);
        } catch (NumberFormatException e) {
            sendJson(exchange, StatusCodes.BAD_REQUEST, Map.of("error", "hours and limit must be integers"));
            return;
        }
        if (hours <= 0 || limit <= 0) {
            sendJson(exchange, StatusCodes.BAD_REQUEST, Map.of("error", "hours and limit must be positive"));
            return;
        }

        List<SensorReading> readings = sink.recent(Duration.ofHours(hours), Math.min(limit, MAX_HISTORY_LIMIT));
        sendJson(exchange, StatusCodes.OK, readings);
    }

    /**
     * GET /api/system-config
     */
    public void systemConfig(HttpServerExchange exchange) throws Exception {
        sendJson(exchange, StatusCodes.OK, control.configSnapshot());
    }

    /**
     * GET /api/status
     */
    public void status(HttpServerExchange exchange) throws Exception {
        sendJson(exchange, StatusCodes.OK, control.statusSnapshot());
    }

    /**
     * POST /api/pump/control {"action": "on" | "off" | "auto" | "manual"}
     *
     * Blocks a worker thread until the orchestration loop has handled the command.
     */
    public void pumpControl(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::pumpControl);
            return;
        }
        exchange.startBlocking();
        String body = new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8);

        String action;
        try {
            JsonNode json = MAPPER.readTree(body);
            action = json == null ? null : json.path("action").asText(null);
        } catch (JsonProcessingException e) {
            sendJson(exchange, StatusCodes.BAD_REQUEST, CommandResult.rejected("Invalid JSON body"));
            return;
        }

        Optional<RemoteCommand.Kind> kind = RemoteCommand.Kind.forControlAction(action);
        if (kind.isEmpty()) {
            sendJson(exchange, StatusCodes.BAD_REQUEST,
                CommandResult.rejected("Unknown action '" + action + "'. Use on, off, auto or manual."));
            return;
        }

        CommandResult result;
        try {
            result = control.submitCommand(RemoteCommand.of(kind.get(), RemoteCommand.Origin.HTTP))
                .get(COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("[HTTP] Pump control '{}' timed out", action);
            result = CommandResult.rejected("Command timed out");
        } catch (ExecutionException e) {
            log.error("[HTTP] Pump control '{}' failed: {}", action, e.getMessage(), e);
            result = CommandResult.rejected("Command failed");
        }
        sendJson(exchange, StatusCodes.OK, result);
    }

    /**
     * POST /api/telegram/test
     */
    public void telegramTest(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::telegramTest);
            return;
        }
        boolean delivered;
        try {
            delivered = telegram.sendTestNotification().get(COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException | ExecutionException e) {
            log.warn("[HTTP] Telegram test failed: {}", e.getMessage());
            delivered = false;
        }
        sendJson(exchange, StatusCodes.OK, Map.of("success", delivered));
    }

    private static int intParam(HttpServerExchange exchange, String name, int defaultValue) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.peekFirst().isBlank()) {
            return defaultValue;
        }
        return Integer.parseInt(values.peekFirst().trim());
    }

    private static void sendJson(HttpServerExchange exchange, int status, Object data) throws IOException {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }
}
