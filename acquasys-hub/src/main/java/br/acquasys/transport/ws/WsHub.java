package br.acquasys.transport.ws;

import br.acquasys.application.port.input.HubControl;
import br.acquasys.application.port.output.FanoutGateway;
import br.acquasys.domain.common.EventType;
import br.acquasys.domain.common.HubEvent;
import br.acquasys.domain.control.CommandResult;
import br.acquasys.domain.control.RemoteCommand;
import br.acquasys.infrastructure.metrics.HubMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Undertow WebSocket hub for live dashboards:
 * - Optional shared token (?token=xxx) when configured
 * - Current config and latest reading pushed on connect
 * - Broadcast of hub events to every open channel
 * - Inbound pump control answered with a commandResult envelope
 * - Keep-alive ping every 30 seconds
 */
public final class WsHub implements FanoutGateway {
    private static final Logger log = LoggerFactory.getLogger(WsHub.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final long PING_INTERVAL_SECONDS = 30;

    private final Set<WebSocketChannel> channels = ConcurrentHashMap.newKeySet();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ws-keepalive");
        t.setDaemon(true);
        return t;
    });

    private final String requiredToken;
    private final HubMetrics metrics;
    private final Clock clock;
    private volatile HubControl control;

    /**
     * @param requiredToken shared secret expected in {@code ?token=}, or null to accept everyone
     */
    public WsHub(String requiredToken, HubMetrics metrics, Clock clock) {
        this.requiredToken = requiredToken == null || requiredToken.isBlank() ? null : requiredToken;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void attach(HubControl control) {
        this.control = Objects.requireNonNull(control, "control");
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::sendKeepAlive, PING_INTERVAL_SECONDS, PING_INTERVAL_SECONDS, TimeUnit.SECONDS);
        log.info("[WS] Hub started (token {}, ping every {}s)",
            requiredToken == null ? "not required" : "required", PING_INTERVAL_SECONDS);
    }

    public void stop() {
        scheduler.shutdownNow();
        for (WebSocketChannel channel : List.copyOf(channels)) {
            cleanup(channel);
        }
        log.info("[WS] Hub stopped");
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                if (requiredToken != null && !requiredToken.equals(extractToken(exchange.getQueryString()))) {
                    log.warn("[WS] Connection rejected: invalid token from {}", channel.getSourceAddress());
                    closeQuietly(channel);
                    return;
                }

                channels.add(channel);
                metrics.updateSubscriberCount(channels.size());
                log.info("[WS] Client connected: {} ({} total)", channel.getSourceAddress(), channels.size());

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        handleClientMessage(ch, message.getData());
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        cleanup(ch);
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("[WS] Channel error: {}", error.toString());
                        cleanup(ch);
                    }
                });
                channel.resumeReceives();

                sendInitialState(channel);
            }
        });
    }

    static String extractToken(String query) {
        if (query == null) {
            return null;
        }
        for (String param : query.split("&")) {
            if (param.startsWith("token=")) {
                return param.substring(6);
            }
        }
        return null;
    }

    private void sendInitialState(WebSocketChannel channel) {
        HubControl core = control;
        if (core == null) {
            return;
        }
        sendDirect(channel, HubEvent.of(EventType.SYSTEM_CONFIG, core.configSnapshot(), clock.instant()));
        core.latestReading().ifPresent(reading ->
            sendDirect(channel, HubEvent.of(EventType.SENSOR_DATA, reading, clock.instant())));
    }

    void handleClientMessage(WebSocketChannel channel, String raw) {
        JsonNode msg;
        try {
            msg = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("[WS] Invalid JSON from {}: {}", channel.getSourceAddress(), e.getOriginalMessage());
            sendResult(channel, CommandResult.rejected("Invalid JSON"));
            return;
        }

        String type = msg.path("type").asText("");
        switch (type) {
            case "controlPump" -> {
                Optional<RemoteCommand.Kind> kind = RemoteCommand.Kind.forControlAction(msg.path("action").asText(null));
                if (kind.isEmpty()) {
                    sendResult(channel, CommandResult.rejected("Unknown action: " + msg.path("action").asText("")));
                    return;
                }
                control.submitCommand(RemoteCommand.of(kind.get(), RemoteCommand.Origin.DASHBOARD))
                    .thenAccept(result -> sendResult(channel, result));
            }
            case "ping" -> sendDirect(channel, HubEvent.of(EventType.PING, Map.of("pong", true), clock.instant()));
            default -> {
                log.debug("[WS] Ignoring message type '{}'", type);
                sendResult(channel, CommandResult.rejected("Unknown message type: " + type));
            }
        }
    }

    private void sendResult(WebSocketChannel channel, CommandResult result) {
        sendDirect(channel, HubEvent.of(EventType.COMMAND_RESULT, result, clock.instant()));
    }

    private void sendKeepAlive() {
        try {
            broadcast(HubEvent.of(EventType.PING, Map.of("clients", channels.size()), clock.instant()));
        } catch (RuntimeException e) {
            log.error("[WS] Keep-alive failed: {}", e.getMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // FanoutGateway
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void broadcast(HubEvent event) {
        if (channels.isEmpty()) {
            return;
        }
        String json = serialize(event);
        if (json == null) {
            return;
        }
        for (WebSocketChannel channel : List.copyOf(channels)) {
            send(channel, json);
        }
    }

    @Override
    public int subscriberCount() {
        return channels.size();
    }

    private void sendDirect(WebSocketChannel channel, HubEvent event) {
        String json = serialize(event);
        if (json != null) {
            send(channel, json);
        }
    }

    private void send(WebSocketChannel channel, String json) {
        if (!channel.isOpen()) {
            cleanup(channel);
            return;
        }
        WebSockets.sendText(json, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                log.warn("[WS] Send to {} failed, dropping client: {}", ch.getSourceAddress(), throwable.toString());
                cleanup(ch);
            }
        });
    }

    private String serialize(HubEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("[WS] Failed to serialize {} event: {}", event.type().wireName(), e.toString());
            return null;
        }
    }

    private void cleanup(WebSocketChannel channel) {
        if (channels.remove(channel)) {
            metrics.updateSubscriberCount(channels.size());
            log.info("[WS] Client disconnected: {} ({} total)", channel.getSourceAddress(), channels.size());
        }
        closeQuietly(channel);
    }

    private static void closeQuietly(WebSocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[WS] Close failed: {}", e.getMessage());
        }
    }
}
