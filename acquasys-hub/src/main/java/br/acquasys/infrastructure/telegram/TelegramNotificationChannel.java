package br.acquasys.infrastructure.telegram;

import br.acquasys.application.port.input.HubControl;
import br.acquasys.application.port.output.NotificationChannel;
import br.acquasys.domain.control.RemoteCommand;
import br.acquasys.domain.monitoring.Alert;
import br.acquasys.domain.monitoring.AlertKind;
import br.acquasys.infrastructure.common.ReconnectionPolicy;
import br.acquasys.infrastructure.metrics.HubMetrics;
import br.acquasys.util.Html;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Telegram notification and command channel.
 *
 * Outbound: alerts are rendered as HTML and sent asynchronously to the configured chat.
 * Inbound: a long-poll loop reads bot updates, ignores chats other than the configured one and
 * turns recognised commands into {@link RemoteCommand}s for the core.
 *
 * Runs disabled (alerts logged and dropped, no polling) when the bot token or chat id is missing.
 */
public final class TelegramNotificationChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(TelegramNotificationChannel.class);

    static final int LONG_POLL_SECONDS = 20;
    static final Duration CONFLICT_PAUSE = Duration.ofSeconds(30);

    static final String NON_COMMAND_HINT = "❓ Use /help to see the available commands.";

    private final TelegramBotClient client;
    private final String chatId;
    private final TelegramMessageFormatter formatter;
    private final ReconnectionPolicy backoff;
    private final HubMetrics metrics;
    private final Clock clock;
    private final ScheduledExecutorService poller;

    private volatile HubControl control;
    private volatile boolean stopped = false;
    private long nextOffset = 0;

    public TelegramNotificationChannel(TelegramBotClient client, String chatId, ZoneId zone,
                                       ReconnectionPolicy backoff, HubMetrics metrics, Clock clock) {
        this(client, chatId, zone, backoff, metrics, clock, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "telegram-poller");
            t.setDaemon(true);
            return t;
        }));
    }

    TelegramNotificationChannel(TelegramBotClient client, String chatId, ZoneId zone,
                                ReconnectionPolicy backoff, HubMetrics metrics, Clock clock,
                                ScheduledExecutorService poller) {
        this.client = client;
        this.chatId = chatId == null || chatId.isBlank() ? null : chatId.trim();
        this.formatter = new TelegramMessageFormatter(zone);
        this.backoff = backoff;
        this.metrics = metrics;
        this.clock = clock;
        this.poller = poller;
    }

    public void attach(HubControl control) {
        this.control = control;
    }

    @Override
    public boolean isEnabled() {
        return client != null && chatId != null;
    }

    public void start() {
        if (!isEnabled()) {
            log.warn("[TELEGRAM] Bot token or chat id not configured, notifications disabled");
            return;
        }
        if (control == null) {
            throw new IllegalStateException("HubControl not attached");
        }
        stopped = false;
        poller.execute(this::announceStartup);
        poller.schedule(this::pollLoop, backoff.currentDelay().toMillis(), TimeUnit.MILLISECONDS);
        log.info("[TELEGRAM] Channel started for chat {}", chatId);
    }

    public void stop() {
        stopped = true;
        poller.shutdownNow();
        try {
            poller.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[TELEGRAM] Channel stopped");
    }

    // ═══════════════════════════════════════════════════════════════
    // Outbound
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void sendAlert(Alert alert) {
        deliver(alert);
    }

    /**
     * Send an alert and report whether Telegram accepted it. Completes with false when disabled.
     */
    public CompletableFuture<Boolean> deliver(Alert alert) {
        if (!isEnabled()) {
            log.info("[TELEGRAM] Disabled, alert not sent: {}", alert);
            return CompletableFuture.completedFuture(false);
        }
        return client.sendMessage(chatId, formatter.formatAlert(alert))
            .thenApply(delivered -> {
                metrics.recordNotification(delivered);
                if (delivered) {
                    log.info("[TELEGRAM] ✓ Alert sent: {} - {}", alert.getLevel(), alert.getKind().key());
                } else {
                    log.warn("[TELEGRAM] Alert not delivered: {}", alert.getKind().key());
                }
                return delivered;
            });
    }

    /**
     * Send a test notification on operator request.
     */
    public CompletableFuture<Boolean> sendTestNotification() {
        return deliver(Alert.builder()
            .kind(AlertKind.TEST_NOTIFICATION)
            .device("AcquaSys Hub")
            .message("🧪 Test notification: the alert channel is working.")
            .timestamp(clock.instant())
            .build());
    }

    private void reply(String targetChat, String text) {
        client.sendMessage(targetChat, text);
    }

    private void announceStartup() {
        try {
            String bot = client.getMe();
            log.info("[TELEGRAM] 🤖 Bot connected: {}", bot);
            deliver(Alert.builder()
                .kind(AlertKind.SYSTEM_STARTED)
                .device("AcquaSys Hub")
                .message("🚀 AcquaSys hub started, monitoring active!")
                .timestamp(clock.instant())
                .build());
        } catch (TelegramApiException e) {
            log.error("[TELEGRAM] Bot check failed: {}", e.getMessage());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Inbound
    // ═══════════════════════════════════════════════════════════════

    private void pollLoop() {
        if (stopped) {
            return;
        }
        Duration next;
        try {
            next = pollOnce();
        } catch (RuntimeException e) {
            log.error("[TELEGRAM] Poll loop error: {}", e.getMessage(), e);
            next = backoff.recordFailure();
        }
        if (!stopped) {
            poller.schedule(this::pollLoop, next.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * One long-poll round.
     *
     * @return delay before the next round
     */
    Duration pollOnce() {
        List<TelegramUpdate> updates;
        try {
            updates = client.getUpdates(nextOffset, LONG_POLL_SECONDS);
        } catch (TelegramApiException e) {
            if (e.isConflict()) {
                log.warn("[TELEGRAM] ⚠️ Another process is polling this bot (409), pausing {}s",
                    CONFLICT_PAUSE.toSeconds());
                return CONFLICT_PAUSE;
            }
            Duration delay = backoff.recordFailure();
            log.warn("[TELEGRAM] Polling failed, retrying in {} ms: {}", delay.toMillis(), e.getMessage());
            return delay;
        }

        backoff.recordSuccess();
        for (TelegramUpdate update : updates) {
            nextOffset = Math.max(nextOffset, update.updateId() + 1);
            handleUpdate(update);
        }
        return backoff.currentDelay();
    }

    void handleUpdate(TelegramUpdate update) {
        if (update.text() == null || update.chatId() == null) {
            return;
        }
        if (!update.chatId().equals(chatId)) {
            log.warn("[TELEGRAM] Ignoring command from unauthorized chat {}", update.chatId());
            return;
        }

        String text = update.text().trim();
        log.info("[TELEGRAM] 📩 Command from {}: {}", update.fromName(), text);

        if (!ChatCommand.isCommand(text)) {
            reply(update.chatId(), NON_COMMAND_HINT);
            return;
        }

        Optional<RemoteCommand.Kind> kind = ChatCommand.resolve(text);
        if (kind.isEmpty()) {
            reply(update.chatId(), "❓ Unknown command \"" + Html.escape(text)
                + "\".\nUse /help.");
            return;
        }

        control.submitCommand(new RemoteCommand(kind.get(), RemoteCommand.Origin.CHAT, update.fromName()))
            .thenAccept(result -> reply(update.chatId(), result.message()));
    }
}
