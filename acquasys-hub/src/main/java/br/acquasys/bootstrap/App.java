package br.acquasys.bootstrap;

import br.acquasys.application.orchestration.OrchestrationCore;
import br.acquasys.domain.config.EfficiencyModel;
import br.acquasys.domain.config.SystemOperatingConfig;
import br.acquasys.infrastructure.common.ReconnectionPolicy;
import br.acquasys.infrastructure.metrics.PrometheusHubMetrics;
import br.acquasys.infrastructure.metrics.PrometheusMetricsHandler;
import br.acquasys.infrastructure.mqtt.PahoDeviceTransport;
import br.acquasys.infrastructure.mqtt.TelemetryIngressAdapter;
import br.acquasys.infrastructure.mqtt.TelemetryParser;
import br.acquasys.infrastructure.storage.PostgresTimeSeriesStore;
import br.acquasys.infrastructure.storage.ReadingRingBuffer;
import br.acquasys.infrastructure.storage.TimeSeriesSink;
import br.acquasys.infrastructure.telegram.TelegramBotClient;
import br.acquasys.infrastructure.telegram.TelegramNotificationChannel;
import br.acquasys.migration.SensorReadingsMigration;
import br.acquasys.transport.http.ApiHandlers;
import br.acquasys.transport.ws.WsHub;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Composition root: wires adapters around the orchestration core and starts the HTTP/WebSocket
 * server.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== AcquaSys Hub Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        HubConfig config = HubConfig.fromEnv();
        StartupConfigValidator.validate(config);
        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusHubMetrics metrics = new PrometheusHubMetrics();

        // ═══════════════════════════════════════════════════════════════
        // Database + time-series sink
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config.database());
        boolean schemaReady = new SensorReadingsMigration(dataSource).migrate();
        TimeSeriesSink sink = new TimeSeriesSink(
            new PostgresTimeSeriesStore(dataSource), new ReadingRingBuffer(), metrics, clock);
        if (!schemaReady) {
            log.warn("[SINK] Starting with in-memory history until the database is reachable");
        }

        // ═══════════════════════════════════════════════════════════════
        // Device transport (MQTT)
        // ═══════════════════════════════════════════════════════════════
        HubConfig.Mqtt mqtt = config.mqtt();
        TelemetryIngressAdapter ingress = new TelemetryIngressAdapter(
            new PahoDeviceTransport(mqtt.host(), mqtt.port(), mqtt.clientId(), mqtt.username(), mqtt.password()),
            mqtt.topics(),
            new TelemetryParser(clock),
            ReconnectionPolicy.forDeviceTransport(),
            metrics);

        // ═══════════════════════════════════════════════════════════════
        // Notification channel (Telegram)
        // ═══════════════════════════════════════════════════════════════
        TelegramBotClient botClient = config.telegramBotToken() != null
            ? new TelegramBotClient(config.telegramBotToken())
            : null;
        TelegramNotificationChannel telegram = new TelegramNotificationChannel(
            botClient, config.telegramChatId(), config.zone(), ReconnectionPolicy.forChatPolling(), metrics, clock);

        // ═══════════════════════════════════════════════════════════════
        // Fan-out (WebSocket)
        // ═══════════════════════════════════════════════════════════════
        WsHub wsHub = new WsHub(config.wsToken(), metrics, clock);

        // ═══════════════════════════════════════════════════════════════
        // Orchestration core
        // ═══════════════════════════════════════════════════════════════
        ExecutorService eventLoop = Executors.newSingleThreadExecutor(r -> new Thread(r, "orchestration-loop"));
        OrchestrationCore core = new OrchestrationCore(
            ingress,
            sink,
            telegram,
            wsHub,
            new SystemOperatingConfig(config.lowThreshold(), config.highThreshold()),
            config.alertThresholds(),
            EfficiencyModel.defaults(),
            metrics,
            clock,
            config.zone(),
            eventLoop);

        ingress.attach(core);
        telegram.attach(core);
        wsHub.attach(core);

        // ═══════════════════════════════════════════════════════════════
        // HTTP API + WebSocket
        // ═══════════════════════════════════════════════════════════════
        ApiHandlers api = new ApiHandlers(core, sink, ingress, wsHub, telegram);
        RoutingHandler routes = Handlers.routing()
            .get("/api/health", api::health)
            .get("/api/sensor-data/latest", api::latestReading)
            .get("/api/sensor-data/history", api::history)
            .get("/api/system-config", api::systemConfig)
            .get("/api/status", api::status)
            .post("/api/pump/control", api::pumpControl)
            .post("/api/telegram/test", api::telegramTest)
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/ws", wsHub.websocketHandler());

        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(corsHandler)
            .build();

        sink.start();
        wsHub.start();
        server.start();
        log.info("✓ HTTP API on http://localhost:{}/api, WebSocket on ws://localhost:{}/ws", config.port(), config.port());
        ingress.start();
        telegram.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down AcquaSys hub...");
            telegram.stop();
            ingress.stop();
            server.stop();
            wsHub.stop();
            eventLoop.shutdown();
            try {
                if (!eventLoop.awaitTermination(5, TimeUnit.SECONDS)) {
                    eventLoop.shutdownNow();
                }
            } catch (InterruptedException e) {
                eventLoop.shutdownNow();
                Thread.currentThread().interrupt();
            }
            sink.stop();
            dataSource.close();
            log.info("AcquaSys hub stopped");
        }, "shutdown"));

        log.info("✓ AcquaSys hub started");
    }

    private static HikariDataSource createDataSource(HubConfig.Database db) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(db.url());
        config.setUsername(db.user());
        config.setPassword(db.password());
        config.setMaximumPoolSize(db.poolSize());
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5000);
        // Start even when the database is down; the sink serves memory until it comes back
        config.setInitializationFailTimeout(-1);
        config.setPoolName("acquasys-hikari");

        log.info("DB: url={}, user={}, pool={}", db.url(), db.user(), db.poolSize());
        return new HikariDataSource(config);
    }

    private App() {}
}
