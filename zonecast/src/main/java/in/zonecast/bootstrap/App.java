package in.zonecast.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.zonecast.application.port.input.CandleSource;
import in.zonecast.application.port.output.EventStore;
import in.zonecast.infrastructure.broker.BrokerConfig;
import in.zonecast.infrastructure.broker.RestBrokerGateway;
import in.zonecast.infrastructure.broker.metrics.PrometheusBrokerMetrics;
import in.zonecast.infrastructure.metrics.PipelineMetrics;
import in.zonecast.infrastructure.metrics.PrometheusMetricsHandler;
import in.zonecast.infrastructure.persistence.InMemoryCandleSource;
import in.zonecast.infrastructure.persistence.InMemoryEventStore;
import in.zonecast.infrastructure.persistence.PostgresCandleSource;
import in.zonecast.infrastructure.persistence.PostgresEventStore;
import in.zonecast.service.core.CoreService;
import in.zonecast.service.decision.DecisionConfig;
import in.zonecast.service.execution.BrokerGateway;
import in.zonecast.service.execution.OrderLifecycle;
import in.zonecast.service.execution.SimulatedBrokerGateway;
import in.zonecast.service.report.ReportService;
import in.zonecast.service.state.StreamState;
import in.zonecast.transport.http.PhaseHandlers;
import in.zonecast.transport.ws.EventDistributor;
import in.zonecast.transport.ws.WsEndpoint;
import in.zonecast.util.Env;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("=== zonecast starting ===");

        int port = Env.getInt("PORT", 9090);
        int windowCap = Env.getInt("CANDLE_WINDOW_CAP", StreamState.DEFAULT_WINDOW_CAP);
        int pendingCap = Env.getInt("PENDING_BUFFER_CAP", EventDistributor.DEFAULT_PENDING_CAP);
        String brokerMode = Env.get("BROKER_MODE", "simulated").toLowerCase(Locale.ROOT);

        // Metrics
        CollectorRegistry registry = CollectorRegistry.defaultRegistry;
        PipelineMetrics pipelineMetrics = new PipelineMetrics(registry);
        PrometheusBrokerMetrics brokerMetrics = new PrometheusBrokerMetrics(registry);

        // Persistence
        HikariDataSource dataSource = createDataSource();
        CandleSource candleSource;
        EventStore eventStore;
        if (dataSource != null) {
            candleSource = new PostgresCandleSource(dataSource);
            eventStore = new PostgresEventStore(dataSource);
            log.info("[BOOT] Using PostgreSQL candles and event store");
        } else {
            candleSource = new InMemoryCandleSource();
            eventStore = new InMemoryEventStore();
            log.warn("[BOOT] DB_URL not set, using in-memory candles and event store (no data until published)");
        }

        // Broker
        BrokerGateway gateway;
        if ("rest".equals(brokerMode)) {
            gateway = new RestBrokerGateway(BrokerConfig.fromEnv(), brokerMetrics);
        } else {
            gateway = new SimulatedBrokerGateway();
        }
        log.info("[BOOT] Broker gateway: {}", gateway.name());

        ExecutorService brokerExecutor = Executors.newFixedThreadPool(2, named("broker"));
        ExecutorService streamExecutor = Executors.newCachedThreadPool(named("stream"));
        OrderLifecycle lifecycle = new OrderLifecycle(gateway, brokerExecutor);

        // Distribution and phases
        EventDistributor distributor = new EventDistributor(pendingCap, pipelineMetrics);
        CoreService coreService = new CoreService(candleSource, eventStore, distributor, pipelineMetrics,
            DecisionConfig.fromEnv(), lifecycle, streamExecutor, windowCap, Clock.systemUTC());
        distributor.setControlListener(coreService);
        distributor.start();

        ReportService reportService = new ReportService(eventStore);
        PhaseHandlers api = new PhaseHandlers(coreService, reportService);
        WsEndpoint wsEndpoint = new WsEndpoint(distributor);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(registry);

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .put("/api/phase/start", api::startPhase)
            .put("/api/phase/stop", api::stopPhase)
            .get("/api/phase/events", api::events)
            .get("/api/report", api::report)
            .get("/api/calendar/isTradingDay", api::isTradingDay)
            .get("/ws", wsEndpoint.websocketHandler())
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "zonecast\n\n" +
                    "API: GET /api/health, PUT /api/phase/start, PUT /api/phase/stop, GET /api/phase/events\n" +
                    "     GET /api/report, GET /api/calendar/isTradingDay, GET /metrics\n" +
                    "WS:  ws://localhost:" + port + "/ws\n"
                );
            });

        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, PUT, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(corsHandler)
            .build();
        server.start();
        log.info("[BOOT] zonecast started on http://localhost:{}/", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("[BOOT] Shutting down");
            coreService.stopAll();
            server.stop();
            distributor.stop();
            streamExecutor.shutdownNow();
            brokerExecutor.shutdown();
            try {
                if (!brokerExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                    brokerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            candleSource.close();
        }, "shutdown"));
    }

    /**
     * Hikari pool when DB_URL is set, otherwise null.
     */
    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", null);
        if (url == null || url.isBlank()) {
            return null;
        }
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASSWORD", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("zonecast-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private App() {}
}
