package com.relay.proxy.core.services;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.IntSupplier;

import com.relay.proxy.config.AdminConfig;
import com.relay.proxy.config.RelayProperties;
import com.relay.proxy.core.utils.NamedThreadFactory;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service providing application metrics via Micrometer and a simple HTTP admin
 * server.
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);
    private final PrometheusMeterRegistry registry;
    private final AdminConfig config;
    private volatile IntSupplier readyWorkers = () -> 1;
    private HttpServer adminServer;
    private ExecutorService adminExecutor;

    public MetricsService(RelayProperties properties) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = properties.getAdmin();
        setupAdminServer();
    }

    /**
     * Sets the source of the ready worker count reported by {@code /health}.
     *
     * @param readyWorkers Supplier of the number of READY workers.
     */
    public void setReadyWorkers(IntSupplier readyWorkers) {
        this.readyWorkers = readyWorkers;
    }

    private void setupAdminServer() {
        if (!config.isEnabled()) {
            return;
        }

        try {
            this.adminServer = HttpServer.create(new InetSocketAddress(config.getBindAddress(), config.getPort()), 0);

            // Healthy while at least one worker can take requests
            adminServer.createContext("/health", exchange -> {
                if (readyWorkers.getAsInt() > 0) {
                    respond(exchange, 200, "OK");
                } else {
                    respond(exchange, 503, "NO READY WORKERS");
                }
            });

            // Metrics endpoint (Prometheus format)
            adminServer.createContext("/metrics", exchange -> respond(exchange, 200, registry.scrape()));

            adminExecutor = Executors.newFixedThreadPool(2, new NamedThreadFactory("admin-"));
            adminServer.setExecutor(adminExecutor);
            adminServer.start();
            log.info("Admin server started on port {} (/health, /metrics)", config.getPort());
        } catch (IOException e) {
            log.error("Failed to start admin server: {}", e.getMessage());
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    public void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server...");
            adminServer.stop(0);
            adminServer = null;
        }
        if (adminExecutor != null) {
            adminExecutor.shutdownNow();
            adminExecutor = null;
        }
    }
}
