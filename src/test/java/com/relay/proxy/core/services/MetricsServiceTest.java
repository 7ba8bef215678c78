package com.relay.proxy.core.services;

import com.relay.proxy.config.AdminConfig;
import com.relay.proxy.config.RelayProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsServiceTest {

    private MetricsService metricsService;

    @AfterEach
    void tearDown() {
        if (metricsService != null) {
            metricsService.shutdown();
        }
    }

    private int startWithAdmin() throws IOException {
        int port;
        try (ServerSocket s = new ServerSocket(0)) {
            port = s.getLocalPort();
        }
        RelayProperties props = new RelayProperties();
        AdminConfig admin = new AdminConfig();
        admin.setPort(port);
        admin.setBindAddress("127.0.0.1");
        props.setAdmin(admin);
        metricsService = new MetricsService(props);
        return port;
    }

    private static HttpResponse<String> get(int port, String path) throws Exception {
        HttpClient client = HttpClient.newHttpClient();
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void health_reportsOkWhileWorkersAreReady() throws Exception {
        int port = startWithAdmin();
        metricsService.setReadyWorkers(() -> 3);

        HttpResponse<String> response = get(port, "/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("OK");
    }

    @Test
    void health_reportsUnavailableWithoutReadyWorkers() throws Exception {
        int port = startWithAdmin();
        metricsService.setReadyWorkers(() -> 0);

        HttpResponse<String> response = get(port, "/health");

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(response.body()).isEqualTo("NO READY WORKERS");
    }

    @Test
    void metrics_exposesRegisteredMeters() throws Exception {
        int port = startWithAdmin();
        metricsService.getRegistry().counter("test.counter").increment();

        HttpResponse<String> response = get(port, "/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("test_counter_total");
    }

    @Test
    void disabledAdminDoesNotBind() throws Exception {
        int port;
        try (ServerSocket s = new ServerSocket(0)) {
            port = s.getLocalPort();
        }
        RelayProperties props = new RelayProperties();
        AdminConfig admin = new AdminConfig();
        admin.setEnabled(false);
        admin.setPort(port);
        props.setAdmin(admin);

        metricsService = new MetricsService(props);

        assertThat(metricsService.getRegistry()).isNotNull();
        try (ServerSocket s = new ServerSocket(port)) {
            assertThat(s.isBound()).isTrue();
        }
    }
}
