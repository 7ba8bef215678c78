package com.relay.proxy;

import com.relay.proxy.config.RelayProperties;
import com.relay.proxy.core.constants.DeadWorkerPolicy;
import com.relay.proxy.core.exceptions.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class RelayProxyApplicationTest {

    @TempDir
    Path tempDir;

    private static int freePort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    private Path writeConfig(String yaml) throws IOException {
        Path configFile = tempDir.resolve("relay.yml");
        Files.writeString(configFile, yaml);
        return configFile;
    }

    private static String validYaml(int port) {
        return "server:\n" +
                "  listenPort: " + port + "\n" +
                "  bindAddress: 127.0.0.1\n" +
                "  workerCount: 2\n" +
                "  upstreams:\n" +
                "    - id: backend\n" +
                "      url: localhost:1\n" +
                "  rules:\n" +
                "    - path: /\n" +
                "      upstreams: [backend]\n" +
                "admin:\n" +
                "  enabled: false\n" +
                "logging:\n" +
                "  format: '%h %r %w'\n";
    }

    @Test
    void main_withHelpOption_returnsZero() {
        int exitCode = new CommandLine(new RelayProxyApplication()).execute("--help");
        assertThat(exitCode).isZero();
    }

    @Test
    void main_withVersionOption_returnsZero() {
        int exitCode = new CommandLine(new RelayProxyApplication()).execute("--version");
        assertThat(exitCode).isZero();
    }

    @Test
    void call_withValidConfig_startsListener() throws Exception {
        int port = freePort();
        Path configFile = writeConfig(validYaml(port));

        RelayProxyApplication app = new RelayProxyApplication();
        CommandLine cmd = new CommandLine(app);
        Thread appThread = new Thread(() -> cmd.execute("-c", configFile.toAbsolutePath().toString()));
        appThread.setDaemon(true);
        appThread.start();

        await().atMost(Duration.ofSeconds(10)).until(() -> {
            try (Socket s = new Socket("127.0.0.1", port)) {
                return s.isConnected();
            } catch (IOException e) {
                return false;
            }
        });
        assertThat(app.getListenPort()).isEqualTo(port);
        assertThatCode(() -> app.processCommand("status")).doesNotThrowAnyException();

        app.processCommand("stop");

        await().atMost(Duration.ofSeconds(10)).until(() -> !appThread.isAlive());
    }

    @Test
    void call_withInvalidYaml_returnsError() throws Exception {
        Path configFile = writeConfig("invalid yaml content: !!!");

        int exitCode = new CommandLine(new RelayProxyApplication()).execute("-c", configFile.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void call_withMissingFile_returnsError() {
        int exitCode = new CommandLine(new RelayProxyApplication())
                .execute("-c", tempDir.resolve("missing.yml").toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void call_withUnknownUpstreamReference_returnsError() throws Exception {
        int port = freePort();
        Path configFile = writeConfig(validYaml(port).replace("upstreams: [backend]", "upstreams: [dummy]"));

        int exitCode = new CommandLine(new RelayProxyApplication()).execute("-c", configFile.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void loadConfig_readsBundledClasspathConfig() {
        RelayProperties props = RelayProxyApplication.loadConfig("relay-proxy.yml");

        assertThat(props.getServer().getListenPort()).isEqualTo(8000);
        assertThat(props.getServer().getDeadWorkerPolicy()).isEqualTo(DeadWorkerPolicy.DEGRADE);
        assertThat(props.getServer().getRules()).hasSize(2);
        assertThat(props.getAdmin().getPort()).isEqualTo(9090);
    }

    @Test
    void loadConfig_fillsMissingOptionalSections() throws Exception {
        Path configFile = writeConfig("server:\n  listenPort: 8081\n");

        RelayProperties props = RelayProxyApplication.loadConfig(configFile.toString());

        assertThat(props.getAdmin()).isNotNull();
        assertThat(props.getLogging()).isNotNull();
        assertThat(props.getServer().getListenPort()).isEqualTo(8081);
    }

    @Test
    void loadConfig_rejectsEmptyFile() throws Exception {
        Path configFile = writeConfig("");

        assertThatThrownBy(() -> RelayProxyApplication.loadConfig(configFile.toString()))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void loadConfig_rejectsMissingServerSection() throws Exception {
        Path configFile = writeConfig("admin:\n  enabled: false\n");

        assertThatThrownBy(() -> RelayProxyApplication.loadConfig(configFile.toString()))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("server");
    }
}
