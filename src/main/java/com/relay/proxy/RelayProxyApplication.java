package com.relay.proxy;

import com.relay.proxy.config.AdminConfig;
import com.relay.proxy.config.LoggingConfig;
import com.relay.proxy.config.RelayProperties;
import com.relay.proxy.config.ServerConfig;
import com.relay.proxy.core.dispatch.Dispatcher;
import com.relay.proxy.core.exceptions.ConfigException;
import com.relay.proxy.core.exceptions.ProxyException;
import com.relay.proxy.core.forward.HttpUpstreamForwarder;
import com.relay.proxy.core.routing.RoutingTable;
import com.relay.proxy.core.services.LoggingService;
import com.relay.proxy.core.services.MetricsService;
import com.relay.proxy.core.worker.WorkerHandle;
import com.relay.proxy.core.worker.WorkerPool;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Scanner;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Relay Proxy application.
 * Handles command-line arguments, configuration loading, and application
 * lifecycle.
 */
@Command(name = "relay-proxy", mixinStandardHelpOptions = true, version = "1.0.0", description = "Path-routing reverse proxy backed by a pool of isolated workers.")
public class RelayProxyApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RelayProxyApplication.class);

    /** Seconds to wait for the listener to bind before giving up. */
    private static final long BIND_TIMEOUT_SECONDS = 5;

    /**
     * Path to the YAML configuration file.
     */
    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "relay-proxy.yml")
    private String configPath;

    private HttpUpstreamForwarder forwarder;
    private WorkerPool workerPool;
    private Dispatcher dispatcher;
    private LoggingService loggingService;
    private MetricsService metricsService;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /** Flag to signal background threads to stop. */
    private final AtomicBoolean running = new AtomicBoolean(true);

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    /**
     * Main method to launch the application.
     *
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new RelayProxyApplication()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Bootstraps the application: loads and validates the configuration, starts
     * the worker pool and the listener, then blocks until shutdown.
     *
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Relay Proxy...");

            RelayProperties props = loadConfig(configPath);
            ServerConfig serverConfig = props.getServer();
            RoutingTable routingTable = RoutingTable.from(serverConfig);

            this.loggingService = new LoggingService(props.getLogging());
            this.metricsService = new MetricsService(props);
            this.forwarder = new HttpUpstreamForwarder(serverConfig.getConnectTimeout(),
                    serverConfig.getRequestTimeout());
            this.workerPool = new WorkerPool(serverConfig, routingTable, forwarder);
            metricsService.setReadyWorkers(workerPool::readyCount);

            this.dispatcher = new Dispatcher(serverConfig, workerPool, loggingService, metricsService.getRegistry());
            Thread acceptThread = new Thread(dispatcher::start, "dispatcher-accept");
            acceptThread.setDaemon(true);
            acceptThread.start();
            if (!dispatcher.awaitBind(BIND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                throw new ProxyException("Listener failed to bind on port " + serverConfig.getListenPort());
            }

            if (System.getProperty("relay.no-command-listener") == null) {
                startCommandListener();
            }

            if (System.getProperty("relay.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (ProxyException e) {
            log.error("Fatal proxy error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Starts an interactive command listener on System.in.
     */
    private void startCommandListener() {
        Thread listener = new Thread(() -> {
            try (Scanner scanner = new Scanner(System.in, StandardCharsets.UTF_8)) {
                log.info("Interactive console ready. Type 'status' for pool state or 'stop' to exit.");
                while (running.get() && readAndProcessCommand(scanner)) {
                    // Loop continues as long as input is available and stop hasn't been signaled
                }
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("Command listener fatal error: {}", e.getMessage(), e);
                }
            }
        }, "CommandListener");
        listener.setDaemon(true);
        listener.start();
    }

    private boolean readAndProcessCommand(Scanner scanner) {
        try {
            if (scanner.hasNextLine()) {
                processCommand(scanner.nextLine().trim().toLowerCase(Locale.ROOT));
                return true;
            }
        } catch (NoSuchElementException e) {
            log.debug("Console input closed");
        }
        return false;
    }

    /**
     * Processes a single interactive command from the console.
     *
     * @param command The command string.
     */
    void processCommand(String command) {
        if (command.isEmpty()) {
            return;
        }

        switch (command) {
            case "status" -> logStatus();
            case "stop", "exit", "quit" -> stop();
            case "help" -> log.info("Available commands: status, stop, exit, quit, help");
            default -> log.warn("Unknown command: {}. Type 'help' for available commands.", command);
        }
    }

    private void logStatus() {
        if (workerPool == null) {
            log.info("Worker pool not started");
            return;
        }
        log.info("Workers ready: {}/{}, pending replies: {}, dead worker policy: {}", workerPool.readyCount(),
                workerPool.size(), workerPool.pendingCount(), workerPool.getDeadWorkerPolicy());
        for (WorkerHandle handle : workerPool.handles()) {
            log.info("  worker {} (slot {}): {} pending={} dispatched={}", handle.getId(), handle.getSlot(),
                    handle.getState(), handle.pendingCount(), handle.dispatchedCount());
        }
    }

    /**
     * Gracefully stops the listener, the worker pool and the admin server.
     * Also unregisters the shutdown hook.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Relay Proxy...");

            unregisterShutdownHook();

            if (dispatcher != null) {
                dispatcher.stop();
            }
            if (workerPool != null) {
                workerPool.shutdown();
            }
            if (forwarder != null) {
                forwarder.close();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            shutdownLatch.countDown();
        }
    }

    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown already in progress");
            }
        }
    }

    /**
     * Retrieves the port the listener is bound to.
     *
     * @return The local port, or -1 before startup.
     */
    int getListenPort() {
        return dispatcher != null ? dispatcher.getLocalPort() : -1;
    }

    /**
     * Loads the configuration from the specified path or classpath.
     *
     * @param path Path to the configuration file.
     * @return Loaded RelayProperties.
     * @throws ConfigException if configuration cannot be loaded.
     */
    static RelayProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(RelayProperties.class, new LoaderOptions()));

        // 1. Try absolute/relative path
        RelayProperties fromFile = tryLoadFromFile(yaml, path);
        if (fromFile != null) {
            return fromFile;
        }

        // 2. Try classpath
        RelayProperties fromClasspath = tryLoadFromClasspath(yaml, path);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        throw new ConfigException("Configuration file not found: " + path);
    }

    private static RelayProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return requireContent(yaml.load(is), path);
            } catch (YAMLException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage());
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    private static RelayProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = RelayProxyApplication.class.getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return requireContent(yaml.load(is), path);
            }
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }

    private static RelayProperties requireContent(RelayProperties props, String path) {
        if (props == null) {
            throw new ConfigException("Configuration file is empty: " + path);
        }
        if (props.getServer() == null) {
            throw new ConfigException("Missing 'server' section in " + path);
        }
        if (props.getAdmin() == null) {
            props.setAdmin(new AdminConfig());
        }
        if (props.getLogging() == null) {
            props.setLogging(new LoggingConfig());
        }
        return props;
    }
}
