package com.tollgate.proxy;

import com.tollgate.proxy.config.TollgateProperties;
import com.tollgate.proxy.core.constants.ProxyEventType;
import com.tollgate.proxy.core.exceptions.ConfigException;
import com.tollgate.proxy.core.exceptions.ProxyException;
import com.tollgate.proxy.core.proxy.ProxyEngine;
import com.tollgate.proxy.core.proxy.ProxyEngineFactory;
import com.tollgate.proxy.core.proxy.impl.http.HttpProxyServer;
import com.tollgate.proxy.core.services.MetricsService;
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
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for Tollgate.
 * Handles command-line arguments, configuration loading, and application
 * lifecycle.
 */
@Command(name = "tollgate-proxy", mixinStandardHelpOptions = true, version = "1.0.0", description = "Reverse proxy with routing, health checks, rate limiting and caching.")
public class TollgateProxyApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TollgateProxyApplication.class);

    /** Receives one line per request from the logging middleware. */
    private static final Logger accessLog = LoggerFactory.getLogger("tollgate.access");

    /**
     * Path to the YAML configuration file.
     */
    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "application.yml")
    private String configPath;

    private ProxyEngine engine;
    private HttpProxyServer server;
    private MetricsService metricsService;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    private final AtomicBoolean running = new AtomicBoolean(true);

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    /**
     * Main method to launch the application.
     *
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        new CommandLine(new TollgateProxyApplication()).execute(args);
    }

    /**
     * Bootstraps the application and blocks until shutdown.
     *
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Tollgate...");

            TollgateProperties props = loadConfig(configPath);
            this.metricsService = new MetricsService(props.getAdmin());
            ProxyEngineFactory factory = new ProxyEngineFactory(metricsService.getRegistry(), accessLog::info);
            this.engine = factory.create(props);
            registerEventLogging(engine);
            metricsService.start(engine);

            this.server = new HttpProxyServer(props.getServer(), engine, metricsService.getRegistry());
            Thread acceptThread = new Thread(server::start, "http-accept");
            acceptThread.start();
            if (!server.awaitBind(10, TimeUnit.SECONDS)) {
                throw new ProxyException("Failed to bind " + props.getServer().getHost() + ":"
                        + props.getServer().getPort());
            }

            if (System.getProperty("tollgate.no-shutdown-hook") == null) {
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
        } finally {
            stop();
        }
    }

    private static void registerEventLogging(ProxyEngine engine) {
        engine.on(ProxyEventType.REQUEST_FORWARDED.getValue(), event -> log.debug("Request forwarded: {} {} -> {}",
                event.request().getMethod(), event.request().getPath(), event.server()));
        engine.on(ProxyEventType.CACHE_HIT.getValue(), event -> log.debug("Cache hit: {} {}",
                event.request().getMethod(), event.request().getPath()));
        engine.on(ProxyEventType.PROXY_ERROR.getValue(), event -> log.warn("Proxy error: {}",
                event.error() != null ? event.error().getMessage() : "unknown"));
    }

    /**
     * Stops the front end, admin server and background tasks.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Tollgate...");

            unregisterShutdownHook();

            if (server != null) {
                server.stop();
            }
            if (engine != null) {
                engine.shutdown();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            shutdownLatch.countDown();
        }
    }

    /**
     * Unregisters the JVM shutdown hook safely.
     */
    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("Shutdown in progress, hook not removed");
            }
        }
    }

    /**
     * Loads the configuration from the specified path or classpath.
     *
     * @param path Path to the configuration file.
     * @return Loaded TollgateProperties.
     * @throws ConfigException if configuration cannot be loaded.
     */
    TollgateProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(TollgateProperties.class, new LoaderOptions()));

        // 1. Try absolute/relative path
        TollgateProperties fromFile = tryLoadFromFile(yaml, path);
        if (fromFile != null) {
            return fromFile;
        }

        // 2. Try classpath
        TollgateProperties fromClasspath = tryLoadFromClasspath(yaml, path);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        throw new ConfigException("Configuration file not found: " + path);
    }

    private TollgateProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return orDefaults(yaml.load(is));
            } catch (YAMLException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage());
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    private TollgateProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return orDefaults(yaml.load(is));
            }
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }

    // An empty document loads as null
    private static TollgateProperties orDefaults(TollgateProperties loaded) {
        return loaded != null ? loaded : new TollgateProperties();
    }
}
