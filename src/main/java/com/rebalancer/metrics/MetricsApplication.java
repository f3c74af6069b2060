package com.rebalancer.metrics;

import com.rebalancer.metrics.config.MetricsConfig;
import com.rebalancer.metrics.exporter.MetricsServer;
import com.rebalancer.metrics.registry.MetricsRegistrar;
import com.rebalancer.metrics.registry.MetricsRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Stand-alone entry point: registers the well-known metrics and serves them
 * until the process is stopped.
 *
 * <p>Configuration is read from the properties file named by the
 * {@code metrics.config} system property (default {@code metrics.properties}),
 * with {@code METRICS_*} environment overrides.
 */
public class MetricsApplication {
    private static final Logger logger = Logger.getLogger(MetricsApplication.class.getName());

    private MetricsServer metricsServer;
    private MetricsRegistry metrics;

    public static void main(String[] args) {
        configureLogging();
        try {
            MetricsApplication app = new MetricsApplication();
            app.start();
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown));
            app.metricsServer.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Metrics exporter failed to start: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    private void start() throws IOException {
        String configFile = System.getProperty("metrics.config", "metrics.properties");
        MetricsConfig config = MetricsConfig.loadFromProperties(configFile);
        logger.info("Starting metrics exporter with " + config);

        metrics = MetricsRegistrar.register(config);

        metricsServer = new MetricsServer(config.host(), config.port());
        metricsServer.start();
        logger.info("Serving " + metrics.keys().size() + " metrics on port " + metricsServer.port());
    }

    private void shutdown() {
        if (metricsServer != null) metricsServer.stop(1);
        logger.info("Metrics exporter shutdown complete");
    }

    private static void configureLogging() {
        try (InputStream is = MetricsApplication.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read logging.properties, keeping JDK defaults", e);
        }
    }
}
