package com.rebalancer.metrics.exporter;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Prometheus scrape endpoint.
 *
 * <h2>Endpoints</h2>
 * <p>Every request, whatever its method or path, gets a snapshot of every
 * collector in the target {@link CollectorRegistry} in the text exposition
 * format, version 0.0.4:
 * <pre>
 * # HELP bytes_count_total Bytes transferred.
 * # TYPE bytes_count_total counter
 * bytes_count_total{service="1.rebalancer.localhost",server="127.0.0.1",datacenter="development",zonename="host",} 42.0
 * </pre>
 *
 * <p>The client's {@code *_created} timestamp samples of counters and
 * histograms are left out; only current values are exposed.
 *
 * <h2>Threading</h2>
 * <p>Requests are served by a fixed worker pool, independently of each other.
 * Scrapes only read instrument state, so they never block updates.
 *
 * <h2>Failures</h2>
 * <p>The listener binds in the constructor: an unusable address fails
 * immediately. A scrape that cannot be encoded is logged and its connection
 * closed without a response; the server keeps serving.
 */
public class MetricsServer {

    private static final Logger logger = Logger.getLogger(MetricsServer.class.getName());

    private final HttpServer server;
    private final CollectorRegistry registry;
    private final ExecutorService executor;
    private final CountDownLatch terminated = new CountDownLatch(1);

    /**
     * Creates a server exposing the default Prometheus registry.
     *
     * @param host IP literal or hostname to bind to; a hostname is resolved once, here
     * @param port port to bind to; 0 picks an ephemeral port
     * @throws IOException if the address cannot be bound
     * @throws IllegalArgumentException if the address cannot be resolved
     */
    public MetricsServer(String host, int port) throws IOException {
        this(host, port, CollectorRegistry.defaultRegistry);
    }

    /**
     * Creates a server exposing {@code registry}.
     *
     * @param host     IP literal or hostname to bind to; a hostname is resolved once, here
     * @param port     port to bind to; 0 picks an ephemeral port
     * @param registry collectors to expose
     * @throws IOException if the address cannot be bound
     * @throws IllegalArgumentException if the address cannot be resolved
     */
    public MetricsServer(String host, int port, CollectorRegistry registry) throws IOException {
        this.registry = Objects.requireNonNull(registry, "CollectorRegistry cannot be null");
        this.server = HttpServer.create(parseAddress(host, port), 0);

        // One context for "/" catches every path.
        this.server.createContext("/", new ScrapeHandler());

        int coreCount = Runtime.getRuntime().availableProcessors();
        this.executor = Executors.newFixedThreadPool(coreCount * 2, new ScrapeThreadFactory());
        this.server.setExecutor(executor);
    }

    /**
     * Binds and serves the default Prometheus registry until the process
     * exits. Does not return under normal operation.
     *
     * @throws IOException if the address cannot be bound
     * @throws IllegalArgumentException if the address cannot be resolved
     */
    public static void startServer(String host, int port) throws IOException {
        MetricsServer server = new MetricsServer(host, port);
        server.start();
        try {
            server.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.stop(0);
        }
    }

    /**
     * Starts accepting scrapes. Returns immediately.
     */
    public void start() {
        server.start();
        logger.info("Metrics server listening on " + server.getAddress());
    }

    /**
     * Blocks until {@link #stop(int)} is called.
     */
    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    /**
     * Stops the server, waiting up to {@code delaySeconds} for in-flight
     * scrapes to finish.
     */
    public void stop(int delaySeconds) {
        logger.info("Stopping metrics server...");
        server.stop(delaySeconds);
        executor.shutdown();
        terminated.countDown();
    }

    /**
     * The bound address; with port 0 this carries the chosen port.
     */
    public InetSocketAddress address() {
        return server.getAddress();
    }

    public int port() {
        return server.getAddress().getPort();
    }

    static InetSocketAddress parseAddress(String host, int port) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Metrics server address must not be blank");
        }
        InetSocketAddress address = new InetSocketAddress(host, port);
        if (address.isUnresolved()) {
            throw new IllegalArgumentException("Invalid metrics server address: " + host + ":" + port);
        }
        return address;
    }

    /**
     * Serializes a snapshot of the registry.
     */
    String scrape() throws IOException {
        StringWriter writer = new StringWriter();
        TextFormat.write004(writer, withoutCreatedSeries(registry.metricFamilySamples()));
        return writer.toString();
    }

    /**
     * Drops the {@code <family>_created} samples of counters, histograms and
     * summaries, and any family left without samples.
     */
    static Enumeration<Collector.MetricFamilySamples> withoutCreatedSeries(
            Enumeration<Collector.MetricFamilySamples> families) {
        List<Collector.MetricFamilySamples> result = new ArrayList<>();
        while (families.hasMoreElements()) {
            Collector.MetricFamilySamples family = families.nextElement();
            if (family.type != Collector.Type.COUNTER
                    && family.type != Collector.Type.HISTOGRAM
                    && family.type != Collector.Type.SUMMARY) {
                result.add(family);
                continue;
            }
            String created = family.name + "_created";
            List<Collector.MetricFamilySamples.Sample> samples = new ArrayList<>();
            for (Collector.MetricFamilySamples.Sample sample : family.samples) {
                if (!sample.name.equals(created)) {
                    samples.add(sample);
                }
            }
            if (!samples.isEmpty()) {
                result.add(new Collector.MetricFamilySamples(family.name, family.type, family.help, samples));
            }
        }
        return Collections.enumeration(result);
    }

    /**
     * Serves every request the same way, ignoring method and path.
     */
    class ScrapeHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try (InputStream is = exchange.getRequestBody()) {
                is.readAllBytes();
            }

            byte[] body;
            try {
                body = scrape().getBytes(StandardCharsets.UTF_8);
            } catch (IOException | RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to encode metrics for " + exchange.getRemoteAddress(), e);
                exchange.close();
                return;
            }

            exchange.getResponseHeaders().set("Content-Type", TextFormat.CONTENT_TYPE_004);
            if ("HEAD".equals(exchange.getRequestMethod())) {
                // The JDK server rejects a body on HEAD.
                exchange.sendResponseHeaders(200, -1);
                exchange.close();
                return;
            }
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        }
    }

    private static final class ScrapeThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "metrics-http-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
