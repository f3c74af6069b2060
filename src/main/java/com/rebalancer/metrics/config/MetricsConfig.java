package com.rebalancer.metrics.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Configuration of the metrics exporter and of the labels attached to every
 * metric.
 *
 * <p>{@code host} and {@code port} are where the scrape endpoint binds;
 * {@code datacenter}, {@code service} and {@code server} become constant
 * labels of every instrument.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden with {@code METRICS_<PROPERTY>}:
 * <pre>
 * METRICS_HOST=0.0.0.0
 * METRICS_PORT=8878
 * METRICS_DATACENTER=us-east-1
 * METRICS_SERVICE=1.rebalancer.example.com
 * METRICS_SERVER=10.0.0.12
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Defaults with env override
 * MetricsConfig config = MetricsConfig.fromEnvironment();
 *
 * // Properties file, then env override
 * MetricsConfig config = MetricsConfig.loadFromProperties("metrics.properties");
 *
 * // Explicit
 * MetricsConfig config = MetricsConfig.builder()
 *     .datacenter("us-east-1")
 *     .port(9100)
 *     .build();
 * }</pre>
 */
public final class MetricsConfig {

    private static final Logger logger = Logger.getLogger(MetricsConfig.class.getName());

    // ========================================================================
    // DEFAULTS
    // ========================================================================

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 8878;
    public static final String DEFAULT_DATACENTER = "development";
    public static final String DEFAULT_SERVICE = "1.rebalancer.localhost";
    public static final String DEFAULT_SERVER = "127.0.0.1";

    // ========================================================================
    // ENVIRONMENT VARIABLE AND PROPERTY KEYS
    // ========================================================================

    static final String ENV_HOST = "METRICS_HOST";
    static final String ENV_PORT = "METRICS_PORT";
    static final String ENV_DATACENTER = "METRICS_DATACENTER";
    static final String ENV_SERVICE = "METRICS_SERVICE";
    static final String ENV_SERVER = "METRICS_SERVER";

    static final String PROP_HOST = "metrics.host";
    static final String PROP_PORT = "metrics.port";
    static final String PROP_DATACENTER = "metrics.datacenter";
    static final String PROP_SERVICE = "metrics.service";
    static final String PROP_SERVER = "metrics.server";

    private final String host;
    private final int port;
    private final String datacenter;
    private final String service;
    private final String server;

    private MetricsConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.datacenter = builder.datacenter;
        this.service = builder.service;
        this.server = builder.server;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults, without consulting the environment.
     */
    public static MetricsConfig defaults() {
        return new Builder().build();
    }

    /**
     * Defaults overridden by {@code METRICS_*} environment variables.
     */
    public static MetricsConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Loads configuration from a properties file.
     *
     * <p>Searches the classpath first, then the file system. A missing file
     * is not an error: defaults are used. Environment variables override
     * the file's values.
     *
     * <p><b>Example metrics.properties:</b>
     * <pre>
     * metrics.host=0.0.0.0
     * metrics.port=8878
     * metrics.datacenter=us-east-1
     * metrics.service=1.rebalancer.example.com
     * metrics.server=10.0.0.12
     * </pre>
     *
     * @param propertiesPath classpath resource or file path
     * @return configuration loaded from the file
     */
    public static MetricsConfig loadFromProperties(String propertiesPath) {
        return loadFromProperties(propertiesPath, System::getenv);
    }

    static MetricsConfig loadFromProperties(String propertiesPath, Function<String, String> env) {
        logger.info("Loading metrics configuration from: " + propertiesPath);

        Properties props = new Properties();

        try (InputStream is = MetricsConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        Builder builder = new Builder();
        builder.applyProperties(props);
        builder.applyEnvironment(env);
        return builder.build();
    }

    public static Builder builder() {
        Builder builder = new Builder();
        builder.applyEnvironment(System::getenv);
        return builder;
    }

    public Builder toBuilder() {
        return new Builder()
                .host(host)
                .port(port)
                .datacenter(datacenter)
                .service(service)
                .server(server);
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    /** Address the scrape endpoint binds to. */
    public String host() {
        return host;
    }

    /** Port the scrape endpoint binds to; 0 picks an ephemeral port. */
    public int port() {
        return port;
    }

    public String datacenter() {
        return datacenter;
    }

    public String service() {
        return service;
    }

    public String server() {
        return server;
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {

        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String datacenter = DEFAULT_DATACENTER;
        private String service = DEFAULT_SERVICE;
        private String server = DEFAULT_SERVER;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder datacenter(String datacenter) {
            this.datacenter = datacenter;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder server(String server) {
            this.server = server;
            return this;
        }

        public MetricsConfig build() {
            return new MetricsConfig(this);
        }

        private void applyProperties(Properties props) {
            Optional.ofNullable(props.getProperty(PROP_HOST)).map(String::trim).ifPresent(val -> this.host = val);
            Optional.ofNullable(props.getProperty(PROP_PORT)).map(String::trim)
                    .flatMap(val -> parsePort(PROP_PORT, val))
                    .ifPresent(val -> this.port = val);
            Optional.ofNullable(props.getProperty(PROP_DATACENTER)).map(String::trim)
                    .ifPresent(val -> this.datacenter = val);
            Optional.ofNullable(props.getProperty(PROP_SERVICE)).map(String::trim)
                    .ifPresent(val -> this.service = val);
            Optional.ofNullable(props.getProperty(PROP_SERVER)).map(String::trim)
                    .ifPresent(val -> this.server = val);
        }

        private void applyEnvironment(Function<String, String> env) {
            getEnv(env, ENV_HOST).ifPresent(val -> this.host = val);
            getEnv(env, ENV_PORT).flatMap(val -> parsePort(ENV_PORT, val)).ifPresent(val -> this.port = val);
            getEnv(env, ENV_DATACENTER).ifPresent(val -> this.datacenter = val);
            getEnv(env, ENV_SERVICE).ifPresent(val -> this.service = val);
            getEnv(env, ENV_SERVER).ifPresent(val -> this.server = val);
        }

        // ====================================================================
        // ENVIRONMENT VARIABLE HELPERS
        // ====================================================================

        private static Optional<String> getEnv(Function<String, String> env, String key) {
            String value = env.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded env var: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Integer> parsePort(String key, String value) {
            try {
                return Optional.of(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                logger.warning("Invalid int value for " + key + ": " + value);
                return Optional.empty();
            }
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        requireNonBlank("host", host);
        requireNonBlank("datacenter", datacenter);
        requireNonBlank("service", service);
        requireNonBlank("server", server);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535: " + port);
        }
    }

    private static void requireNonBlank(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    @Override
    public String toString() {
        return "MetricsConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", datacenter='" + datacenter + '\'' +
                ", service='" + service + '\'' +
                ", server='" + server + '\'' +
                '}';
    }
}
