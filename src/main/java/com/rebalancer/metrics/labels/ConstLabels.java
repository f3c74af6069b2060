package com.rebalancer.metrics.labels;

import com.rebalancer.metrics.config.MetricsConfig;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Labels attached identically to every instrument of the process.
 *
 * <p>The set is the fleet-wide minimum: {@code service}, {@code server},
 * {@code datacenter} and {@code zonename} (the local hostname). Other labels
 * may be added per instrument, but these four are always present and always
 * come first, in this order.
 *
 * <p>Immutable and thread-safe.
 */
public record ConstLabels(String service, String server, String datacenter, String zonename) {

    public static final String SERVICE = "service";
    public static final String SERVER = "server";
    public static final String DATACENTER = "datacenter";
    public static final String ZONENAME = "zonename";

    private static final String[] NAMES = {SERVICE, SERVER, DATACENTER, ZONENAME};

    public ConstLabels {
        Objects.requireNonNull(service, "service cannot be null");
        Objects.requireNonNull(server, "server cannot be null");
        Objects.requireNonNull(datacenter, "datacenter cannot be null");
        Objects.requireNonNull(zonename, "zonename cannot be null");
    }

    /**
     * Builds the label set from the configuration and the given hostname.
     */
    public static ConstLabels of(MetricsConfig config, String hostname) {
        return new ConstLabels(config.service(), config.server(), config.datacenter(), hostname);
    }

    /**
     * Label names, in declaration order.
     *
     * @return a fresh array; callers may append to a copy of it
     */
    public String[] names() {
        return NAMES.clone();
    }

    /**
     * Label values, aligned with {@link #names()}.
     */
    public String[] values() {
        return new String[]{service, server, datacenter, zonename};
    }

    /**
     * Names followed by {@code extraName}; used for labeled collectors.
     */
    public String[] namesWith(String extraName) {
        return append(names(), extraName);
    }

    /**
     * Values followed by {@code extraValue}; aligned with {@link #namesWith(String)}.
     */
    public String[] valuesWith(String extraValue) {
        return append(values(), extraValue);
    }

    /**
     * Read-only view of the labels as an ordered map.
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(SERVICE, service);
        map.put(SERVER, server);
        map.put(DATACENTER, datacenter);
        map.put(ZONENAME, zonename);
        return Collections.unmodifiableMap(map);
    }

    private static String[] append(String[] head, String last) {
        String[] result = Arrays.copyOf(head, head.length + 1);
        result[head.length] = last;
        return result;
    }
}
