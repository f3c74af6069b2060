package com.rebalancer.metrics.labels;

import java.io.IOException;
import java.net.InetAddress;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Source of the {@code zonename} label.
 */
@FunctionalInterface
public interface HostnameResolver {

    /** Placeholder used when the hostname cannot be determined. */
    String UNKNOWN = "unknown";

    /**
     * Resolves the local hostname.
     *
     * @throws IOException if the hostname cannot be determined
     */
    String resolve() throws IOException;

    /**
     * Resolver backed by {@link InetAddress#getLocalHost()}.
     */
    static HostnameResolver local() {
        return () -> InetAddress.getLocalHost().getHostName();
    }

    /**
     * Resolves the hostname, substituting {@link #UNKNOWN} on failure.
     * Never throws; a missing hostname must not block start-up.
     */
    default String resolveOrUnknown() {
        try {
            String hostname = resolve();
            if (hostname == null || hostname.isBlank()) {
                Logger.getLogger(HostnameResolver.class.getName())
                        .warning("Hostname resolved to an empty value, using '" + UNKNOWN + "'");
                return UNKNOWN;
            }
            return hostname;
        } catch (IOException | RuntimeException e) {
            Logger.getLogger(HostnameResolver.class.getName())
                    .log(Level.WARNING, "Could not resolve hostname, using '" + UNKNOWN + "'", e);
            return UNKNOWN;
        }
    }
}
