package com.rebalancer.metrics.labels;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Lock-guarded holder for the label set published at start-up.
 *
 * <p>{@link com.rebalancer.metrics.registry.MetricsRegistrar} writes the
 * labels once while registering the well-known metrics; any other component
 * may then read them to decorate its own instruments with identical labels.
 * Until the first publication {@link #get()} returns an empty optional.
 *
 * <p>Writes are expected once per process, so contention on the lock is
 * negligible.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * ConstLabels labels = SharedLabels.global().get()
 *     .orElseThrow(() -> new IllegalStateException("metrics not registered yet"));
 * }</pre>
 */
public final class SharedLabels {

    private static final Logger logger = Logger.getLogger(SharedLabels.class.getName());

    private static final SharedLabels GLOBAL = new SharedLabels();

    private final ReentrantLock lock = new ReentrantLock();
    private ConstLabels labels;

    /**
     * Creates an empty holder. Most code should use {@link #global()}.
     */
    public SharedLabels() {
    }

    /**
     * The process-wide holder.
     */
    public static SharedLabels global() {
        return GLOBAL;
    }

    /**
     * Publishes the label set, replacing any earlier one.
     *
     * @param labels the labels to publish
     */
    public void publish(ConstLabels labels) {
        Objects.requireNonNull(labels, "labels cannot be null");
        lock.lock();
        try {
            if (this.labels != null && !this.labels.equals(labels)) {
                logger.warning("Replacing published metric labels " + this.labels + " with " + labels);
            }
            this.labels = labels;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the published labels, or empty if none were published yet.
     */
    public Optional<ConstLabels> get() {
        lock.lock();
        try {
            return Optional.ofNullable(labels);
        } finally {
            lock.unlock();
        }
    }
}
