package io.invoiceops.webhook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically re-attempts due webhook retries. Keeps sweeping while batches come back full.
 */
public class RetrySweeper {
    private static final Logger log = LoggerFactory.getLogger(RetrySweeper.class);

    private final DeliveryEngine deliveryEngine;
    private final Duration interval;
    private final int batchSize;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private ScheduledExecutorService executor;

    public RetrySweeper(DeliveryEngine deliveryEngine, Duration interval, int batchSize) {
        this.deliveryEngine = Objects.requireNonNull(deliveryEngine, "deliveryEngine must not be null");
        this.interval = Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be a positive duration");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be a positive number");
        }
        this.batchSize = batchSize;
    }

    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("invoiceops.webhook.retry-sweeper");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::sweepOnce, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Webhook retry sweeper started interval={} batchSize={}", interval, batchSize);
    }

    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        executor.shutdownNow();
        executor = null;
        log.info("Webhook retry sweeper stopped");
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * @return number of deliveries attempted
     */
    public int sweepOnce() {
        int total = 0;
        try {
            int processed;
            do {
                processed = deliveryEngine.sweepDueRetries(batchSize);
                total += processed;
            } while (processed == batchSize && !Thread.currentThread().isInterrupted());
        } catch (RuntimeException e) {
            log.error("Webhook retry sweep failed msg={}", e.getMessage(), e);
        }
        return total;
    }
}
