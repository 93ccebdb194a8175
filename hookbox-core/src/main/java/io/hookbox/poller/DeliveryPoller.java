package io.hookbox.poller;

import io.hookbox.model.DeliveryRecord;
import io.hookbox.queue.DeliveryQueue;
import io.hookbox.queue.DeliveryTask;
import io.hookbox.spi.ConnectionProvider;
import io.hookbox.spi.DeliveryStore;
import io.hookbox.spi.MetricsExporter;
import io.hookbox.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled sweep of the {@code delivery_records} table for due work the in-memory
 * queue does not hold: records whose hot enqueue was rejected, retries scheduled
 * before a restart, and records left behind by a crashed node.
 *
 * <p>Operates in two modes:
 * <ul>
 *   <li><b>Single-node</b> (default): uses {@link DeliveryStore#pollDue} with no locking.
 *   <li><b>Multi-node</b>: uses {@link DeliveryStore#claimDue} with row-level claims.
 *       Enabled via {@link Builder#claimLocking}.
 * </ul>
 *
 * <p>Rows that became due within {@code skipRecent} are left to the hot path.
 * Duplicates are harmless: the queue ignores ids it already holds and the executor
 * re-checks state before every attempt. In multi-node mode the executor also claims
 * each record before sending, so a row this node's hot path is already posting is
 * not taken over by another node.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized.
 */
public final class DeliveryPoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(DeliveryPoller.class.getName());

    private final ConnectionProvider connectionProvider;
    private final DeliveryStore deliveryStore;
    private final DeliveryQueue queue;
    private final Duration skipRecent;
    private final int batchSize;
    private final long intervalMs;
    private final MetricsExporter metrics;
    private final String ownerId;
    private final Duration lockTimeout;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private DeliveryPoller(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
        this.queue = Objects.requireNonNull(builder.queue, "queue");

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        if (builder.skipRecent != null && builder.skipRecent.isNegative()) {
            throw new IllegalArgumentException("skipRecent must be >= 0");
        }

        this.skipRecent = builder.skipRecent == null ? Duration.ZERO : builder.skipRecent;
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.ownerId = builder.ownerId;
        this.lockTimeout = builder.lockTimeout;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Schedules {@link #poll()} at the configured fixed delay. Idempotent.
     *
     * @throws IllegalStateException after {@link #close()}
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("DeliveryPoller has been closed");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("hookbox-poller-"));
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Executes a single poll cycle and returns how many records were handed to the queue.
     * Called by the scheduler; tests may call it directly.
     */
    public int poll() {
        if (closed) {
            return 0;
        }
        try {
            int capacity = queue.remainingCapacity();
            if (capacity <= 0) {
                return 0;
            }
            Instant now = clock.instant();
            List<DeliveryRecord> rows = fetchDueRows(now, Math.min(batchSize, capacity));
            if (rows == null) {
                return 0;
            }
            if (rows.isEmpty()) {
                metrics.recordOldestLagMs(0);
                return 0;
            }
            // Rows are sorted oldest-due first
            long lagMs = Duration.between(rows.get(0).availableAt(), now).toMillis();
            metrics.recordOldestLagMs(Math.max(0L, lagMs));

            int enqueued = 0;
            for (DeliveryRecord row : rows) {
                if (!queue.enqueue(new DeliveryTask(row.id(), row.subscriptionId(), row.availableAt()))) {
                    break;
                }
                enqueued++;
            }
            if (enqueued > 0) {
                logger.fine("Poller enqueued " + enqueued + " due deliveries");
            }
            return enqueued;
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Poll cycle failed", t);
            return 0;
        }
    }

    /**
     * Returns {@code null} on failure, to distinguish from an empty result.
     */
    private List<DeliveryRecord> fetchDueRows(Instant now, int limit) {
        try (Connection conn = connectionProvider.getConnection()) {
            if (ownerId != null) {
                conn.setAutoCommit(false);
                try {
                    List<DeliveryRecord> claimed = deliveryStore.claimDue(
                        conn, ownerId, now, now.minus(lockTimeout), skipRecent, limit);
                    conn.commit();
                    return claimed;
                } catch (SQLException | RuntimeException e) {
                    conn.rollback();
                    throw e;
                }
            }
            conn.setAutoCommit(true);
            return deliveryStore.pollDue(conn, now, skipRecent, limit);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to fetch due deliveries", e);
            return null;
        }
    }

    /**
     * Cancels the polling schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link DeliveryPoller}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private DeliveryStore deliveryStore;
        private DeliveryQueue queue;
        private Duration skipRecent;
        private int batchSize = 50;
        private long intervalMs = 5000;
        private MetricsExporter metrics;
        private String ownerId;
        private Duration lockTimeout;
        private Clock clock;

        private Builder() {
        }

        /** <b>Required.</b> Each poll cycle opens one connection from here. */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> Source of due delivery records. */
        public Builder deliveryStore(DeliveryStore deliveryStore) {
            this.deliveryStore = deliveryStore;
            return this;
        }

        /** <b>Required.</b> Due records become {@link DeliveryTask}s on this queue. */
        public Builder queue(DeliveryQueue queue) {
            this.queue = queue;
            return this;
        }

        /**
         * Records due for less than this long are left to the worker that already queued
         * them. Defaults to zero; negative values are rejected.
         */
        public Builder skipRecent(Duration skipRecent) {
            this.skipRecent = skipRecent;
            return this;
        }

        /** Upper bound on records per cycle, further capped by free queue capacity. Default 50. */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /** Fixed delay between cycles. Default 5000 ms. */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Enables claim-based locking for multi-node deployments.
         *
         * @param ownerId     unique identifier for this node (e.g. hostname or pod name)
         * @param lockTimeout how long a claim holds before another node may take the row
         */
        public Builder claimLocking(String ownerId, Duration lockTimeout) {
            this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
            this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
            if (lockTimeout.isNegative() || lockTimeout.isZero()) {
                throw new IllegalArgumentException("lockTimeout must be positive");
            }
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws NullPointerException     if the connection provider, store or queue is missing
         * @throws IllegalArgumentException if batch size or interval is not positive, or
         *                                  {@code skipRecent} is negative
         */
        public DeliveryPoller build() {
            return new DeliveryPoller(this);
        }
    }
}
