package io.hookbox.poller;

import io.hookbox.model.DeliveryRecord;
import io.hookbox.model.DeliveryStatus;
import io.hookbox.queue.DeliveryQueue;
import io.hookbox.queue.DeliveryTask;
import io.hookbox.spi.DeliveryStore;
import io.hookbox.support.InMemoryDeliveryStore;
import io.hookbox.support.MutableClock;
import io.hookbox.support.RecordingQueue;
import io.hookbox.support.StubConnections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryPollerTest {
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryDeliveryStore store;
    private RecordingQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryDeliveryStore();
        queue = new RecordingQueue();
    }

    @Test
    void enqueuesDueRecordsOldestFirst() {
        store.put(record("d-late", DeliveryStatus.RETRY, T0.minusSeconds(10)));
        store.put(record("d-early", DeliveryStatus.PENDING, T0.minusSeconds(30)));
        store.put(record("d-future", DeliveryStatus.RETRY, T0.plusSeconds(30)));
        store.put(record("d-done", DeliveryStatus.DELIVERED, T0.minusSeconds(60)));
        store.put(record("d-dead", DeliveryStatus.DEAD, T0.minusSeconds(60)));

        int enqueued = poller(Duration.ZERO).poll();

        assertEquals(2, enqueued);
        assertEquals(List.of("d-early", "d-late"), queue.tasks.stream().map(DeliveryTask::deliveryId).toList());
        assertEquals(T0.minusSeconds(30), queue.tasks.get(0).notBefore());
    }

    @Test
    void skipRecentLeavesFreshRecordsToTheHotPath() {
        store.put(record("d-fresh", DeliveryStatus.PENDING, T0.minusMillis(500)));
        store.put(record("d-stale", DeliveryStatus.PENDING, T0.minusSeconds(5)));

        poller(Duration.ofSeconds(2)).poll();

        assertEquals(List.of("d-stale"), queue.tasks.stream().map(DeliveryTask::deliveryId).toList());
    }

    @Test
    void batchSizeLimitsOneCycle() {
        for (int i = 0; i < 5; i++) {
            store.put(record("d-" + i, DeliveryStatus.PENDING, T0.minusSeconds(10 + i)));
        }

        int enqueued = DeliveryPoller.builder()
                .connectionProvider(StubConnections.dummyProvider())
                .deliveryStore(store)
                .queue(queue)
                .batchSize(3)
                .clock(clock)
                .build()
                .poll();

        assertEquals(3, enqueued);
    }

    @Test
    void stopsWhenQueueHasNoRoom() {
        store.put(record("d-1", DeliveryStatus.PENDING, T0.minusSeconds(10)));
        DeliveryQueue full = new DeliveryQueue() {
            @Override
            public boolean enqueue(DeliveryTask task) {
                fail("should not enqueue");
                return false;
            }

            @Override
            public int remainingCapacity() {
                return 0;
            }
        };

        int enqueued = DeliveryPoller.builder()
                .connectionProvider(StubConnections.dummyProvider())
                .deliveryStore(store)
                .queue(full)
                .clock(clock)
                .build()
                .poll();

        assertEquals(0, enqueued);
    }

    @Test
    void claimLockingPassesOwnerAndExpiry() {
        AtomicReference<String> owner = new AtomicReference<>();
        AtomicReference<Instant> expiry = new AtomicReference<>();
        DeliveryStore claiming = new ForwardingStore(store) {
            @Override
            public List<DeliveryRecord> claimDue(Connection conn, String ownerId, Instant now,
                                                 Instant lockExpiry, Duration skipRecent, int limit) {
                owner.set(ownerId);
                expiry.set(lockExpiry);
                return super.pollDue(conn, now, skipRecent, limit);
            }
        };
        store.put(record("d-1", DeliveryStatus.PENDING, T0.minusSeconds(10)));
        var provider = new StubConnections.CountingProvider();

        int enqueued = DeliveryPoller.builder()
                .connectionProvider(provider)
                .deliveryStore(claiming)
                .queue(queue)
                .claimLocking("node-a", Duration.ofMinutes(5))
                .clock(clock)
                .build()
                .poll();

        assertEquals(1, enqueued);
        assertEquals("node-a", owner.get());
        assertEquals(T0.minus(Duration.ofMinutes(5)), expiry.get());
        assertEquals(1, provider.commits.get());
    }

    @Test
    void connectionFailureYieldsEmptyCycle() {
        int enqueued = DeliveryPoller.builder()
                .connectionProvider(StubConnections.failingProvider())
                .deliveryStore(store)
                .queue(queue)
                .build()
                .poll();

        assertEquals(0, enqueued);
    }

    @Test
    void closedPollerDoesNothing() {
        store.put(record("d-1", DeliveryStatus.PENDING, T0.minusSeconds(10)));
        DeliveryPoller poller = poller(Duration.ZERO);
        poller.start();
        poller.close();

        assertEquals(0, poller.poll());
        assertThrows(IllegalStateException.class, poller::start);
    }

    @Test
    void builderRejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> base().batchSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> base().intervalMs(0).build());
        assertThrows(IllegalArgumentException.class, () -> base().skipRecent(Duration.ofSeconds(-1)).build());
        assertThrows(NullPointerException.class, () -> DeliveryPoller.builder().deliveryStore(store).queue(queue).build());
    }

    private DeliveryPoller.Builder base() {
        return DeliveryPoller.builder()
                .connectionProvider(StubConnections.dummyProvider())
                .deliveryStore(store)
                .queue(queue)
                .clock(clock);
    }

    private DeliveryPoller poller(Duration skipRecent) {
        return base().skipRecent(skipRecent).build();
    }

    private static DeliveryRecord record(String id, DeliveryStatus status, Instant availableAt) {
        return new DeliveryRecord(id, "sub-1", "content.created", "{}", "sub-1:content.created:" + id,
                status, status == DeliveryStatus.PENDING ? 0 : 1, null, null, availableAt, null, availableAt);
    }

    private static class ForwardingStore implements DeliveryStore {
        private final DeliveryStore delegate;

        ForwardingStore(DeliveryStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public void insertNew(Connection conn, DeliveryRecord record) {
            delegate.insertNew(conn, record);
        }

        @Override
        public java.util.Optional<DeliveryRecord> findById(Connection conn, String id) {
            return delegate.findById(conn, id);
        }

        @Override
        public boolean existsCreatedSince(Connection conn, String idempotencyKey, Instant since) {
            return delegate.existsCreatedSince(conn, idempotencyKey, since);
        }

        @Override
        public int markDelivered(Connection conn, String id, int expectedAttempts, int responseStatus,
                                 Instant deliveredAt) {
            return delegate.markDelivered(conn, id, expectedAttempts, responseStatus, deliveredAt);
        }

        @Override
        public int markRetry(Connection conn, String id, int expectedAttempts, Integer responseStatus,
                             String error, Instant nextAt) {
            return delegate.markRetry(conn, id, expectedAttempts, responseStatus, error, nextAt);
        }

        @Override
        public int markDead(Connection conn, String id, int expectedAttempts, Integer responseStatus,
                            String error) {
            return delegate.markDead(conn, id, expectedAttempts, responseStatus, error);
        }

        @Override
        public List<DeliveryRecord> findBySubscription(Connection conn, String subscriptionId, int limit) {
            return delegate.findBySubscription(conn, subscriptionId, limit);
        }

        @Override
        public List<DeliveryRecord> pollDue(Connection conn, Instant now, Duration skipRecent, int limit) {
            return delegate.pollDue(conn, now, skipRecent, limit);
        }
    }
}
