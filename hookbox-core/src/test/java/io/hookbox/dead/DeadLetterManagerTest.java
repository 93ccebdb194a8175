package io.hookbox.dead;

import io.hookbox.model.DeadLetterEntry;
import io.hookbox.model.DeadLetterQuery;
import io.hookbox.support.InMemoryDeadLetterStore;
import io.hookbox.support.StubConnections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeadLetterManagerTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private InMemoryDeadLetterStore store;
  private DeadLetterManager manager;

  @BeforeEach
  void setUp() {
    store = new InMemoryDeadLetterStore();
    manager = new DeadLetterManager(StubConnections.dummyProvider(), store);
    store.insert(null, entry("e-1", DeadLetterEntry.WEBHOOK_DELIVERY, "HTTP 500", 5, 10));
    store.insert(null, entry("e-2", DeadLetterEntry.WEBHOOK_DELIVERY, "ConnectException: Connection refused", 3, 20));
    store.insert(null, entry("e-3", "report_export", "HTTP 500", 5, 30));
  }

  @Test
  void recentIsNewestFirstAndScopedToWebhooks() {
    List<DeadLetterEntry> recent = manager.recent(10);

    assertEquals(List.of("e-2", "e-1"), recent.stream().map(DeadLetterEntry::id).toList());
    assertEquals(2, manager.count());
  }

  @Test
  void queryByReasonAndRetryCount() {
    assertEquals(List.of("e-1"), ids(manager.query(DeadLetterQuery.all().withReasonContains("http 5"))));
    assertEquals(List.of("e-2"), ids(manager.query(DeadLetterQuery.all().withRetryCountBetween(1, 3))));
    assertEquals(1, manager.query(DeadLetterQuery.all().withLimit(1)).size());
  }

  @Test
  void findIgnoresOtherJobTypes() {
    assertTrue(manager.find("e-1").isPresent());
    assertTrue(manager.find("e-3").isEmpty());
    assertTrue(manager.find("missing").isEmpty());
  }

  @Test
  void connectionFailureIsReportedNotThrown() {
    DeadLetterManager failing = new DeadLetterManager(StubConnections.failingProvider(), store);

    assertTrue(failing.recent(10).isEmpty());
    assertTrue(failing.find("e-1").isEmpty());
    assertEquals(0, failing.count());
  }

  private static List<String> ids(List<DeadLetterEntry> entries) {
    return entries.stream().map(DeadLetterEntry::id).toList();
  }

  private static DeadLetterEntry entry(String id, String jobType, String reason, int retries, int offsetSeconds) {
    return new DeadLetterEntry(id, jobType, "sub-1", "d-" + id, "{}", reason, retries,
        T0, T0.plusSeconds(offsetSeconds));
  }
}
