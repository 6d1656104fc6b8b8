package reaper.refresh;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reaper.MutableClock;
import reaper.ReaperConfig;
import reaper.RecordingMetrics;
import reaper.StubConnections;
import reaper.StubReplicaStore;
import reaper.model.Replica;
import reaper.model.ReplicaRef;
import reaper.model.ReplicaState;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LeaseRefresherTest {

    private final ReaperConfig config = ReaperConfig.defaults();
    private MutableClock clock;
    private StubReplicaStore store;
    private RecordingMetrics metrics;
    private LeaseRefresher refresher;
    private Instant claimedAt;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        store = new StubReplicaStore();
        metrics = new RecordingMetrics();
        refresher = new LeaseRefresher(new StubConnections().provider(), store, clock, metrics);
        claimedAt = clock.instant();
    }

    @Test
    void dueOnlyStrictlyAfterTriggerTime() {
        assertFalse(LeaseRefresher.isDue(Duration.ofSeconds(479), 10, config));
        assertFalse(LeaseRefresher.isDue(Duration.ofSeconds(480), 10, config));
        assertTrue(LeaseRefresher.isDue(Duration.ofMillis(480_001), 10, config));
        assertFalse(LeaseRefresher.isDue(Duration.ofSeconds(900), 0, config));
    }

    @Test
    void doesNothingBeforeTrigger() {
        List<ReplicaRef> outstanding = leased(5);

        assertFalse(refresher.maybeRefresh("RSE1", Duration.ofSeconds(480), outstanding, config));
        assertTrue(store.refreshCalls.isEmpty());
    }

    @Test
    void doesNothingWithoutOutstandingReplicas() {
        assertFalse(refresher.maybeRefresh("RSE1", Duration.ofSeconds(900), List.of(), config));
        assertTrue(store.refreshCalls.isEmpty());
    }

    @Test
    void restampsOutstandingReplicasAfterTrigger() {
        List<ReplicaRef> outstanding = leased(5);
        clock.advance(Duration.ofSeconds(481));

        assertTrue(refresher.maybeRefresh("RSE1", Duration.ofSeconds(481), outstanding, config));

        assertEquals(1, store.refreshCalls.size());
        assertEquals(outstanding, store.refreshCalls.get(0));
        for (ReplicaRef ref : outstanding) {
            assertEquals(clock.instant(), store.row(ref).updatedAt());
        }
        assertEquals(5, metrics.refreshedRows.get());
    }

    @Test
    void refreshIfDueReturnsTheWrittenStamp() {
        List<ReplicaRef> outstanding = leased(2);
        clock.advance(Duration.ofMillis(481_250));
        Instant expected = clock.instant();

        assertEquals(Optional.empty(),
                refresher.refreshIfDue("RSE1", Duration.ofSeconds(400), outstanding, config));
        assertEquals(Optional.of(expected),
                refresher.refreshIfDue("RSE1", Duration.ofMillis(481_250), outstanding, config));
        assertEquals(expected, store.row(outstanding.get(0)).updatedAt());

        store.refreshFailures.set(1);
        assertEquals(Optional.empty(),
                refresher.refreshIfDue("RSE1", Duration.ofSeconds(500), outstanding, config));
    }

    @Test
    void unknownRowCountStillCountsAsRefreshed() {
        StubReplicaStore uncounted = new StubReplicaStore() {
            @Override
            public synchronized int refreshLeases(Connection conn, String rseId, List<ReplicaRef> refs,
                                                  Instant now) {
                super.refreshLeases(conn, rseId, refs, now);
                return UNKNOWN_ROW_COUNT;
            }
        };
        List<ReplicaRef> refs = uncounted.seed("RSE1", 3, claimedAt).stream().map(Replica::ref).toList();
        LeaseRefresher refresher = new LeaseRefresher(new StubConnections().provider(), uncounted, clock, metrics);

        assertTrue(refresher.refresh("RSE1", refs));

        assertEquals(0, metrics.refreshedRows.get());
        assertEquals(0, metrics.refreshFailures.get());
    }

    @Test
    void skipsRowsNoLongerBeingDeleted() {
        List<ReplicaRef> outstanding = leased(3);
        ReplicaRef reassigned = outstanding.get(1);
        store.put(store.row(reassigned).withLease(ReplicaState.AVAILABLE, claimedAt));
        clock.advance(Duration.ofSeconds(500));

        assertTrue(refresher.maybeRefresh("RSE1", Duration.ofSeconds(500), outstanding, config));

        assertEquals(claimedAt, store.row(reassigned).updatedAt());
        assertEquals(clock.instant(), store.row(outstanding.get(0)).updatedAt());
        assertEquals(2, metrics.refreshedRows.get());
    }

    @Test
    void refreshOfRemovedRowsIsNoOp() {
        List<ReplicaRef> outstanding = leased(2);
        store.deleteReplicas(null, List.of(outstanding.get(0)));

        assertTrue(refresher.refresh("RSE1", outstanding));

        assertEquals(1, store.size());
        assertEquals(1, metrics.refreshedRows.get());
    }

    @Test
    void repeatedRefreshIsIdempotent() {
        List<ReplicaRef> outstanding = leased(4);

        clock.advance(Duration.ofSeconds(10));
        assertTrue(refresher.refresh("RSE1", outstanding));
        clock.advance(Duration.ofSeconds(10));
        assertTrue(refresher.refresh("RSE1", outstanding));

        assertEquals(4, store.size());
        for (ReplicaRef ref : outstanding) {
            Replica row = store.row(ref);
            assertEquals(ReplicaState.BEING_DELETED, row.state());
            assertEquals(clock.instant(), row.updatedAt());
        }
    }

    @Test
    void storeFailureReturnsFalseAndCountsFailure() {
        List<ReplicaRef> outstanding = leased(3);
        store.refreshFailures.set(1);

        assertFalse(refresher.maybeRefresh("RSE1", Duration.ofSeconds(500), outstanding, config));

        assertEquals(1, metrics.refreshFailures.get());
        assertEquals(claimedAt, store.row(outstanding.get(0)).updatedAt());
    }

    @Test
    void connectionFailureReturnsFalse() {
        LeaseRefresher broken = new LeaseRefresher(StubConnections.failing(), store, clock, metrics);

        assertFalse(broken.refresh("RSE1", leased(1)));
        assertEquals(1, metrics.refreshFailures.get());
    }

    private List<ReplicaRef> leased(int count) {
        return store.seed("RSE1", count, claimedAt).stream()
                .map(r -> {
                    store.put(r.withLease(ReplicaState.BEING_DELETED, claimedAt));
                    return r.ref();
                })
                .toList();
    }
}
