package reaper.select;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reaper.MutableClock;
import reaper.ReaperConfig;
import reaper.ReaperException;
import reaper.StubConnections;
import reaper.StubReplicaStore;
import reaper.model.Replica;
import reaper.model.ReplicaBatch;
import reaper.model.ReplicaRef;
import reaper.model.ReplicaState;
import reaper.spi.MetricsExporter;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReplicaSelectorTest {

    private MutableClock clock;
    private StubReplicaStore store;
    private StubConnections connections;
    private ReplicaSelector selector;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        store = new StubReplicaStore();
        connections = new StubConnections();
        selector = new ReplicaSelector(connections.provider(), store, "worker-a", clock, MetricsExporter.NOOP);
    }

    @Test
    void rejectsNonPositiveChunkSize() {
        assertThrows(IllegalArgumentException.class,
                () -> selector.select("RSE1", 0, Duration.ofSeconds(600)));
        assertThrows(IllegalArgumentException.class,
                () -> selector.select("RSE1", -5, Duration.ofSeconds(600)));
    }

    @Test
    void emptyBatchWhenNothingEligible() {
        ReplicaBatch batch = selector.select("RSE1", ReaperConfig.defaults());

        assertTrue(batch.isEmpty());
        assertEquals("RSE1", batch.rseId());
        assertEquals(1, connections.commits.get());
    }

    @Test
    void claimsUpToChunkSizeAndStampsLease() {
        store.seed("RSE1", 30, clock.instant().minusSeconds(3600));

        ReplicaBatch batch = selector.select("RSE1", 20, Duration.ofSeconds(600));

        assertEquals(20, batch.size());
        assertEquals(clock.instant(), batch.claimedAt());
        for (Replica replica : batch.replicas()) {
            Replica row = store.row(replica.ref());
            assertEquals(ReplicaState.BEING_DELETED, row.state());
            assertEquals(clock.instant(), row.updatedAt());
        }
    }

    @Test
    void onlyClaimsAtRequestedRse() {
        store.seed("RSE1", 5, clock.instant());
        store.seed("RSE2", 5, clock.instant());

        ReplicaBatch batch = selector.select("RSE2", 100, Duration.ofSeconds(600));

        assertEquals(5, batch.size());
        assertTrue(batch.replicas().stream().allMatch(r -> r.rseId().equals("RSE2")));
    }

    @Test
    void successiveClaimsNeverOverlap() {
        store.seed("RSE1", 25, clock.instant());

        ReplicaBatch first = selector.select("RSE1", 10, Duration.ofSeconds(600));
        ReplicaBatch second = selector.select("RSE1", 10, Duration.ofSeconds(600));
        ReplicaBatch third = selector.select("RSE1", 10, Duration.ofSeconds(600));

        Set<ReplicaRef> seen = new HashSet<>();
        for (ReplicaBatch batch : List.of(first, second, third)) {
            for (ReplicaRef ref : batch.refs()) {
                assertTrue(seen.add(ref), "claimed twice: " + ref);
            }
        }
        assertEquals(25, seen.size());
        assertEquals(5, third.size());
    }

    @Test
    void leasedReplicaIsNotClaimableBeforeDelay() {
        store.seed("RSE1", 3, clock.instant());
        selector.select("RSE1", 10, Duration.ofSeconds(600));

        clock.advance(Duration.ofSeconds(600));
        ReplicaSelector other = new ReplicaSelector(connections.provider(), store, "worker-b", clock, null);

        assertTrue(other.select("RSE1", 10, Duration.ofSeconds(600)).isEmpty());
    }

    @Test
    void expiredLeaseIsClaimableByAnyWorker() {
        store.seed("RSE1", 3, clock.instant());
        ReplicaBatch original = selector.select("RSE1", 10, Duration.ofSeconds(600));

        clock.advance(Duration.ofSeconds(601));
        ReplicaSelector other = new ReplicaSelector(connections.provider(), store, "worker-b", clock, null);
        ReplicaBatch reclaimed = other.select("RSE1", 10, Duration.ofSeconds(600));

        assertEquals(original.refs(), reclaimed.refs());
        assertEquals(clock.instant(), store.row(reclaimed.refs().get(0)).updatedAt());
    }

    @Test
    void originalWorkerCanReclaimItsOwnExpiredLease() {
        store.seed("RSE1", 2, clock.instant());
        selector.select("RSE1", 10, Duration.ofSeconds(600));

        clock.advance(Duration.ofSeconds(700));

        assertEquals(2, selector.select("RSE1", 10, Duration.ofSeconds(600)).size());
    }

    @Test
    void nonEligibleStatesAreIgnored() {
        Instant old = clock.instant().minusSeconds(3600);
        store.put(new Replica(new ReplicaRef("s", "bad", "RSE1"), ReplicaState.BAD, old, 1L, null));
        store.put(new Replica(new ReplicaRef("s", "copying", "RSE1"), ReplicaState.COPYING, old, 1L, null));
        store.put(new Replica(new ReplicaRef("s", "ok", "RSE1"), ReplicaState.AVAILABLE, old, 1L, null));

        ReplicaBatch batch = selector.select("RSE1", 10, Duration.ofSeconds(600));

        assertEquals(List.of(new ReplicaRef("s", "ok", "RSE1")), batch.refs());
    }

    @Test
    void stampIsTruncatedToMillis() {
        clock.set(Instant.parse("2024-05-01T12:00:00.123456789Z"));
        store.seed("RSE1", 1, clock.instant());

        ReplicaBatch batch = selector.select("RSE1", 1, Duration.ofSeconds(600));

        assertEquals(Instant.parse("2024-05-01T12:00:00.123Z"), batch.claimedAt());
    }

    @Test
    void storeFailureRollsBackAndPropagates() {
        store.failClaims = true;

        assertThrows(IllegalStateException.class, () -> selector.select("RSE1", 10, Duration.ofSeconds(600)));
        assertEquals(1, connections.rollbacks.get());
        assertEquals(0, connections.commits.get());
    }

    @Test
    void connectionFailureIsWrapped() {
        ReplicaSelector broken = new ReplicaSelector(StubConnections.failing(), store, "w", clock, null);

        ReaperException ex = assertThrows(ReaperException.class,
                () -> broken.select("RSE1", 10, Duration.ofSeconds(600)));
        assertTrue(ex.getMessage().contains("RSE1"));
        assertNotNull(ex.getCause());
    }
}
