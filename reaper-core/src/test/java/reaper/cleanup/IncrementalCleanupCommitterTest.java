package reaper.cleanup;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reaper.StubConnections;
import reaper.StubReplicaStore;
import reaper.model.Replica;
import reaper.spi.MetricsExporter;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IncrementalCleanupCommitterTest {

    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private StubReplicaStore store;
    private CatalogCleaner cleaner;

    @BeforeEach
    void setUp() {
        store = new StubReplicaStore();
        cleaner = new CatalogCleaner(new StubConnections().provider(), store, MetricsExporter.NOOP);
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> new IncrementalCleanupCommitter(cleaner, 0));
    }

    @Test
    void flushesExactSlicesOnceThresholdReached() {
        List<Replica> replicas = store.seed("RSE1", 150, T0);
        IncrementalCleanupCommitter committer = new IncrementalCleanupCommitter(cleaner, 50);

        int flushed = 0;
        for (int from = 0; from < 150; from += 15) {
            flushed += committer.commit(replicas.subList(from, from + 15));
        }
        List<Replica> handedBack = committer.finish();

        assertEquals(150, flushed);
        assertEquals(List.of(50, 50, 50), committer.progress().commitSizes());
        assertEquals(0, committer.progress().finalFlushSize());
        assertTrue(handedBack.isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void smallerRemainderIsFlushedAtFinish() {
        List<Replica> replicas = store.seed("RSE1", 37, T0);
        IncrementalCleanupCommitter committer = new IncrementalCleanupCommitter(cleaner, 10);

        committer.commit(replicas.subList(0, 25));
        committer.commit(replicas.subList(25, 37));
        committer.finish();

        assertEquals(List.of(10, 10, 10), committer.progress().commitSizes());
        assertEquals(7, committer.progress().finalFlushSize());
        assertEquals(37, committer.progress().committedCount());
        assertEquals(0, committer.progress().pendingCount());
        assertEquals(List.of(10, 10, 10, 7), store.deleteCalls.stream().map(List::size).toList());
    }

    @Test
    void noCatalogDeleteExceedsBatchSize() {
        int[] chunkSizes = {1, 3, 7, 20, 64};
        int[] batchSizes = {1, 4, 16, 50};
        for (int chunk : chunkSizes) {
            for (int dbBatch : batchSizes) {
                StubReplicaStore local = new StubReplicaStore();
                List<Replica> replicas = local.seed("RSE1", 97, T0);
                IncrementalCleanupCommitter committer = new IncrementalCleanupCommitter(
                        new CatalogCleaner(new StubConnections().provider(), local, null), dbBatch);

                for (int from = 0; from < replicas.size(); from += chunk) {
                    committer.commit(replicas.subList(from, Math.min(from + chunk, replicas.size())));
                }
                committer.finish();

                CleanupProgress progress = committer.progress();
                for (int size : progress.commitSizes()) {
                    assertEquals(dbBatch, size, "chunk=" + chunk + " dbBatch=" + dbBatch);
                }
                assertTrue(progress.finalFlushSize() < dbBatch);
                assertEquals(97, progress.committedCount());
                assertTrue(local.deleteCalls.stream().allMatch(call -> call.size() <= dbBatch));
            }
        }
    }

    @Test
    void emptyCommitsDoNothing() {
        IncrementalCleanupCommitter committer = new IncrementalCleanupCommitter(cleaner, 5);

        assertEquals(0, committer.commit(List.of()));
        committer.finish();

        assertTrue(store.deleteCalls.isEmpty());
        assertEquals(0, committer.progress().finalFlushSize());
    }

    @Test
    void failureKeepsPendingAndReportsCommittedCount() {
        List<Replica> replicas = store.seed("RSE1", 25, T0);
        IncrementalCleanupCommitter committer = new IncrementalCleanupCommitter(cleaner, 10);
        committer.commit(replicas.subList(0, 15));
        store.deleteFailures.set(1);

        CatalogCommitException ex = assertThrows(CatalogCommitException.class,
                () -> committer.commit(replicas.subList(15, 25)));

        assertEquals(10, ex.committedCount());
        assertEquals(15, ex.uncommitted().size());
        assertEquals(replicas.subList(10, 25), ex.uncommitted());
        assertEquals(15, committer.progress().pendingCount());
        assertEquals(15, store.size());
    }

    @Test
    void finishFailureIsReported() {
        List<Replica> replicas = store.seed("RSE1", 3, T0);
        IncrementalCleanupCommitter committer = new IncrementalCleanupCommitter(cleaner, 10);
        committer.commit(replicas);
        store.deleteFailures.set(1);

        CatalogCommitException ex = assertThrows(CatalogCommitException.class, committer::finish);

        assertEquals(0, ex.committedCount());
        assertEquals(3, ex.uncommitted().size());
        assertEquals(3, store.size());
    }
}
