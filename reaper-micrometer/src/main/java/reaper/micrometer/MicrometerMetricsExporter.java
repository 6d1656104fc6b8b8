package reaper.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import reaper.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code reaper.replicas.claimed}: replicas claimed by the selector</li>
 *   <li>{@code reaper.deletion.success}: physical deletions confirmed</li>
 *   <li>{@code reaper.deletion.failure}: physical deletions failed (lease left to expire)</li>
 *   <li>{@code reaper.deletion.bytes}: bytes reclaimed by successful deletions</li>
 *   <li>{@code reaper.lease.refresh}: rows re-stamped by lease refreshes</li>
 *   <li>{@code reaper.lease.refresh.failure}: lease refreshes that failed</li>
 *   <li>{@code reaper.catalog.committed}: rows removed from the catalog</li>
 *   <li>{@code reaper.catalog.commit.failure}: catalog deletes that failed</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code reaper.batch.duration}: time from claim to final commit of one batch</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter replicasClaimed;
  private final Counter deletionSuccess;
  private final Counter deletionFailure;
  private final Counter bytesReclaimed;
  private final Counter leaseRefreshRows;
  private final Counter leaseRefreshFailure;
  private final Counter rowsCommitted;
  private final Counter commitFailure;
  private final Timer batchDuration;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "reaper"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "reaper");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "disk.reaper"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.replicasClaimed = Counter.builder(namePrefix + ".replicas.claimed")
        .description("Replicas claimed for deletion")
        .register(registry);
    this.deletionSuccess = Counter.builder(namePrefix + ".deletion.success")
        .description("Physical deletions confirmed by the storage endpoint")
        .register(registry);
    this.deletionFailure = Counter.builder(namePrefix + ".deletion.failure")
        .description("Physical deletions that failed")
        .register(registry);
    this.bytesReclaimed = Counter.builder(namePrefix + ".deletion.bytes")
        .description("Bytes reclaimed by successful deletions")
        .baseUnit("bytes")
        .register(registry);
    this.leaseRefreshRows = Counter.builder(namePrefix + ".lease.refresh")
        .description("Rows re-stamped by lease refreshes")
        .register(registry);
    this.leaseRefreshFailure = Counter.builder(namePrefix + ".lease.refresh.failure")
        .description("Lease refreshes that failed")
        .register(registry);
    this.rowsCommitted = Counter.builder(namePrefix + ".catalog.committed")
        .description("Rows removed from the catalog")
        .register(registry);
    this.commitFailure = Counter.builder(namePrefix + ".catalog.commit.failure")
        .description("Catalog deletes that failed")
        .register(registry);
    this.batchDuration = Timer.builder(namePrefix + ".batch.duration")
        .description("Time from claim to final commit of one batch")
        .register(registry);
  }

  @Override
  public void incrementReplicasClaimed(int count) {
    if (closed) return;
    replicasClaimed.increment(count);
  }

  @Override
  public void incrementDeletionSuccess() {
    if (closed) return;
    deletionSuccess.increment();
  }

  @Override
  public void incrementDeletionFailure() {
    if (closed) return;
    deletionFailure.increment();
  }

  @Override
  public void addBytesReclaimed(long bytes) {
    if (closed) return;
    bytesReclaimed.increment(bytes);
  }

  @Override
  public void incrementLeaseRefresh(int rows) {
    if (closed) return;
    leaseRefreshRows.increment(rows);
  }

  @Override
  public void incrementLeaseRefreshFailure() {
    if (closed) return;
    leaseRefreshFailure.increment();
  }

  @Override
  public void incrementRowsCommitted(int rows) {
    if (closed) return;
    rowsCommitted.increment(rows);
  }

  @Override
  public void incrementCommitFailure() {
    if (closed) return;
    commitFailure.increment();
  }

  @Override
  public void recordBatchDurationMs(long durationMs) {
    if (closed) return;
    batchDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link reaper.Reaper} is closed) to prevent stale meters.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(replicasClaimed, deletionSuccess, deletionFailure, bytesReclaimed,
        leaseRefreshRows, leaseRefreshFailure, rowsCommitted, commitFailure, batchDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
