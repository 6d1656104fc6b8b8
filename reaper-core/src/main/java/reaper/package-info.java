/**
 * Root API for the replica reaper: many independent processes delete physical replicas
 * and remove them from a shared catalog without racing on the same replica.
 *
 * <h2>Core Design</h2>
 * <p>There is no lock manager. A replica is leased by setting its state to
 * {@code BEING_DELETED} and stamping {@code updated_at}; any worker may re-claim it once
 * the stamp is older than {@code delay_seconds}. A
 * {@linkplain reaper.select.ReplicaSelector selector} claims a bounded batch, a
 * {@linkplain reaper.worker.DeletionWorker worker} deletes it chunk by chunk, a
 * {@linkplain reaper.refresh.LeaseRefresher refresher} extends the leases of what is left
 * when the batch runs long, and a {@linkplain reaper.cleanup.CleanupCommitter committer}
 * removes successes from the catalog either at the end or incrementally.
 *
 * <p>A crashed worker needs no cleanup: its leases expire and the replicas are claimed
 * again. Refreshes lower the chance that a slow batch loses its leases to another worker;
 * they do not rule it out.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>reaper-core</b>: model, SPI, selector, worker, refresher, committers (zero external deps)</li>
 *   <li><b>reaper-jdbc</b>: {@linkplain reaper.jdbc JDBC replica store hierarchy}
 *       (H2, MySQL, PostgreSQL)</li>
 *   <li><b>reaper-micrometer</b>: Micrometer metrics bridge</li>
 *   <li><b>reaper-spring-boot-starter</b>: configuration binding and auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var store        = JdbcReplicaStores.detect(dataSource);
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 *
 * try (Reaper reaper = Reaper.builder()
 *     .connectionProvider(connProvider)
 *     .replicaStore(store)
 *     .deleter(replica -> storageClient.delete(replica.path()))
 *     .rseIds(List.of("rse-cern-disk", "rse-bnl-tape"))
 *     .config(ReaperConfig.builder()
 *         .immediateCleanup(true)
 *         .dbBatchSize(50)
 *         .build())
 *     .build()) {
 *     reaper.start();
 *     ...
 * }
 * }</pre>
 *
 * @see reaper.Reaper
 * @see reaper.ReaperConfig
 * @see reaper.spi.ReplicaStore
 */
package reaper;
