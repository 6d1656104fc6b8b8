/**
 * Service provider interfaces for plugging in persistence, storage endpoints and
 * observability.
 *
 * <p>{@link reaper.spi.ReplicaStore} is the only shared mutable resource between
 * workers; {@link reaper.spi.PhysicalDeleter} talks to storage endpoints;
 * {@link reaper.spi.MetricsExporter} receives counters.
 */
package reaper.spi;
