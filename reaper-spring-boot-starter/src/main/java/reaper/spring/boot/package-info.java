/**
 * Spring Boot auto-configuration for the replica reaper.
 *
 * <p>Provide a {@link javax.sql.DataSource} and a {@link reaper.spi.PhysicalDeleter} bean,
 * list the storage locations under {@code reaper.rse-ids}, and a {@link reaper.Reaper}
 * is created and started. Metrics are exported through Micrometer when it is present.
 */
package reaper.spring.boot;
