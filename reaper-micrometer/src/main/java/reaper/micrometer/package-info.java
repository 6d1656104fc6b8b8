/**
 * Micrometer bridge for {@link reaper.spi.MetricsExporter}.
 *
 * @see reaper.micrometer.MicrometerMetricsExporter
 */
package reaper.micrometer;
