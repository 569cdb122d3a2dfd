/**
 * Micrometer bridge for exporting connection actor metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.litebridge.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.litebridge.spi.MetricsExporter} SPI using Micrometer counters, gauges and a
 * distribution summary.
 *
 * @see io.litebridge.micrometer.MicrometerMetricsExporter
 */
package io.litebridge.micrometer;
