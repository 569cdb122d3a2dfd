/**
 * Service Provider Interfaces (SPI) for extending litebridge.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in connection opening and metrics.
 *
 * @see io.litebridge.spi.ConnectionFactory
 * @see io.litebridge.spi.MetricsExporter
 */
package io.litebridge.spi;
