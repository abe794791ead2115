/**
 * Micrometer bridge for {@link io.burrow.spi.MetricsExporter}.
 */
package io.burrow.micrometer;
