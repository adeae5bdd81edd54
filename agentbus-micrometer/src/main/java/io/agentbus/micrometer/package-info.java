/**
 * Micrometer bridge for exporting bus, router and registry metrics to Prometheus, Grafana and
 * other backends.
 *
 * @see io.agentbus.micrometer.MicrometerMetricsExporter
 */
package io.agentbus.micrometer;
