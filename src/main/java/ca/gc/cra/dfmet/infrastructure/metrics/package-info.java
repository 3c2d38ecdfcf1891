/**
 * OpenTelemetry-backed implementation of the metrics port.
 * <p><strong>Observability:</strong> Counters carry a {@code dfmet.metric.key} attribute with the unsanitized key.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dfmet.infrastructure.metrics;
