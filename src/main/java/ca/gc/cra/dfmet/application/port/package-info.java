/**
 * <strong>Purpose:</strong> Ports defining the source, writer, metrics and clock contracts of the conversion.
 * <p><strong>Pipeline role:</strong> Application boundary; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Sources and writers are used from one thread per conversion.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dfmet.application.port;
