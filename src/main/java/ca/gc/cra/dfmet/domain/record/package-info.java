/**
 * Decoded flight-log records exchanged between record sources and the conversion engine.
 * <p><strong>Role:</strong> Domain boundary type; carries no format-specific knowledge.</p>
 * <p><strong>Concurrency:</strong> Immutable values.</p>
 */
package ca.gc.cra.dfmet.domain.record;
