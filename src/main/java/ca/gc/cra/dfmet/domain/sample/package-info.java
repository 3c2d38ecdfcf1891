/**
 * Typed sensor samples, one record shape per channel.
 * <p><strong>Role:</strong> Domain layer; produced by classification, consumed by aggregation.</p>
 * <p><strong>Concurrency:</strong> Immutable records.</p>
 */
package ca.gc.cra.dfmet.domain.sample;
