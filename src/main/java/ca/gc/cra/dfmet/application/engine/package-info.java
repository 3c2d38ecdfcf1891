/**
 * Temporal alignment and aggregation engine.
 * <p><strong>Role:</strong> Pure application core: classify, bucket, aggregate, smooth, derive and assemble.</p>
 * <p><strong>Concurrency:</strong> Each invocation owns its intermediate state; no state survives a run.</p>
 * <p><strong>Observability:</strong> None here; callers log and record metrics from {@link
 * ca.gc.cra.dfmet.application.engine.ClassificationStats}.</p>
 */
package ca.gc.cra.dfmet.application.engine;
