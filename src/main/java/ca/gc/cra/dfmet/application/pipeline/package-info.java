/**
 * <strong>Purpose:</strong> The convert use case and its result types.
 * <p><strong>Pipeline role:</strong> Application layer between the CLI and the engine, sources and writers.</p>
 * <p><strong>Concurrency:</strong> Single-threaded batch.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dfmet.application.pipeline;
