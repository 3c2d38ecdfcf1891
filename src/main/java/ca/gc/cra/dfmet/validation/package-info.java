/**
 * Input validation helpers shared by configuration and CLI layers.
 * <p><strong>Observability:</strong> Violations surface as {@link java.lang.IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dfmet.validation;
