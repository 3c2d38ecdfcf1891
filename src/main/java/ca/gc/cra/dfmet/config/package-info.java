/**
 * <strong>Purpose:</strong> Configuration loading, merging and wiring for the DFMET CLI.
 * <p><strong>Precedence:</strong> CLI {@code key=value} arguments override YAML, which overrides embedded
 * defaults.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dfmet.config;
