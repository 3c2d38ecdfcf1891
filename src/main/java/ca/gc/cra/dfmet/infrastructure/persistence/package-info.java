/**
 * Table writers rendering the observation table to files.
 *
 * @since 0.1.0
 */
package ca.gc.cra.dfmet.infrastructure.persistence;
