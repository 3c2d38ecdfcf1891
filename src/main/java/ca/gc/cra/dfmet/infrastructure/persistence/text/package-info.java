/** Comma-separated text table output. */
package ca.gc.cra.dfmet.infrastructure.persistence.text;
