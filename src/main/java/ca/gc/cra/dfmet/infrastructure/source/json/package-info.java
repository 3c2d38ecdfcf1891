/** Newline-delimited JSON record source. */
package ca.gc.cra.dfmet.infrastructure.source.json;
