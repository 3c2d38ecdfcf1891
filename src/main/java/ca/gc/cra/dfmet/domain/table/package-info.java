/**
 * The assembled observation table and its rows.
 * <p><strong>Role:</strong> Domain output of the conversion engine; input of every table writer.</p>
 * <p><strong>Concurrency:</strong> Immutable values.</p>
 */
package ca.gc.cra.dfmet.domain.table;
