/** Clock adapters. */
package ca.gc.cra.dfmet.infrastructure.time;
