/**
 * Command-line entry points: the {@code dfmet} dispatcher and the {@code convert} subcommand.
 * <p><strong>Role:</strong> Adapter layer that parses {@code key=value} arguments and flags, merges defaults, YAML and
 * CLI values, and maps outcomes to {@link ca.gc.cra.dfmet.api.ExitCode} values.</p>
 * <p><strong>Concurrency:</strong> Single-threaded; intended to run once per JVM.</p>
 */
package ca.gc.cra.dfmet.api;
