/**
 * Self-logging helpers: SLF4J level control for the CLI and message previews for failure reports.
 */
package ca.gc.cra.unilog.logging;
