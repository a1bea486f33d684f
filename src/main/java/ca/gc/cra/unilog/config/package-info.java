/**
 * Logger configuration records, the YAML loader, and the bootstrap that wires them into a registry.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Logger and file names are restricted to {@code [A-Za-z0-9._-]} so they cannot
 * escape the log directory.</p>
 */
package ca.gc.cra.unilog.config;
