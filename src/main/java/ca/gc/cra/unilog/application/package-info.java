/**
 * Application layer of the logging subsystem.
 * <p><strong>Role:</strong> Hosts the logger core, ports to sinks and formatters, and thin collaborators such as
 * the health monitor and message envelope helpers.</p>
 * <p><strong>Concurrency:</strong> Per-event paths hold no locks of their own; sinks serialize writes.</p>
 */
package ca.gc.cra.unilog.application;
