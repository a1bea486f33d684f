/**
 * Executor factories for background work such as health checks.
 */
package ca.gc.cra.unilog.infrastructure.exec;
