/**
 * Periodic health checks reported through a structured logger.
 */
package ca.gc.cra.unilog.application.health;
