/**
 * Concurrency helpers shared by the registry.
 *
 * @since 0.1.0
 */
package ca.gc.cra.unilog.application.util;
