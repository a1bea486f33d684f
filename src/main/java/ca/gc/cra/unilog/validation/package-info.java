/**
 * <strong>Purpose:</strong> Validation helpers for configuration values supplied via YAML, CLI arguments, and
 * the registry API.
 * <p><strong>Concurrency:</strong> Stateless and thread-safe.
 * <p><strong>Observability:</strong> Failures raise {@link java.lang.IllegalArgumentException} with the offending
 * key in the message.
 *
 * @since 0.1.0
 */
package ca.gc.cra.unilog.validation;
