/**
 * <strong>Purpose:</strong> Log event model: levels, typed field values, events, and the error taxonomy.
 * <p><strong>Concurrency:</strong> Immutable value types; safe to share across threads.
 *
 * @since 0.1.0
 */
package ca.gc.cra.unilog.domain.log;
