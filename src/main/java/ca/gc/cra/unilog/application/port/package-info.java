/**
 * <strong>Purpose:</strong> Ports between the logging core and its adapters: sinks, formatter, clock, metrics,
 * and logger construction.
 * <p><strong>Concurrency:</strong> Each port documents its thread-safety contract.
 *
 * @since 0.1.0
 */
package ca.gc.cra.unilog.application.port;
