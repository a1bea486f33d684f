/**
 * Metrics adapters for the logging subsystem: OpenTelemetry or no-op.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe; instruments are cached per metric key.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code sink.*}, {@code router.*}, {@code logger.*} and
 * {@code formatter.*} namespaces. Event contents are never exported.</p>
 */
package ca.gc.cra.unilog.infrastructure.metrics;
