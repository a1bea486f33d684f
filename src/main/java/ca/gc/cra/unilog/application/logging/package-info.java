/**
 * Logger core: {@link ca.gc.cra.unilog.application.logging.StructuredLogger}, the error-mirroring
 * {@link ca.gc.cra.unilog.application.logging.SeverityRouter}, and the
 * {@link ca.gc.cra.unilog.application.logging.LoggerRegistry}.
 * <p><strong>Concurrency:</strong> Loggers and routers are stateless apart from their sinks; the registry
 * initializes each name exactly once.</p>
 * <p><strong>Metrics:</strong> Emits {@code logger.write.failures} and {@code router.forward.failures}.</p>
 */
package ca.gc.cra.unilog.application.logging;
