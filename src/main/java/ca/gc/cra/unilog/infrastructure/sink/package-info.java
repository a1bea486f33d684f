/**
 * File-backed sinks and the logger factory that wires them.
 * <p><strong>Concurrency:</strong> Each {@link ca.gc.cra.unilog.infrastructure.sink.RotatingFileSink} has its own
 * lock; a slow file only blocks its own logger.</p>
 * <p><strong>Metrics:</strong> {@code sink.rotations}, {@code sink.rotation.failures}, {@code sink.bytes.written}.</p>
 */
package ca.gc.cra.unilog.infrastructure.sink;
