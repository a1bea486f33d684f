package ca.gc.cra.unilog.application.logging;

/**
 * Outcome of a single {@link StructuredLogger#emit} call.
 *
 * <p>Logging never throws for per-event problems; this value is the side channel that reports them.</p>
 *
 * @since 0.1.0
 */
public enum EmitResult {
  /** The event was below the logger's minimum level; nothing was written. */
  FILTERED,
  /** The event was written to the primary sink and, when applicable, mirrored. */
  WRITTEN,
  /** The primary write succeeded but mirroring to the error sink failed. */
  MIRROR_FAILED,
  /** The primary write failed. */
  WRITE_FAILED;

  /**
   * Returns whether the event reached the primary sink.
   *
   * @return {@code true} for {@link #WRITTEN} and {@link #MIRROR_FAILED}
   */
  public boolean persisted() {
    return this == WRITTEN || this == MIRROR_FAILED;
  }
}
