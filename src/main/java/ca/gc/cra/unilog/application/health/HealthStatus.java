package ca.gc.cra.unilog.application.health;

import java.util.Objects;

/**
 * Outcome of one health check.
 *
 * @param healthy whether the checked component is usable
 * @param detail failure cause; empty when healthy
 * @since 0.1.0
 */
public record HealthStatus(boolean healthy, String detail) {
  private static final HealthStatus OK = new HealthStatus(true, "");

  public HealthStatus {
    detail = Objects.requireNonNullElse(detail, "");
  }

  /**
   * Returns the shared healthy status.
   *
   * @return healthy status
   */
  public static HealthStatus ok() {
    return OK;
  }

  /**
   * Creates an unhealthy status.
   *
   * @param cause failure description
   * @return unhealthy status
   */
  public static HealthStatus failed(String cause) {
    return new HealthStatus(false, cause);
  }
}
