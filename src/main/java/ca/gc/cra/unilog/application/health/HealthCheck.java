package ca.gc.cra.unilog.application.health;

/**
 * Probe run periodically by {@link HealthMonitor}.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HealthCheck {
  /**
   * Checks the component.
   *
   * @return current status
   * @throws Exception when the probe itself fails; reported as unhealthy
   */
  HealthStatus check() throws Exception;
}
