package ca.gc.cra.tide.infrastructure.time;

import ca.gc.cra.tide.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()}; drives acknowledgment intervals in production.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Wall-clock time; a backwards jump only delays the next interval acknowledgment.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
