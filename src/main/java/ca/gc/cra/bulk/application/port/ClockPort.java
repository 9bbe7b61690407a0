package ca.gc.cra.bulk.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps for ingested commands.
 * <p><strong>Why:</strong> Keeps command timestamps deterministic in tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; several sessions may read the
 * clock concurrently.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.bulk.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
