package ca.gc.cra.textpipe.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to stages and the orchestrator.
 * <p><strong>Why:</strong> Record timestamps and deadline checks need a deterministic time source in tests.</p>
 * <p><strong>Role:</strong> Port consumed by application stages.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; concurrent submissions read the clock.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 * <p><strong>Observability:</strong> No direct metrics; returned values end up in record timestamps.</p>
 *
 * @implNote The default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant with millisecond precision
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
