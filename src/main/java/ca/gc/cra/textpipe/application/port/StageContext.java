package ca.gc.cra.textpipe.application.port;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-submission context handed to every stage.
 *
 * @param traceId correlation token of the submission; attached to logs and errors
 * @param deadline optional caller-supplied instant bounding I/O-bound stages
 * @param clock time source used for timestamps and deadline checks
 * @since 0.1.0
 */
public record StageContext(String traceId, Optional<Instant> deadline, ClockPort clock) {

  public StageContext {
    Objects.requireNonNull(traceId, "traceId");
    deadline = deadline == null ? Optional.empty() : deadline;
    clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }
}
