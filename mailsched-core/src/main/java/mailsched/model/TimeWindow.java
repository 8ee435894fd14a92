package mailsched.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)} in local time.
 */
public record TimeWindow(LocalDateTime start, LocalDateTime end) {

  public TimeWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!end.isAfter(start)) {
      throw new IllegalArgumentException("end must be after start: " + start + " .. " + end);
    }
  }

  public boolean overlaps(TimeWindow other) {
    return start.isBefore(other.end) && other.start.isBefore(end);
  }

  /**
   * Minutes separating the two windows; {@code 0} when they overlap or touch.
   */
  public long distanceMinutes(TimeWindow other) {
    if (overlaps(other)) {
      return 0L;
    }
    if (!other.start.isBefore(end)) {
      return Duration.between(end, other.start).toMinutes();
    }
    return Duration.between(other.end, start).toMinutes();
  }

  @Override
  public String toString() {
    return start + ".." + end;
  }
}
