package mailsched.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Recurring {@code (day-of-week, start, end)} template usable for rescheduled classes.
 */
public record WeeklySlot(long slotId, DayOfWeek day, LocalTime start, LocalTime end) {

  public WeeklySlot {
    Objects.requireNonNull(day, "day");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!end.isAfter(start)) {
      throw new IllegalArgumentException("end must be after start for slot " + slotId);
    }
  }

  /** Whether the two templates overlap on the same weekday. */
  public boolean overlaps(WeeklySlot other) {
    return day == other.day && start.isBefore(other.end) && other.start.isBefore(end);
  }

  /**
   * Returns the concrete window of this slot on {@code date}.
   *
   * @throws IllegalArgumentException if {@code date} is not on this slot's weekday
   */
  public TimeWindow on(LocalDate date) {
    if (date.getDayOfWeek() != day) {
      throw new IllegalArgumentException(date + " is not a " + day);
    }
    return new TimeWindow(date.atTime(start), date.atTime(end));
  }
}
