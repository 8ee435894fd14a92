package mailsched.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A {@link WeeklySlot} on a concrete date.
 */
public record SlotOccurrence(WeeklySlot slot, LocalDate date) {

  public SlotOccurrence {
    Objects.requireNonNull(slot, "slot");
    Objects.requireNonNull(date, "date");
    if (date.getDayOfWeek() != slot.day()) {
      throw new IllegalArgumentException(date + " is not a " + slot.day());
    }
  }

  public TimeWindow window() {
    return slot.on(date);
  }
}
