package mailsched.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Concrete occurrence of a rescheduled class. {@code (subject, slotId, date)} is unique.
 * Rows are never deleted; a class that is no longer valid is marked
 * {@link ClassStatus#SUPERSEDED}.
 *
 * @param requestStart start of the window the class was requested for; used to let
 *                     later students of the same request join the same class
 * @param requestEnd   end of the requested window
 */
public record RescheduledClass(
    long id,
    String subject,
    long slotId,
    LocalDate date,
    LocalTime start,
    LocalTime end,
    LocalDateTime requestStart,
    LocalDateTime requestEnd,
    ClassStatus status
) {

  public static RescheduledClass pending(String subject, SlotOccurrence occurrence, TimeWindow request) {
    return new RescheduledClass(0L, subject, occurrence.slot().slotId(), occurrence.date(),
        occurrence.slot().start(), occurrence.slot().end(),
        request.start(), request.end(), ClassStatus.PENDING);
  }

  public RescheduledClass withId(long newId) {
    return new RescheduledClass(newId, subject, slotId, date, start, end,
        requestStart, requestEnd, status);
  }

  public TimeWindow window() {
    return new TimeWindow(date.atTime(start), date.atTime(end));
  }
}
