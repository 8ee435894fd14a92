package mailsched.reconcile;

import mailsched.model.Booking;
import mailsched.model.RescheduledClass;
import mailsched.model.SlotOccurrence;
import mailsched.model.TimeWindow;
import mailsched.model.WeeklySlot;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Picks a weekly slot occurrence for a rescheduled class.
 *
 * <p>Candidates are the occurrences of every weekly slot dated on or after the requested
 * window's start date and inside the search range, which starts on the Monday of the
 * requested week and spans {@code searchWeeks} weeks. Occurrences that are full, or that
 * overlap the student's regular timetable or another rescheduled class the student is
 * assigned to, are skipped. The remaining candidates are ranked by distance to the
 * requested window, then by load, then by date, start time and slot id.
 *
 * <p>Stateless and deterministic: the same inputs always yield the same occurrence.
 */
public final class SlotAllocator {

  public static final int DEFAULT_SLOT_CAPACITY = 40;
  public static final int DEFAULT_SEARCH_WEEKS = 2;

  private final int slotCapacity;
  private final int searchWeeks;

  public SlotAllocator() {
    this(DEFAULT_SLOT_CAPACITY, DEFAULT_SEARCH_WEEKS);
  }

  public SlotAllocator(int slotCapacity, int searchWeeks) {
    if (slotCapacity < 1) {
      throw new IllegalArgumentException("slotCapacity must be >= 1");
    }
    if (searchWeeks < 1) {
      throw new IllegalArgumentException("searchWeeks must be >= 1");
    }
    this.slotCapacity = slotCapacity;
    this.searchWeeks = searchWeeks;
  }

  public int slotCapacity() {
    return slotCapacity;
  }

  /** First day of the search range: the Monday of the requested window's week. */
  public LocalDate rangeStart(TimeWindow requested) {
    return requested.start().toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
  }

  /** Exclusive end of the search range. */
  public LocalDate rangeEnd(TimeWindow requested) {
    return rangeStart(requested).plusWeeks(searchWeeks);
  }

  /**
   * Chooses an occurrence for {@code subject} near {@code requested}.
   *
   * @param slots       all weekly slots
   * @param bookings    current load per occurrence inside the search range
   * @param commitments the student's regular weekly timetable
   * @param assignments pending rescheduled classes the student already attends
   */
  public Allocation allocate(String subject, TimeWindow requested, List<WeeklySlot> slots,
      List<Booking> bookings, List<WeeklySlot> commitments, List<RescheduledClass> assignments) {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(requested, "requested");

    Map<SlotKey, Integer> load = new HashMap<>();
    for (Booking booking : bookings) {
      load.merge(new SlotKey(booking.slotId(), booking.date()), booking.assignedCount(), Integer::sum);
    }

    LocalDate first = requested.start().toLocalDate();
    LocalDate end = rangeEnd(requested);
    List<Candidate> candidates = new ArrayList<>();
    int full = 0;
    int clashing = 0;
    for (WeeklySlot slot : slots) {
      LocalDate date = rangeStart(requested).with(TemporalAdjusters.nextOrSame(slot.day()));
      for (; date.isBefore(end); date = date.plusWeeks(1)) {
        if (date.isBefore(first)) {
          continue;
        }
        SlotOccurrence occurrence = new SlotOccurrence(slot, date);
        int assigned = load.getOrDefault(new SlotKey(slot.slotId(), date), 0);
        if (assigned >= slotCapacity) {
          full++;
          continue;
        }
        TimeWindow window = occurrence.window();
        if (conflicts(window, commitments, assignments)) {
          clashing++;
          continue;
        }
        candidates.add(new Candidate(occurrence, assigned, window.distanceMinutes(requested)));
      }
    }

    if (candidates.isEmpty()) {
      return new Allocation.Exhausted("no free slot for " + subject + " in " + rangeStart(requested)
          + ".." + end + " (" + full + " full, " + clashing + " clashing)");
    }
    Candidate best = candidates.stream().min(CANDIDATE_ORDER).orElseThrow();
    return new Allocation.Assigned(best.occurrence(), best.assigned());
  }

  /**
   * Whether {@code window} overlaps one of the student's weekly commitments or one of the
   * rescheduled classes the student is already assigned to.
   */
  public static boolean conflicts(TimeWindow window, List<WeeklySlot> commitments,
      List<RescheduledClass> assignments) {
    LocalDate date = window.start().toLocalDate();
    for (WeeklySlot commitment : commitments) {
      if (commitment.day() == date.getDayOfWeek() && commitment.on(date).overlaps(window)) {
        return true;
      }
    }
    for (RescheduledClass assigned : assignments) {
      if (assigned.window().overlaps(window)) {
        return true;
      }
    }
    return false;
  }

  private static final Comparator<Candidate> CANDIDATE_ORDER = Comparator
      .comparingLong((Candidate c) -> c.distance())
      .thenComparingInt(c -> c.assigned())
      .thenComparing(c -> c.occurrence().date())
      .thenComparing(c -> c.occurrence().slot().start())
      .thenComparingLong(c -> c.occurrence().slot().slotId());

  private record SlotKey(long slotId, LocalDate date) {
  }

  private record Candidate(SlotOccurrence occurrence, int assigned, long distance) {
  }
}
