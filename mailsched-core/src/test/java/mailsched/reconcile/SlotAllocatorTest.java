package mailsched.reconcile;

import mailsched.model.Booking;
import mailsched.model.ClassStatus;
import mailsched.model.RescheduledClass;
import mailsched.model.SlotOccurrence;
import mailsched.model.TimeWindow;
import mailsched.model.WeeklySlot;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SlotAllocatorTest {

    private static final WeeklySlot MON_9 = slot(1, DayOfWeek.MONDAY, 9);
    private static final WeeklySlot TUE_10 = slot(2, DayOfWeek.TUESDAY, 10);
    private static final WeeklySlot TUE_14 = slot(3, DayOfWeek.TUESDAY, 14);
    private static final WeeklySlot WED_10 = slot(4, DayOfWeek.WEDNESDAY, 10);
    private static final List<WeeklySlot> SLOTS = List.of(MON_9, TUE_10, TUE_14, WED_10);

    // 2024-05-13 is a Monday
    private static final LocalDate TUESDAY = LocalDate.of(2024, 5, 14);
    private static final TimeWindow TUE_10_TO_11 = window(TUESDAY, 10, 11);

    private final SlotAllocator allocator = new SlotAllocator();

    @Test
    void sameInputsAlwaysPickTheSameSlot() {
        Allocation first = allocator.allocate("Math", TUE_10_TO_11, SLOTS, List.of(), List.of(), List.of());
        Allocation second = allocator.allocate("Math", TUE_10_TO_11, SLOTS, List.of(), List.of(), List.of());

        assertEquals(first, second);
        assertEquals(new SlotOccurrence(TUE_10, TUESDAY), occurrence(first));
    }

    @Test
    void fullOccurrenceIsSkipped() {
        List<Booking> bookings = List.of(new Booking(TUE_10.slotId(), TUESDAY, 40));

        Allocation result = allocator.allocate("Math", TUE_10_TO_11, SLOTS, bookings, List.of(), List.of());

        assertEquals(new SlotOccurrence(TUE_14, TUESDAY), occurrence(result));
    }

    @Test
    void occurrenceClashingWithTimetableIsSkipped() {
        WeeklySlot lab = new WeeklySlot(99, DayOfWeek.TUESDAY, LocalTime.of(10, 30), LocalTime.of(11, 30));

        Allocation result = allocator.allocate("Math", TUE_10_TO_11, SLOTS, List.of(), List.of(lab), List.of());

        assertEquals(new SlotOccurrence(TUE_14, TUESDAY), occurrence(result));
    }

    @Test
    void occurrenceClashingWithAnotherRescheduledClassIsSkipped() {
        RescheduledClass physics = new RescheduledClass(7, "Physics", TUE_10.slotId(), TUESDAY,
                LocalTime.of(10, 0), LocalTime.of(11, 0), TUESDAY.atTime(9, 0), TUESDAY.atTime(10, 0),
                ClassStatus.PENDING);

        Allocation result = allocator.allocate("Math", TUE_10_TO_11, SLOTS, List.of(), List.of(), List.of(physics));

        assertEquals(new SlotOccurrence(TUE_14, TUESDAY), occurrence(result));
    }

    @Test
    void datesBeforeTheRequestedDayAreNotCandidates() {
        LocalDate wednesday = TUESDAY.plusDays(1);

        Allocation result = allocator.allocate("Math", window(wednesday, 10, 11), SLOTS, List.of(), List.of(), List.of());

        assertEquals(new SlotOccurrence(WED_10, wednesday), occurrence(result));
    }

    @Test
    void lighterOccurrenceWinsAmongEquallyCloseOnes() {
        TimeWindow wide = window(TUESDAY, 10, 15);
        List<Booking> bookings = List.of(new Booking(TUE_10.slotId(), TUESDAY, 5));

        Allocation loaded = allocator.allocate("Math", wide, SLOTS, bookings, List.of(), List.of());
        Allocation empty = allocator.allocate("Math", wide, SLOTS, List.of(), List.of(), List.of());

        assertEquals(new SlotOccurrence(TUE_14, TUESDAY), occurrence(loaded));
        assertEquals(new SlotOccurrence(TUE_10, TUESDAY), occurrence(empty));
    }

    @Test
    void exhaustedWhenEveryOccurrenceIsFull() {
        List<Booking> bookings = List.of(
                new Booking(TUE_10.slotId(), TUESDAY, 40),
                new Booking(TUE_10.slotId(), TUESDAY.plusWeeks(1), 40));

        Allocation result = allocator.allocate("Math", TUE_10_TO_11, List.of(TUE_10), bookings, List.of(), List.of());

        assertInstanceOf(Allocation.Exhausted.class, result);
    }

    @Test
    void searchRangeIsBoundedByWeeks() {
        var oneWeek = new SlotAllocator(40, 1);
        LocalDate friday = LocalDate.of(2024, 5, 17);

        Allocation result = oneWeek.allocate("Math", window(friday, 10, 11), SLOTS, List.of(), List.of(), List.of());

        assertInstanceOf(Allocation.Exhausted.class, result);
        assertEquals(LocalDate.of(2024, 5, 13), oneWeek.rangeStart(window(friday, 10, 11)));
        assertEquals(LocalDate.of(2024, 5, 20), oneWeek.rangeEnd(window(friday, 10, 11)));
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new SlotAllocator(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new SlotAllocator(40, 0));
    }

    private static SlotOccurrence occurrence(Allocation allocation) {
        return assertInstanceOf(Allocation.Assigned.class, allocation).occurrence();
    }

    private static WeeklySlot slot(long id, DayOfWeek day, int hour) {
        return new WeeklySlot(id, day, LocalTime.of(hour, 0), LocalTime.of(hour + 1, 0));
    }

    private static TimeWindow window(LocalDate date, int fromHour, int toHour) {
        return new TimeWindow(LocalDateTime.of(date, LocalTime.of(fromHour, 0)),
                LocalDateTime.of(date, LocalTime.of(toHour, 0)));
    }
}
