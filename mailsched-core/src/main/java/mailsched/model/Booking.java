package mailsched.model;

import java.time.LocalDate;

/**
 * Current load of one slot occurrence: number of students assigned to pending
 * rescheduled classes in {@code slotId} on {@code date}.
 */
public record Booking(long slotId, LocalDate date, int assignedCount) {
}
