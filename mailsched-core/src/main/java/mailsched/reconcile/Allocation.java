package mailsched.reconcile;

import mailsched.model.SlotOccurrence;

import java.util.Objects;

/**
 * Result of {@link SlotAllocator#allocate}.
 */
public sealed interface Allocation permits Allocation.Assigned, Allocation.Exhausted {

  /** A free occurrence was found. {@code assignedCount} is its load before this assignment. */
  record Assigned(SlotOccurrence occurrence, int assignedCount) implements Allocation {
    public Assigned {
      Objects.requireNonNull(occurrence, "occurrence");
    }
  }

  /** No occurrence in the search range is free for the student. */
  record Exhausted(String reason) implements Allocation {
    public Exhausted {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
