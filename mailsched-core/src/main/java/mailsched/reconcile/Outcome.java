package mailsched.reconcile;

/**
 * What reconciling one event did.
 */
public enum Outcome {
  /** A new company drive and its notification were committed. */
  CREATED_DRIVE,
  /** The student was assigned to a rescheduled class. */
  ASSIGNED,
  /** No slot was available; a {@code NO_SLOT_AVAILABLE} notification was committed. */
  NO_SLOT,
  /** The event had already been applied; nothing changed. */
  DUPLICATE,
  NO_EVENT,
  /** The unit of work was rolled back because of a store failure. */
  FAILED
}
