package mailsched.reconcile;

import mailsched.model.CompanyDrive;
import mailsched.model.NotificationType;
import mailsched.model.RescheduledClass;

import java.util.Objects;

/**
 * Minimal set of writes planned for one event, applied atomically by
 * {@link ReconciliationEngine}.
 *
 * @param outcome     outcome reported once the writes commit
 * @param drive       drive to insert, or {@code null}
 * @param targetClass class to assign the student to; {@code id == 0} when it must be created first
 * @param notification notification to append once the rows it refers to exist, or {@code null}
 */
public record WriteSet(
    String studentId,
    Outcome outcome,
    CompanyDrive drive,
    RescheduledClass targetClass,
    Draft notification
) {

  public WriteSet {
    Objects.requireNonNull(studentId, "studentId");
    Objects.requireNonNull(outcome, "outcome");
  }

  static WriteSet nothing(String studentId, Outcome outcome) {
    return new WriteSet(studentId, outcome, null, null, null);
  }

  public boolean isEmpty() {
    return drive == null && targetClass == null && notification == null;
  }

  /** Notification content; the reference id is filled in when the referenced row exists. */
  public record Draft(NotificationType type, String message, String dedupKey) {
    public Draft {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(message, "message");
      Objects.requireNonNull(dedupKey, "dedupKey");
    }
  }
}
