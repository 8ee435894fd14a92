package mailsched.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only fact read by the dashboard.
 *
 * @param referenceId id of the {@link CompanyDrive} or {@link RescheduledClass} this
 *                    notification refers to; {@code null} for {@link NotificationType#NO_SLOT_AVAILABLE}
 * @param dedupKey    unique key that makes re-inserting the same notification a conflict
 */
public record Notification(
    long id,
    String studentId,
    NotificationType type,
    Long referenceId,
    String message,
    String dedupKey,
    Instant createdAt
) {

  public Notification {
    Objects.requireNonNull(studentId, "studentId");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(dedupKey, "dedupKey");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public Notification withId(long newId) {
    return new Notification(newId, studentId, type, referenceId, message, dedupKey, createdAt);
  }
}
