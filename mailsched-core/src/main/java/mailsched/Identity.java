package mailsched;

import java.util.Objects;

/**
 * One student's mailbox processing context.
 *
 * <p>The credentials handle is an opaque reference into an external credential store;
 * the pipeline only passes it through to {@link mailsched.spi.MessageSource#connect}.
 * It is excluded from {@link #toString()}.
 *
 * @param studentId         student identifier, the partition key for dedup and reconciliation
 * @param credentialsHandle opaque handle for mailbox credentials (may be {@code null})
 */
public record Identity(String studentId, String credentialsHandle) {

  public Identity {
    Objects.requireNonNull(studentId, "studentId");
    if (studentId.isEmpty()) {
      throw new IllegalArgumentException("studentId must not be empty");
    }
  }

  public static Identity of(String studentId) {
    return new Identity(studentId, null);
  }

  @Override
  public String toString() {
    return "Identity[" + studentId + "]";
  }
}
