package mailsched;

import java.time.Instant;
import java.util.Objects;

/**
 * One fetched email. Transient: the body is never persisted.
 *
 * @param identity    the mailbox the message was fetched from
 * @param fingerprint stable identifier used for deduplication
 * @param messageId   mailbox-level message id
 * @param receivedAt  message timestamp, used for fetch ordering
 * @param body        plain-text body handed to extraction
 */
public record RawMessage(
    Identity identity,
    Fingerprint fingerprint,
    String messageId,
    Instant receivedAt,
    String body
) {

  public RawMessage {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(fingerprint, "fingerprint");
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(receivedAt, "receivedAt");
    body = body == null ? "" : body;
  }

  /**
   * Creates a message whose fingerprint is derived from {@code messageId} and {@code receivedAt}.
   */
  public static RawMessage of(Identity identity, String messageId, Instant receivedAt, String body) {
    return new RawMessage(identity, Fingerprint.of(messageId, receivedAt), messageId, receivedAt, body);
  }

  @Override
  public String toString() {
    return "RawMessage[" + identity.studentId() + ", " + fingerprint + ", " + receivedAt + "]";
  }
}
