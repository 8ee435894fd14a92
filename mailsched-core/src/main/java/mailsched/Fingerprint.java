package mailsched;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Stable identifier of a fetched message, used to recognise repeats across fetches.
 *
 * <p>Derived from the mailbox message id and the message timestamp so that a server
 * re-using ids after mailbox compaction does not collide with an older message.
 */
public record Fingerprint(String value) {

  public Fingerprint {
    Objects.requireNonNull(value, "value");
    if (value.isEmpty()) {
      throw new IllegalArgumentException("value must not be empty");
    }
  }

  /**
   * Derives a fingerprint as the SHA-256 hex digest of {@code messageId + '\n' + epochMillis}.
   *
   * @param messageId  the mailbox message id (e.g. IMAP UID or Message-ID header)
   * @param receivedAt the message timestamp
   * @return the derived fingerprint
   */
  public static Fingerprint of(String messageId, Instant receivedAt) {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(receivedAt, "receivedAt");
    String material = messageId + '\n' + receivedAt.toEpochMilli();
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(material.getBytes(StandardCharsets.UTF_8));
      return new Fingerprint(HexFormat.of().formatHex(hash));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  @Override
  public String toString() {
    return value.length() > 12 ? value.substring(0, 12) : value;
  }
}
