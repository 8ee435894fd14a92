package mailsched.dedup;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds the memory of a {@link DeduplicationCache}: fingerprints older than
 * {@code maxAge} are evicted, and each identity keeps at most {@code maxPerIdentity}
 * fingerprints (oldest evicted first).
 */
public record RetentionPolicy(Duration maxAge, int maxPerIdentity) {

  public static final RetentionPolicy DEFAULT = new RetentionPolicy(Duration.ofDays(7), 10_000);

  public RetentionPolicy {
    Objects.requireNonNull(maxAge, "maxAge");
    if (maxAge.isNegative() || maxAge.isZero()) {
      throw new IllegalArgumentException("maxAge must be > 0");
    }
    if (maxPerIdentity <= 0) {
      throw new IllegalArgumentException("maxPerIdentity must be > 0");
    }
  }
}
