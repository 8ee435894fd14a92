package mailsched.fetch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter: {@code baseDelay * 2^(failures-1)} scaled by a random
 * factor in {@code [0.5, 1.5)}, never above {@code maxDelay}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay) {
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must be >= 0, got: " + baseDelay);
    }
    if (maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
    }
    this.baseDelayMs = baseDelay.toMillis();
    this.maxDelayMs = maxDelay.toMillis();
  }

  @Override
  public Duration delayAfter(int failures) {
    if (failures <= 0 || baseDelayMs == 0L) {
      return Duration.ZERO;
    }
    long exponential;
    if (failures > 62 || (1L << (failures - 1)) > maxDelayMs / baseDelayMs) {
      exponential = maxDelayMs;
    } else {
      exponential = baseDelayMs << (failures - 1);
    }
    long capped = Math.min(maxDelayMs, exponential);
    long jittered = (long) (capped * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    return Duration.ofMillis(Math.min(maxDelayMs, Math.max(0L, jittered)));
  }
}
