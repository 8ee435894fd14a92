package mailsched.fetch;

import java.time.Duration;

/**
 * Computes how long to wait before retrying a failed mailbox fetch or extraction call.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * @param failures number of consecutive failures so far (1-based)
     * @return delay before the next attempt, never negative
     */
    Duration delayAfter(int failures);
}
