package mailsched.dedup;

import mailsched.Fingerprint;
import mailsched.Identity;

/**
 * Set of message fingerprints already processed, partitioned by identity.
 *
 * <p>A {@code (student, fingerprint)} pair is handed to extraction at most once for the
 * lifetime of a cache instance. The cache is not durable: after a restart, replays are
 * absorbed by the natural keys of the persistence layer.
 *
 * <p>Implementations must allow concurrent use from workers handling different
 * identities without contending on a single lock.
 *
 * @see InMemoryDeduplicationCache
 */
public interface DeduplicationCache {

  /**
   * Returns {@code true} if the fingerprint was already recorded for this identity.
   */
  boolean seen(Identity identity, Fingerprint fingerprint);

  /**
   * Records the fingerprint for this identity.
   */
  void mark(Identity identity, Fingerprint fingerprint);

  /**
   * Atomically records the fingerprint if absent.
   *
   * @return {@code true} if this call recorded it (the caller now owns the message)
   */
  boolean markIfAbsent(Identity identity, Fingerprint fingerprint);

  /**
   * Removes a fingerprint, so a claimed but unprocessed message can be picked up again.
   */
  void forget(Identity identity, Fingerprint fingerprint);

  /**
   * Drops fingerprints that fall outside the retention policy.
   *
   * @return number of fingerprints removed
   */
  int evictExpired();

  /**
   * Total fingerprints currently held.
   */
  int size();

  /** Drops all state. */
  void clear();
}
