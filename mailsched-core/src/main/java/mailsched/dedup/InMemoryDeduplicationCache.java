package mailsched.dedup;

import mailsched.Fingerprint;
import mailsched.Identity;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-partitioned dedup cache. Each identity owns an insertion-ordered
 * map of fingerprint to first-seen time, guarded by its own monitor, so workers on
 * different identities never contend.
 *
 * <p>Expired entries are trimmed lazily on {@link #mark} and in bulk by
 * {@link #evictExpired()} (see {@link mailsched.poller.DedupEvictionScheduler}).
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryDeduplicationCache implements DeduplicationCache {
  private final Map<String, Partition> partitions = new ConcurrentHashMap<>();
  private final RetentionPolicy policy;
  private final Clock clock;

  public InMemoryDeduplicationCache() {
    this(RetentionPolicy.DEFAULT, Clock.systemUTC());
  }

  public InMemoryDeduplicationCache(RetentionPolicy policy) {
    this(policy, Clock.systemUTC());
  }

  public InMemoryDeduplicationCache(RetentionPolicy policy, Clock clock) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public boolean seen(Identity identity, Fingerprint fingerprint) {
    Partition partition = partitions.get(identity.studentId());
    if (partition == null) {
      return false;
    }
    synchronized (partition) {
      Instant at = partition.entries.get(fingerprint.value());
      return at != null && !expired(at, clock.instant());
    }
  }

  @Override
  public void mark(Identity identity, Fingerprint fingerprint) {
    markIfAbsent(identity, fingerprint);
  }

  @Override
  public boolean markIfAbsent(Identity identity, Fingerprint fingerprint) {
    while (true) {
      Partition partition = partitions.computeIfAbsent(identity.studentId(), k -> new Partition());
      Instant now = clock.instant();
      synchronized (partition) {
        if (partition.retired) {
          // Evicted between lookup and lock; pick up the replacement partition
          continue;
        }
        trim(partition, now);
        Instant existing = partition.entries.get(fingerprint.value());
        if (existing != null) {
          return false;
        }
        partition.entries.put(fingerprint.value(), now);
        while (partition.entries.size() > policy.maxPerIdentity()) {
          Iterator<String> oldest = partition.entries.keySet().iterator();
          oldest.next();
          oldest.remove();
        }
        return true;
      }
    }
  }

  @Override
  public void forget(Identity identity, Fingerprint fingerprint) {
    Partition partition = partitions.get(identity.studentId());
    if (partition == null) {
      return;
    }
    synchronized (partition) {
      partition.entries.remove(fingerprint.value());
    }
  }

  @Override
  public int evictExpired() {
    Instant now = clock.instant();
    int removed = 0;
    for (Map.Entry<String, Partition> e : partitions.entrySet()) {
      Partition partition = e.getValue();
      synchronized (partition) {
        removed += trim(partition, now);
        if (partition.entries.isEmpty() && partitions.remove(e.getKey(), partition)) {
          partition.retired = true;
        }
      }
    }
    return removed;
  }

  @Override
  public int size() {
    int total = 0;
    for (Partition partition : partitions.values()) {
      synchronized (partition) {
        total += partition.entries.size();
      }
    }
    return total;
  }

  @Override
  public void clear() {
    for (Map.Entry<String, Partition> e : partitions.entrySet()) {
      Partition partition = e.getValue();
      synchronized (partition) {
        if (partitions.remove(e.getKey(), partition)) {
          partition.retired = true;
        }
      }
    }
  }

  /** Entries are insertion ordered, so expiry stops at the first young entry. */
  private int trim(Partition partition, Instant now) {
    int removed = 0;
    Iterator<Instant> it = partition.entries.values().iterator();
    while (it.hasNext()) {
      if (!expired(it.next(), now)) {
        break;
      }
      it.remove();
      removed++;
    }
    return removed;
  }

  private boolean expired(Instant markedAt, Instant now) {
    return markedAt.plus(policy.maxAge()).isBefore(now);
  }

  private static final class Partition {
    private final LinkedHashMap<String, Instant> entries = new LinkedHashMap<>();
    private boolean retired;
  }
}
