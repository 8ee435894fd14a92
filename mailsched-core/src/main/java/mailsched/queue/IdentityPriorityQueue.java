package mailsched.queue;

import mailsched.Identity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pending identities ordered by score (number of pending messages), highest first.
 *
 * <p>Ties are broken by insertion order: an identity that entered the queue earlier is
 * popped first. An identity whose score drops to zero or below leaves the queue; a later
 * positive update re-inserts it behind every identity already queued with the same score.
 *
 * <p>Entries re-queued with a delay stay invisible to {@link #popHighest()} and
 * {@link #poll(long, TimeUnit)} until the delay has elapsed.
 *
 * <p>Thread-safe. All operations hold a single lock for a few map/tree operations.
 */
public final class IdentityPriorityQueue {

  private static final Comparator<Entry> ORDER = Comparator
      .comparingLong((Entry e) -> -e.score)
      .thenComparingLong(e -> e.seq);

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final TreeSet<Entry> ordered = new TreeSet<>(ORDER);
  private final Map<String, Entry> byStudent = new HashMap<>();
  private final Clock clock;
  private long nextSeq;

  public IdentityPriorityQueue() {
    this(Clock.systemUTC());
  }

  public IdentityPriorityQueue(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Adds {@code delta} to the identity's score, inserting it if absent.
   *
   * @return the new score; {@code 0} if the identity is no longer queued
   */
  public long updateScore(Identity identity, long delta) {
    Objects.requireNonNull(identity, "identity");
    lock.lock();
    try {
      Entry current = byStudent.get(identity.studentId());
      long score = (current == null ? 0L : current.score) + delta;
      if (current != null) {
        ordered.remove(current);
        byStudent.remove(identity.studentId());
      }
      if (score <= 0L) {
        return 0L;
      }
      long seq = current == null ? nextSeq++ : current.seq;
      Instant eligibleAt = current == null ? Instant.MIN : current.eligibleAt;
      insert(new Entry(identity, score, seq, eligibleAt));
      return score;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Puts the identity back with {@code score}, not eligible before {@code delay} elapses.
   * Any existing entry for the identity is replaced.
   */
  public void requeue(Identity identity, long score, Duration delay) {
    Objects.requireNonNull(identity, "identity");
    Objects.requireNonNull(delay, "delay");
    if (score <= 0L) {
      throw new IllegalArgumentException("score must be > 0");
    }
    lock.lock();
    try {
      Entry current = byStudent.remove(identity.studentId());
      if (current != null) {
        ordered.remove(current);
      }
      insert(new Entry(identity, score, nextSeq++, clock.instant().plus(delay)));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the highest-scored eligible identity, or {@code null} if none.
   */
  public Identity popHighest() {
    lock.lock();
    try {
      return takeEligible(clock.instant());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Like {@link #popHighest()} but waits up to {@code timeout} for an identity to
   * become available or eligible.
   */
  public Identity poll(long timeout, TimeUnit unit) throws InterruptedException {
    long remainingNanos = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (true) {
        Instant now = clock.instant();
        Identity identity = takeEligible(now);
        if (identity != null) {
          return identity;
        }
        if (remainingNanos <= 0L) {
          return null;
        }
        long waitNanos = remainingNanos;
        Instant nextEligible = earliestEligible();
        if (nextEligible != null && nextEligible.isAfter(now)) {
          waitNanos = Math.min(waitNanos, Duration.between(now, nextEligible).toNanos());
        }
        long slept = waitNanos - changed.awaitNanos(waitNanos);
        remainingNanos -= Math.max(slept, 1L);
      }
    } finally {
      lock.unlock();
    }
  }

  /** Score of a queued identity, {@code 0} if absent. */
  public long score(Identity identity) {
    lock.lock();
    try {
      Entry entry = byStudent.get(identity.studentId());
      return entry == null ? 0L : entry.score;
    } finally {
      lock.unlock();
    }
  }

  public boolean contains(Identity identity) {
    lock.lock();
    try {
      return byStudent.containsKey(identity.studentId());
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return byStudent.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /** Removes all entries. */
  public void clear() {
    lock.lock();
    try {
      ordered.clear();
      byStudent.clear();
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  private void insert(Entry entry) {
    ordered.add(entry);
    byStudent.put(entry.identity.studentId(), entry);
    changed.signalAll();
  }

  private Identity takeEligible(Instant now) {
    Iterator<Entry> it = ordered.iterator();
    while (it.hasNext()) {
      Entry entry = it.next();
      if (!entry.eligibleAt.isAfter(now)) {
        it.remove();
        byStudent.remove(entry.identity.studentId());
        return entry.identity;
      }
    }
    return null;
  }

  private Instant earliestEligible() {
    Instant earliest = null;
    for (Entry entry : ordered) {
      if (earliest == null || entry.eligibleAt.isBefore(earliest)) {
        earliest = entry.eligibleAt;
      }
    }
    return earliest;
  }

  private static final class Entry {
    final Identity identity;
    final long score;
    final long seq;
    final Instant eligibleAt;

    Entry(Identity identity, long score, long seq, Instant eligibleAt) {
      this.identity = identity;
      this.score = score;
      this.seq = seq;
      this.eligibleAt = eligibleAt;
    }
  }
}
