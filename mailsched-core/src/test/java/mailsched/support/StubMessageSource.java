package mailsched.support;

import mailsched.Fingerprint;
import mailsched.Identity;
import mailsched.RawMessage;
import mailsched.spi.MailboxConnection;
import mailsched.spi.MessageSource;
import mailsched.spi.TransientFetchException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mailboxes held in memory, with injectable fetch failures and latency.
 */
public final class StubMessageSource implements MessageSource {

    private final Map<String, List<RawMessage>> unread = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> failuresLeft = new ConcurrentHashMap<>();
    private final AtomicInteger openConnections = new AtomicInteger();
    public final AtomicInteger maxOpenConnections = new AtomicInteger();
    public final AtomicInteger connects = new AtomicInteger();
    public final List<Fingerprint> markedRead = new CopyOnWriteArrayList<>();
    public volatile long listLatencyMs;

    public RawMessage deliver(Identity identity, String messageId, Instant receivedAt, String body) {
        RawMessage message = RawMessage.of(identity, messageId, receivedAt, body);
        unread.computeIfAbsent(identity.studentId(), k -> new CopyOnWriteArrayList<>()).add(message);
        return message;
    }

    /** The next {@code times} connects for the student fail; negative means always. */
    public void failConnects(Identity identity, int times) {
        failuresLeft.put(identity.studentId(), new AtomicInteger(times < 0 ? Integer.MAX_VALUE : times));
    }

    public List<RawMessage> unread(Identity identity) {
        return List.copyOf(unread.getOrDefault(identity.studentId(), List.of()));
    }

    @Override
    public MailboxConnection connect(Identity identity) {
        connects.incrementAndGet();
        AtomicInteger left = failuresLeft.get(identity.studentId());
        if (left != null && left.get() > 0) {
            if (left.get() != Integer.MAX_VALUE) {
                left.decrementAndGet();
            }
            throw new TransientFetchException("connection refused for " + identity.studentId());
        }
        int now = openConnections.incrementAndGet();
        maxOpenConnections.accumulateAndGet(now, Math::max);
        return new MailboxConnection() {
            private boolean closed;

            @Override
            public List<RawMessage> listUnread() {
                if (listLatencyMs > 0) {
                    try {
                        Thread.sleep(listLatencyMs);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new TransientFetchException("interrupted");
                    }
                }
                // Newest first, so the pipeline has to sort.
                List<RawMessage> messages = new ArrayList<>(unread.getOrDefault(identity.studentId(), List.of()));
                messages.sort((a, b) -> b.receivedAt().compareTo(a.receivedAt()));
                return messages;
            }

            @Override
            public void markRead(Collection<Fingerprint> fingerprints) {
                markedRead.addAll(fingerprints);
                List<RawMessage> box = unread.get(identity.studentId());
                if (box != null) {
                    box.removeIf(m -> fingerprints.contains(m.fingerprint()));
                }
            }

            @Override
            public void close() {
                if (!closed) {
                    closed = true;
                    openConnections.decrementAndGet();
                }
            }
        };
    }
}
