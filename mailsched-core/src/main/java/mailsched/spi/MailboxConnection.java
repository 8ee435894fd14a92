package mailsched.spi;

import mailsched.Fingerprint;
import mailsched.RawMessage;

import java.util.Collection;
import java.util.List;

/**
 * An open mailbox session.
 */
public interface MailboxConnection extends AutoCloseable {

  /**
   * Lists the unread messages in the mailbox. Order is not significant; the
   * pipeline sorts by {@link RawMessage#receivedAt()}.
   *
   * @throws TransientFetchException on failures worth retrying
   */
  List<RawMessage> listUnread();

  /**
   * Marks the given messages read so they stop appearing in {@link #listUnread()}.
   *
   * @throws TransientFetchException on failures worth retrying
   */
  void markRead(Collection<Fingerprint> fingerprints);

  /** Releases the session. Must not throw checked exceptions. */
  @Override
  void close();
}
