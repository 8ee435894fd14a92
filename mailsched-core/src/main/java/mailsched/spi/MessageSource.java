package mailsched.spi;

import mailsched.Identity;

/**
 * Capability to open a mailbox session for one identity.
 *
 * <p>The pipeline treats the returned {@link MailboxConnection} as a scoped resource and
 * always closes it, including when listing fails. Implementations (IMAP, Graph API, ...)
 * live outside this library.
 */
public interface MessageSource {

  /**
   * Opens a session to the identity's mailbox.
   *
   * @param identity the mailbox to open
   * @return an open connection; the caller must close it
   * @throws TransientFetchException on network or authentication hiccups worth retrying
   */
  MailboxConnection connect(Identity identity);
}
