package mailsched.spi;

/**
 * Network or authentication hiccup while talking to a mailbox. The fetch is retried
 * with backoff a bounded number of times before the identity is reported as failed.
 */
public class TransientFetchException extends RuntimeException {

  public TransientFetchException(String message) {
    super(message);
  }

  public TransientFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
