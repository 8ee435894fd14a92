package mailsched.spi;

/**
 * The persistence backend cannot be reached at all. Fatal for the current run:
 * no new work is started once this is observed.
 */
public class PersistenceUnavailableException extends RuntimeException {

  public PersistenceUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
