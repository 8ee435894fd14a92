package mailsched.spi;

/**
 * A unique idempotence key collided at write time. Signals that an equivalent write
 * already succeeded; the reconciliation unit is rolled back and treated as a no-op.
 */
public class PersistenceConflictException extends RuntimeException {

  public PersistenceConflictException(String message, Throwable cause) {
    super(message, cause);
  }
}
