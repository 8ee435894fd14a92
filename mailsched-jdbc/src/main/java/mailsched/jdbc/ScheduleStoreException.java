package mailsched.jdbc;

/**
 * Unchecked exception wrapping JDBC errors that are neither key conflicts nor
 * connectivity failures.
 */
public final class ScheduleStoreException extends RuntimeException {
  public ScheduleStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
