package mailsched.spi;

/**
 * Extraction call failed or returned malformed content. Affected messages degrade to
 * {@link mailsched.model.ScheduleEvent.NoEvent}.
 */
public class ExtractionException extends RuntimeException {

  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
