package mailsched.spi;

import mailsched.model.ScheduleEvent;

import java.util.List;

/**
 * Capability that converts message bodies into typed scheduling events.
 *
 * <p>One call classifies a message as interview, reschedule or nothing, so each message
 * costs a single call to the inference service.
 */
@FunctionalInterface
public interface EventExtractor {

  /**
   * Extracts one event per input body, in input order. Unparseable items yield
   * {@link ScheduleEvent.NoEvent}. Must be idempotent for identical text.
   *
   * @param bodies message bodies, never empty
   * @return exactly {@code bodies.size()} events
   * @throws ExtractionException when the whole call fails
   */
  List<ScheduleEvent> extract(List<String> bodies);
}
