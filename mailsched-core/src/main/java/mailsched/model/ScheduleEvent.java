package mailsched.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Typed result of extracting one message.
 *
 * <ul>
 *   <li>{@link InterviewEvent}: a company drive invitation (online assessment or interview).</li>
 *   <li>{@link RescheduleEvent}: a class needs to be moved into a slot near a requested window.</li>
 *   <li>{@link NoEvent}: nothing actionable, including unparseable content.</li>
 * </ul>
 *
 * <p>Instances are immutable.
 */
public sealed interface ScheduleEvent
    permits ScheduleEvent.InterviewEvent, ScheduleEvent.RescheduleEvent, ScheduleEvent.NoEvent {

  /** Shared {@link NoEvent} for messages with nothing to schedule. */
  NoEvent NONE = new NoEvent("no scheduling content");

  static NoEvent none(String reason) {
    return new NoEvent(reason);
  }

  /**
   * Company drive invitation. The pair {@code (company, datetime)} together with the
   * student forms the idempotence key of the resulting {@link CompanyDrive}.
   */
  record InterviewEvent(String company, LocalDateTime datetime, DriveStage stage) implements ScheduleEvent {
    public InterviewEvent {
      Objects.requireNonNull(company, "company");
      Objects.requireNonNull(datetime, "datetime");
      company = company.strip();
      if (company.isEmpty()) {
        throw new IllegalArgumentException("company must not be blank");
      }
      stage = stage == null ? DriveStage.INTERVIEW : stage;
    }

    public InterviewEvent(String company, LocalDateTime datetime) {
      this(company, datetime, DriveStage.INTERVIEW);
    }
  }

  /** Request to move a class of {@code subject} into a slot within or near {@code requestedWindow}. */
  record RescheduleEvent(String subject, TimeWindow requestedWindow) implements ScheduleEvent {
    public RescheduleEvent {
      Objects.requireNonNull(subject, "subject");
      Objects.requireNonNull(requestedWindow, "requestedWindow");
      subject = subject.strip();
      if (subject.isEmpty()) {
        throw new IllegalArgumentException("subject must not be blank");
      }
    }
  }

  /** Nothing to schedule. {@code reason} is diagnostic only. */
  record NoEvent(String reason) implements ScheduleEvent {
    public NoEvent {
      reason = reason == null ? "" : reason;
    }
  }
}
