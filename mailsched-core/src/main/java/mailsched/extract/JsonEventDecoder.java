package mailsched.extract;

import mailsched.model.DriveStage;
import mailsched.model.ScheduleEvent;
import mailsched.model.TimeWindow;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps the flat JSON answer of an extraction prompt onto a {@link ScheduleEvent}.
 *
 * <p>Recognised keys: {@code type} ({@code interview}, {@code reschedule} or {@code none}),
 * {@code company_name}, {@code interview_datetime}, {@code drive_stage}, {@code subject},
 * {@code window_start} and {@code window_end}. When {@code type} is absent it is inferred
 * from which fields are present. Placeholder values such as {@code "None"} or {@code "N/A"}
 * count as missing. Anything that cannot be turned into a valid event decodes to
 * {@link ScheduleEvent.NoEvent}; this class never throws for bad model output.
 */
public final class JsonEventDecoder {

  /** Length of a reschedule window when the answer gives only its start. */
  static final Duration DEFAULT_WINDOW = Duration.ofHours(1);

  private static final Set<String> PLACEHOLDERS = Set.of("", "none", "null", "n/a", "na", "unknown");

  private static final List<DateTimeFormatter> DATETIME_FORMATS = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE_TIME,
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]"),
      DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm[:ss]"),
      DateTimeFormatter.ofPattern("dd-MM-yyyy HH:mm[:ss]"),
      DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm[:ss]"));

  /**
   * Decodes a raw model answer.
   */
  public ScheduleEvent decode(String answer) {
    Map<String, String> fields;
    try {
      fields = FlatJsonReader.readObject(answer);
    } catch (IllegalArgumentException e) {
      return ScheduleEvent.none("unparseable answer: " + e.getMessage());
    }
    return decode(fields);
  }

  /**
   * Decodes already parsed fields.
   */
  public ScheduleEvent decode(Map<String, String> fields) {
    String type = value(fields, "type");
    String company = value(fields, "company_name");
    String interviewAt = value(fields, "interview_datetime");
    String subject = value(fields, "subject");
    String windowStart = value(fields, "window_start");

    if (type == null) {
      if (company != null && interviewAt != null) {
        type = "interview";
      } else if (subject != null && windowStart != null) {
        type = "reschedule";
      } else {
        return ScheduleEvent.NONE;
      }
    }
    try {
      switch (type.toLowerCase(Locale.ROOT)) {
        case "interview", "oa", "drive" -> {
          if (company == null || interviewAt == null) {
            return ScheduleEvent.none("interview without company or date");
          }
          return new ScheduleEvent.InterviewEvent(company, parseDateTime(interviewAt),
              DriveStage.parse(value(fields, "drive_stage")));
        }
        case "reschedule" -> {
          if (subject == null || windowStart == null) {
            return ScheduleEvent.none("reschedule without subject or window");
          }
          LocalDateTime start = parseDateTime(windowStart);
          String windowEnd = value(fields, "window_end");
          LocalDateTime end = windowEnd == null ? start.plus(DEFAULT_WINDOW) : parseDateTime(windowEnd);
          return new ScheduleEvent.RescheduleEvent(subject, new TimeWindow(start, end));
        }
        default -> {
          return ScheduleEvent.NONE;
        }
      }
    } catch (IllegalArgumentException | DateTimeParseException e) {
      return ScheduleEvent.none("invalid " + type + " fields: " + e.getMessage());
    }
  }

  static LocalDateTime parseDateTime(String text) {
    String trimmed = text.strip();
    for (DateTimeFormatter format : DATETIME_FORMATS) {
      try {
        return LocalDateTime.parse(trimmed, format);
      } catch (DateTimeParseException ignored) {
        // next format
      }
    }
    // A bare date means the start of that day.
    return LocalDate.parse(trimmed).atStartOfDay();
  }

  private static String value(Map<String, String> fields, String key) {
    String raw = fields.get(key);
    if (raw == null) {
      return null;
    }
    String stripped = raw.strip();
    return PLACEHOLDERS.contains(stripped.toLowerCase(Locale.ROOT)) ? null : stripped;
  }
}
