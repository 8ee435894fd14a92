package mailsched.extract;

import mailsched.model.ScheduleEvent;
import mailsched.spi.CompletionClient;
import mailsched.spi.EventExtractor;
import mailsched.spi.ExtractionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventExtractor} that asks a text-completion model to classify each message and
 * answer with a flat JSON object, decoded by {@link JsonEventDecoder}.
 *
 * <p>One prompt per message. A failed completion or a malformed answer only affects its
 * own message, which becomes {@link ScheduleEvent.NoEvent}. Only when every completion of
 * the call fails is an {@link ExtractionException} thrown, so the caller can retry.
 */
public final class PromptedEventExtractor implements EventExtractor {
  private static final Logger logger = Logger.getLogger(PromptedEventExtractor.class.getName());

  static final int DEFAULT_MAX_BODY_CHARS = 8000;

  static final String PROMPT = """
      You read emails sent to a university student and extract scheduling information.
      Classify the email as one of:
        - "interview": an online assessment (OA) or interview invitation from a company
        - "reschedule": a notice that a class of a subject must be moved
        - "none": anything else
      Answer with a single JSON object and nothing else, using these keys:
        "type": "interview" | "reschedule" | "none",
        "company_name": company name, or "None",
        "interview_datetime": "YYYY-MM-DD HH:MM", or "None",
        "drive_stage": "OA" or "Interview", or "None",
        "subject": subject of the class to reschedule, or "None",
        "window_start": "YYYY-MM-DD HH:MM" of the requested time, or "None",
        "window_end": "YYYY-MM-DD HH:MM", or "None"

      Email:
      %s
      """;

  private final CompletionClient client;
  private final JsonEventDecoder decoder;
  private final int maxBodyChars;

  public PromptedEventExtractor(CompletionClient client) {
    this(client, new JsonEventDecoder(), DEFAULT_MAX_BODY_CHARS);
  }

  public PromptedEventExtractor(CompletionClient client, JsonEventDecoder decoder, int maxBodyChars) {
    this.client = Objects.requireNonNull(client, "client");
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    if (maxBodyChars < 1) {
      throw new IllegalArgumentException("maxBodyChars must be >= 1");
    }
    this.maxBodyChars = maxBodyChars;
  }

  @Override
  public List<ScheduleEvent> extract(List<String> bodies) {
    List<ScheduleEvent> events = new ArrayList<>(bodies.size());
    RuntimeException lastFailure = null;
    int failed = 0;
    for (String body : bodies) {
      String answer;
      try {
        answer = client.complete(prompt(body));
      } catch (RuntimeException e) {
        lastFailure = e;
        failed++;
        logger.log(Level.WARNING, "Completion failed for one message", e);
        events.add(ScheduleEvent.none("completion failed: " + e.getMessage()));
        continue;
      }
      ScheduleEvent event = decoder.decode(answer);
      if (event instanceof ScheduleEvent.NoEvent none && !none.reason().equals(ScheduleEvent.NONE.reason())) {
        logger.log(Level.FINE, "Answer decoded to no event: {0}", none.reason());
      }
      events.add(event);
    }
    if (failed > 0 && failed == bodies.size()) {
      throw new ExtractionException("All " + failed + " completions failed", lastFailure);
    }
    return events;
  }

  String prompt(String body) {
    String text = body == null ? "" : body.strip();
    if (text.length() > maxBodyChars) {
      text = text.substring(0, maxBodyChars);
    }
    return String.format(PROMPT, text);
  }
}
