package mailsched.spi;

/**
 * Minimal text-completion capability of an inference provider.
 *
 * @see mailsched.extract.PromptedEventExtractor
 */
@FunctionalInterface
public interface CompletionClient {

  /**
   * Sends a prompt and returns the raw model answer.
   *
   * @throws ExtractionException if the provider call fails
   */
  String complete(String prompt);
}
