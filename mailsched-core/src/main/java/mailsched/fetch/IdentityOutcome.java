package mailsched.fetch;

/**
 * How processing of one identity ended within a run.
 */
public enum IdentityOutcome {
  /** Mailbox fetched and every claimed message processed. */
  SUCCEEDED,
  /** Fetch kept failing after the configured number of attempts. */
  FAILED,
  /** The run was cancelled before the identity was done. */
  CANCELLED,
  /** The run halted because the store became unavailable. */
  ABORTED
}
