package mailsched.fetch;

import mailsched.Identity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summary of one scheduler run.
 *
 * @param outcomes     per-identity outcome, in the order identities finished
 * @param fetched      messages returned by mailbox listings
 * @param deduplicated messages skipped because their fingerprint had been seen
 * @param extracted    messages handed to extraction
 * @param drives       company drives created
 * @param assignments  rescheduled-class assignments created
 * @param noSlot       reschedule requests that found no slot
 * @param duplicates   events that had already been applied
 * @param failed       messages whose reconciliation was rolled back
 */
public record RunReport(
    Map<Identity, IdentityOutcome> outcomes,
    int fetched,
    int deduplicated,
    int extracted,
    int drives,
    int assignments,
    int noSlot,
    int duplicates,
    int failed
) {

  public RunReport {
    outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(outcomes, "outcomes")));
  }

  public IdentityOutcome outcomeOf(Identity identity) {
    return outcomes.get(identity);
  }

  public List<Identity> identitiesWith(IdentityOutcome outcome) {
    List<Identity> result = new ArrayList<>();
    outcomes.forEach((identity, o) -> {
      if (o == outcome) {
        result.add(identity);
      }
    });
    return result;
  }

  @Override
  public String toString() {
    return "RunReport[identities=" + outcomes.size()
        + ", succeeded=" + identitiesWith(IdentityOutcome.SUCCEEDED).size()
        + ", failed=" + identitiesWith(IdentityOutcome.FAILED).size()
        + ", cancelled=" + identitiesWith(IdentityOutcome.CANCELLED).size()
        + ", aborted=" + identitiesWith(IdentityOutcome.ABORTED).size()
        + ", fetched=" + fetched + ", deduplicated=" + deduplicated + ", extracted=" + extracted
        + ", drives=" + drives + ", assignments=" + assignments + ", noSlot=" + noSlot
        + ", duplicates=" + duplicates + ", failedMessages=" + failed + "]";
  }
}
