package mailsched.fetch;

import mailsched.Identity;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Control over a run started by {@link BoundedFetchScheduler#start}.
 */
public interface RunHandle {

  /**
   * Stops the run at the next batch boundary. Calls already in progress complete;
   * claimed but unprocessed messages are released for a later run.
   */
  void cancel();

  /**
   * Raises the identity's priority by {@code newMessages}, queueing it if it is not
   * queued. An identity a worker is processing is queued again once that pass ends, never
   * handed to a second worker. Ignored once the run has finished.
   */
  void signal(Identity identity, int newMessages);

  boolean isDone();

  /** Waits for the run to finish. */
  RunReport await() throws InterruptedException;

  RunReport await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException;
}
