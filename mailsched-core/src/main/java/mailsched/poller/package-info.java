/**
 * Periodic background tasks: pipeline runs and dedup cache eviction.
 */
package mailsched.poller;
