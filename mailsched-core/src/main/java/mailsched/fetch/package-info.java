/**
 * Bounded worker pool that fetches, deduplicates, extracts and reconciles mail per student.
 *
 * @see mailsched.fetch.BoundedFetchScheduler
 * @see mailsched.fetch.ExtractionGate
 * @see mailsched.fetch.RunReport
 */
package mailsched.fetch;
