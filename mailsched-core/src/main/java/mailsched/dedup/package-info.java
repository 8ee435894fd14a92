/**
 * Per-identity set of processed message fingerprints.
 */
package mailsched.dedup;
