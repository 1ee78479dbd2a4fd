/**
 * Delay policies for retries and idle polling.
 *
 * @see io.committer.retry.RetryStrategy
 * @see io.committer.retry.RetryTracker
 */
package io.committer.retry;
