/**
 * Durable priority queue with exponential-backoff retries and its worker loop.
 */
package herald.queue;
