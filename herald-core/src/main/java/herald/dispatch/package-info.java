/**
 * Concurrent fan-out of one notification to many endpoints, and the rules that turn the
 * per-endpoint outcomes into a job state.
 *
 * @see herald.dispatch.FanOutDispatcher
 * @see herald.dispatch.OutcomeAggregator
 * @see herald.dispatch.RetryPolicy
 */
package herald.dispatch;
