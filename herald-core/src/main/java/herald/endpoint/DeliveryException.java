package herald.endpoint;

/**
 * Failure reported by {@link DeliveryEndpoint#send}.
 *
 * <p>The queue retries jobs by attempt count alone, so the transient/permanent split is
 * informational: it shows up in logs, outcomes and metrics but never changes the retry decision.
 *
 * @see TransientDeliveryException
 * @see PermanentDeliveryException
 */
public abstract sealed class DeliveryException extends Exception
    permits TransientDeliveryException, PermanentDeliveryException {

  protected DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Whether retrying the same request later could succeed. */
  public abstract boolean isTransient();
}
