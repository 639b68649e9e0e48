package herald.endpoint;

/**
 * Delivery failed for a reason that may clear up: HTTP 5xx, 429, timeouts, connection resets.
 */
public final class TransientDeliveryException extends DeliveryException {
  public TransientDeliveryException(String message) {
    super(message, null);
  }

  public TransientDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isTransient() {
    return true;
  }
}
