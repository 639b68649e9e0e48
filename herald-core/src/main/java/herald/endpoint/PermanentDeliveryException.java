package herald.endpoint;

/**
 * Delivery was rejected: HTTP 4xx other than 429, bad credentials, an unusable payload.
 */
public final class PermanentDeliveryException extends DeliveryException {
  public PermanentDeliveryException(String message) {
    super(message, null);
  }

  public PermanentDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isTransient() {
    return false;
  }
}
