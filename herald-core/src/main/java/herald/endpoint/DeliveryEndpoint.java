package herald.endpoint;

import herald.Notification;

/**
 * A configured delivery target, produced by an {@link EndpointFactory} from a service URL.
 *
 * <p>Implementations hold private configuration parsed from the URL and speak one vendor
 * protocol. The core only calls the methods below and never branches on the concrete type.
 * Instances are created per dispatch and discarded afterwards, so they need not be reusable,
 * but {@link #send} must tolerate being called from a pool thread.
 */
public interface DeliveryEndpoint {

  /**
   * Short, stable identifier of the service, e.g. {@code discord} or {@code json}. Used as the
   * {@code service_id} metrics label.
   */
  String serviceId();

  /**
   * Configures this endpoint from {@code url}.
   *
   * @throws InvalidEndpointUrlException if the URL is structurally wrong for this service or
   *                                     lacks a required credential
   */
  void parse(EndpointUrl url);

  /**
   * Checks {@code url} without keeping the result. The default parses into this instance, which
   * is fine for throwaway endpoints created by the registry.
   *
   * @throws InvalidEndpointUrlException if {@link #parse} would reject the URL
   */
  default void validate(EndpointUrl url) {
    parse(url);
  }

  /**
   * Delivers one notification. Bodies longer than {@link #maxBodyLength()} have already been
   * truncated by the dispatcher.
   *
   * @param notification the notification
   * @param ctx          deadline and cancellation signal for this dispatch
   * @throws TransientDeliveryException on failures that may clear up (5xx, 429, timeouts)
   * @throws PermanentDeliveryException on rejections (other 4xx, bad credentials)
   */
  void send(Notification notification, DeliveryContext ctx) throws DeliveryException;

  default boolean supportsAttachments() {
    return false;
  }

  /** Maximum body length in characters; {@code 0} means unlimited. */
  default int maxBodyLength() {
    return 0;
  }

  /** Port used when the URL does not carry one. */
  int defaultPort();
}
