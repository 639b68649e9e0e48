package herald.endpoint;

/**
 * Creates unconfigured {@link DeliveryEndpoint} instances for one service.
 * The registry calls {@link DeliveryEndpoint#parse} on the result.
 */
@FunctionalInterface
public interface EndpointFactory {

  DeliveryEndpoint create();
}
