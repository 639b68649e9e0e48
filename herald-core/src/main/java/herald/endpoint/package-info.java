/**
 * Delivery endpoints and the scheme registry that creates them from service URLs.
 *
 * <p>Every service is addressed by a URL of the form
 * {@code scheme://[user[:pass]@]host[:port][/path][?query]}. The
 * {@link herald.endpoint.EndpointRegistry} picks an {@link herald.endpoint.EndpointFactory} by
 * scheme; the {@link herald.endpoint.DeliveryEndpoint} it creates interprets the rest.
 */
package herald.endpoint;
