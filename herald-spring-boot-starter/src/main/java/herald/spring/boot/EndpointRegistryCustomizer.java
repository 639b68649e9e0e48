package herald.spring.boot;

import herald.endpoint.EndpointRegistry;

/**
 * Callback for adding endpoint factories to the auto-configured {@link EndpointRegistry}.
 * Every bean of this type is applied in {@link org.springframework.core.annotation.Order} order.
 *
 * <pre>{@code
 * @Bean
 * EndpointRegistryCustomizer slack() {
 *   return registry -> registry.register(SlackEndpoint::new, "slack");
 * }
 * }</pre>
 */
@FunctionalInterface
public interface EndpointRegistryCustomizer {

  void customize(EndpointRegistry.Builder registry);
}
