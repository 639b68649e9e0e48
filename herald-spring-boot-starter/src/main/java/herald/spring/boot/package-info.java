/**
 * Spring Boot auto-configuration for Herald.
 *
 * <p>With a {@code DataSource} in the context, {@link herald.spring.boot.HeraldAutoConfiguration}
 * starts a {@link herald.Herald} bound to {@code herald.*} properties. Endpoints are added through
 * {@link herald.spring.boot.EndpointRegistryCustomizer} beans.
 */
package herald.spring.boot;
