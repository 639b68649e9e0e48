package herald.endpoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Immutable scheme → {@link EndpointFactory} table.
 *
 * <p>Populate it once at bootstrap through {@link #builder()}; after {@link Builder#build()} the
 * table never changes, so lookups need no locking. Schemes are case-sensitive and several
 * schemes (aliases) may share one factory.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EndpointRegistry registry = EndpointRegistry.builder()
 *     .register(JsonWebhookEndpoint::new, "json", "jsons")
 *     .alias("webhook", "json")
 *     .build();
 *
 * DeliveryEndpoint endpoint = registry.resolve("json://hooks.example.com/notify");
 * }</pre>
 */
public final class EndpointRegistry {
  private static final Logger logger = Logger.getLogger(EndpointRegistry.class.getName());

  private final Map<String, EndpointFactory> factories;

  private EndpointRegistry(Map<String, EndpointFactory> factories) {
    this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Registered schemes, aliases included, in registration order. */
  public Set<String> schemes() {
    return factories.keySet();
  }

  public boolean supports(String scheme) {
    return factories.containsKey(scheme);
  }

  /**
   * Parses {@code url}, picks the factory for its scheme and returns the configured endpoint.
   *
   * @throws InvalidEndpointUrlException if the URL is malformed or the endpoint rejects it
   * @throws UnknownSchemeException      if no factory handles the scheme
   */
  public DeliveryEndpoint resolve(String url) {
    return resolve(EndpointUrl.parse(url));
  }

  /**
   * Resolves an already parsed URL.
   *
   * @throws InvalidEndpointUrlException if the endpoint rejects the URL
   * @throws UnknownSchemeException      if no factory handles the scheme
   */
  public DeliveryEndpoint resolve(EndpointUrl url) {
    DeliveryEndpoint endpoint = factoryFor(url.scheme()).create();
    endpoint.parse(url);
    return endpoint;
  }

  /**
   * Checks that {@code url} would resolve, without keeping the endpoint.
   *
   * @throws InvalidEndpointUrlException if the URL is malformed or the endpoint rejects it
   * @throws UnknownSchemeException      if no factory handles the scheme
   */
  public void validate(String url) {
    EndpointUrl parsed = EndpointUrl.parse(url);
    factoryFor(parsed.scheme()).create().validate(parsed);
  }

  /**
   * Validates every URL, failing on the first bad one.
   *
   * @throws InvalidEndpointUrlException if a URL is malformed or rejected
   * @throws UnknownSchemeException      if a URL has an unregistered scheme
   */
  public void validateAll(List<String> urls) {
    for (String url : urls) {
      validate(url);
    }
  }

  /**
   * Resolves every URL, failing on the first bad one.
   */
  public List<DeliveryEndpoint> resolveAll(List<String> urls) {
    List<DeliveryEndpoint> endpoints = new ArrayList<>(urls.size());
    for (String url : urls) {
      endpoints.add(resolve(url));
    }
    return endpoints;
  }

  /**
   * Resolves the URLs that can be resolved and reports the rest to {@code onError}, keeping the
   * original order among the survivors.
   *
   * @param urls    service URLs
   * @param onError receives each rejected URL (redacted) and the reason
   * @return resolved endpoints paired with their parsed URLs
   */
  public List<Resolved> resolveLenient(List<String> urls, BiConsumer<String, RuntimeException> onError) {
    List<Resolved> resolved = new ArrayList<>(urls.size());
    for (String url : urls) {
      EndpointUrl parsed;
      try {
        parsed = EndpointUrl.parse(url);
        resolved.add(new Resolved(parsed, resolve(parsed)));
      } catch (InvalidEndpointUrlException | UnknownSchemeException e) {
        onError.accept(safeForLog(url), e);
      }
    }
    return resolved;
  }

  private EndpointFactory factoryFor(String scheme) {
    EndpointFactory factory = factories.get(scheme);
    if (factory == null) {
      throw new UnknownSchemeException(scheme);
    }
    return factory;
  }

  private static String safeForLog(String url) {
    try {
      return EndpointUrl.parse(url).redacted();
    } catch (InvalidEndpointUrlException e) {
      logger.log(Level.FINE, "Unparseable service URL", e);
      return "<unparseable>";
    }
  }

  /**
   * An endpoint together with the URL it was configured from.
   *
   * @param url      parsed service URL
   * @param endpoint configured endpoint
   */
  public record Resolved(EndpointUrl url, DeliveryEndpoint endpoint) {
    public Resolved {
      Objects.requireNonNull(url, "url");
      Objects.requireNonNull(endpoint, "endpoint");
    }
  }

  /** Builder for {@link EndpointRegistry}. Not thread-safe. */
  public static final class Builder {
    private final Map<String, EndpointFactory> factories = new LinkedHashMap<>();

    private Builder() {
    }

    /**
     * Registers {@code factory} under one or more schemes.
     *
     * @throws IllegalArgumentException if no scheme is given or a scheme is already registered
     */
    public Builder register(EndpointFactory factory, String... schemes) {
      Objects.requireNonNull(factory, "factory");
      if (schemes == null || schemes.length == 0) {
        throw new IllegalArgumentException("at least one scheme is required");
      }
      for (String scheme : schemes) {
        put(scheme, factory);
      }
      return this;
    }

    /**
     * Makes {@code alias} resolve to the factory already registered for {@code scheme}.
     *
     * @throws IllegalArgumentException if {@code scheme} is not registered or {@code alias} is taken
     */
    public Builder alias(String alias, String scheme) {
      EndpointFactory factory = factories.get(scheme);
      if (factory == null) {
        throw new IllegalArgumentException("Cannot alias unknown scheme: " + scheme);
      }
      put(alias, factory);
      return this;
    }

    private void put(String scheme, EndpointFactory factory) {
      Objects.requireNonNull(scheme, "scheme");
      if (scheme.isEmpty()) {
        throw new IllegalArgumentException("scheme cannot be empty");
      }
      if (factories.putIfAbsent(scheme, factory) != null) {
        throw new IllegalArgumentException("Scheme already registered: " + scheme);
      }
    }

    public EndpointRegistry build() {
      return new EndpointRegistry(factories);
    }
  }
}
