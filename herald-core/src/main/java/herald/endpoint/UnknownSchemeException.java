package herald.endpoint;

/**
 * Thrown when no factory is registered for a service URL's scheme.
 */
public class UnknownSchemeException extends IllegalArgumentException {
  private final String scheme;

  public UnknownSchemeException(String scheme) {
    super("No endpoint registered for scheme: " + scheme);
    this.scheme = scheme;
  }

  public String scheme() {
    return scheme;
  }
}
