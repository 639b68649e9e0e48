package herald.endpoint;

/**
 * Thrown when a service URL is malformed or lacks something its endpoint needs
 * (credentials, host, a required path segment).
 */
public class InvalidEndpointUrlException extends IllegalArgumentException {
  public InvalidEndpointUrlException(String message) {
    super(message);
  }

  public InvalidEndpointUrlException(String message, Throwable cause) {
    super(message, cause);
  }
}
