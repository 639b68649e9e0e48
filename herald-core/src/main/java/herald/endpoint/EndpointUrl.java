package herald.endpoint;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parsed service URL of the form {@code scheme://[user[:pass]@]host[:port][/path][?query]}.
 *
 * <p>Parsing is lenient beyond the scheme: credentials may contain characters
 * {@link java.net.URI} rejects, and many endpoints have no host. User, password, path
 * segments and query values are percent-decoded. Only {@link #scheme()} is interpreted by the
 * registry; everything else belongs to the endpoint.
 */
public final class EndpointUrl {
  private static final Pattern SCHEME = Pattern.compile("[A-Za-z][A-Za-z0-9+.\\-]*");

  private final String raw;
  private final String scheme;
  private final String user;
  private final String password;
  private final String host;
  private final int port;
  private final List<String> pathSegments;
  private final Map<String, String> query;

  private EndpointUrl(String raw, String scheme, String user, String password, String host,
      int port, List<String> pathSegments, Map<String, String> query) {
    this.raw = raw;
    this.scheme = scheme;
    this.user = user;
    this.password = password;
    this.host = host;
    this.port = port;
    this.pathSegments = pathSegments;
    this.query = query;
  }

  /**
   * Parses a service URL.
   *
   * @param url the URL text
   * @return the parsed URL
   * @throws InvalidEndpointUrlException if the scheme separator is missing, the scheme is not a
   *                                     valid identifier, or the port is not numeric
   */
  public static EndpointUrl parse(String url) {
    if (url == null || url.isBlank()) {
      throw new InvalidEndpointUrlException("Service URL is empty");
    }
    String text = url.trim();
    int sep = text.indexOf("://");
    if (sep <= 0) {
      throw new InvalidEndpointUrlException("Service URL has no scheme: " + redact(text));
    }
    String scheme = text.substring(0, sep);
    if (!SCHEME.matcher(scheme).matches()) {
      throw new InvalidEndpointUrlException("Invalid scheme: " + scheme);
    }

    String rest = text.substring(sep + 3);
    int hash = rest.indexOf('#');
    if (hash >= 0) {
      rest = rest.substring(0, hash);
    }
    String queryPart = null;
    int q = rest.indexOf('?');
    if (q >= 0) {
      queryPart = rest.substring(q + 1);
      rest = rest.substring(0, q);
    }
    String pathPart = "";
    int slash = rest.indexOf('/');
    String authority = slash >= 0 ? rest.substring(0, slash) : rest;
    if (slash >= 0) {
      pathPart = rest.substring(slash + 1);
    }

    String user = null;
    String password = null;
    int at = authority.lastIndexOf('@');
    if (at >= 0) {
      String userInfo = authority.substring(0, at);
      authority = authority.substring(at + 1);
      int colon = userInfo.indexOf(':');
      if (colon >= 0) {
        user = decode(userInfo.substring(0, colon));
        password = decode(userInfo.substring(colon + 1));
      } else {
        user = decode(userInfo);
      }
    }

    String host = authority;
    int port = -1;
    String portText = null;
    if (authority.startsWith("[")) {
      int close = authority.indexOf(']');
      if (close < 0) {
        throw new InvalidEndpointUrlException("Unterminated IPv6 host in " + scheme + " URL");
      }
      host = authority.substring(0, close + 1);
      if (close + 1 < authority.length()) {
        if (authority.charAt(close + 1) != ':') {
          throw new InvalidEndpointUrlException("Invalid host in " + scheme + " URL");
        }
        portText = authority.substring(close + 2);
      }
    } else {
      int colon = authority.lastIndexOf(':');
      if (colon >= 0) {
        host = authority.substring(0, colon);
        portText = authority.substring(colon + 1);
      }
    }
    if (portText != null && !portText.isEmpty()) {
      try {
        port = Integer.parseInt(portText);
      } catch (NumberFormatException e) {
        throw new InvalidEndpointUrlException("Invalid port in " + scheme + " URL: " + portText, e);
      }
      if (port < 1 || port > 65535) {
        throw new InvalidEndpointUrlException("Port out of range in " + scheme + " URL: " + port);
      }
    }

    List<String> segments = new ArrayList<>();
    for (String segment : pathPart.split("/")) {
      if (!segment.isEmpty()) {
        segments.add(decode(segment));
      }
    }

    Map<String, String> params = new LinkedHashMap<>();
    if (queryPart != null && !queryPart.isEmpty()) {
      for (String pair : queryPart.split("&")) {
        if (pair.isEmpty()) {
          continue;
        }
        int eq = pair.indexOf('=');
        String key = decodeQuery(eq >= 0 ? pair.substring(0, eq) : pair);
        String value = eq >= 0 ? decodeQuery(pair.substring(eq + 1)) : "";
        params.put(key, value);
      }
    }

    return new EndpointUrl(text, scheme, user, password, decode(host), port,
        Collections.unmodifiableList(segments), Collections.unmodifiableMap(params));
  }

  public String scheme() {
    return scheme;
  }

  public String user() {
    return user;
  }

  public String password() {
    return password;
  }

  public String host() {
    return host;
  }

  public boolean hasHost() {
    return host != null && !host.isEmpty();
  }

  /** Returns the explicit port, or {@code -1} when the URL has none. */
  public int port() {
    return port;
  }

  /** Returns the explicit port, or {@code defaultPort} when the URL has none. */
  public int portOr(int defaultPort) {
    return port > 0 ? port : defaultPort;
  }

  public List<String> pathSegments() {
    return pathSegments;
  }

  public Map<String, String> query() {
    return query;
  }

  /** Returns a query parameter, or {@code fallback} when absent. */
  public String queryParam(String name, String fallback) {
    return query.getOrDefault(name, fallback);
  }

  /** The URL exactly as supplied (trimmed). Contains credentials; never log it. */
  public String raw() {
    return raw;
  }

  /**
   * Returns a form safe for logs and the metrics table: scheme, host and port only, with
   * {@code /...} when the original had a path. Credentials, path tokens and query values
   * never appear.
   */
  public String redacted() {
    StringBuilder sb = new StringBuilder(scheme).append("://");
    if (user != null) {
      sb.append("****@");
    }
    sb.append(host);
    if (port > 0) {
      sb.append(':').append(port);
    }
    if (!pathSegments.isEmpty()) {
      sb.append("/...");
    }
    return sb.toString();
  }

  private static String redact(String text) {
    int at = text.indexOf('@');
    return at >= 0 ? "****" + text.substring(at) : text;
  }

  // '+' is literal outside the query string
  private static String decode(String value) {
    if (value.indexOf('%') < 0) {
      return value;
    }
    return decodeQuery(value.replace("+", "%2B"));
  }

  private static String decodeQuery(String value) {
    if (value.indexOf('%') < 0 && value.indexOf('+') < 0) {
      return value;
    }
    try {
      return URLDecoder.decode(value, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new InvalidEndpointUrlException("Invalid percent-encoding in service URL", e);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EndpointUrl that)) return false;
    return raw.equals(that.raw);
  }

  @Override
  public int hashCode() {
    return Objects.hash(raw);
  }

  @Override
  public String toString() {
    return redacted();
  }
}
