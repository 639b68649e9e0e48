package herald.http;

import herald.Notification;
import herald.endpoint.DeliveryContext;
import herald.endpoint.DeliveryEndpoint;
import herald.endpoint.DeliveryException;
import herald.endpoint.EndpointUrl;
import herald.endpoint.InvalidEndpointUrlException;
import herald.endpoint.PermanentDeliveryException;
import herald.endpoint.TransientDeliveryException;
import herald.spi.MetricsExporter;
import herald.util.JsonCodec;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Posts notifications as JSON to an arbitrary HTTP endpoint.
 *
 * <p>URL form: {@code json://[user[:pass]@]host[:port]/path?method=PUT&header_X-Token=abc}.
 * {@code json} and {@code webhook} use plain HTTP, {@code jsons} and {@code webhooks} use
 * HTTPS. A user with a password becomes Basic auth, a lone user becomes a Bearer token.
 * Query parameters other than the reserved ones are forwarded to the target.
 *
 * <p>The request body is
 * {@code {"title","message","type","timestamp","tags":[],"metadata":{"service","format"}}}.
 * Any 2xx is success; 429, 5xx and I/O failures are transient; other statuses are permanent.
 */
public class JsonWebhookEndpoint implements DeliveryEndpoint {
  private static final Logger logger = Logger.getLogger(JsonWebhookEndpoint.class.getName());

  /** Schemes this endpoint is registered under. */
  public static final String[] SCHEMES = {"json", "jsons", "webhook", "webhooks"};

  static final String HEADER_PREFIX = "header_";
  private static final Set<String> METHODS = Set.of("POST", "PUT", "PATCH");
  private static final Set<String> RESERVED = Set.of("method", "content_type");
  private static final int MAX_ERROR_BODY = 200;

  private final HttpClientPools pools;
  private final MetricsExporter exporter;
  private final JsonCodec codec;
  private final Clock clock;

  private String serviceId = "json";
  private URI target;
  private String method = "POST";
  private ContentType contentType = ContentType.APPLICATION_JSON;
  private final Map<String, String> headers = new LinkedHashMap<>();

  public JsonWebhookEndpoint() {
    this(HttpClientPools.shared(), MetricsExporter.NOOP);
  }

  public JsonWebhookEndpoint(HttpClientPools pools, MetricsExporter exporter) {
    this(pools, exporter, JsonCodec.getDefault(), Clock.systemUTC());
  }

  JsonWebhookEndpoint(HttpClientPools pools, MetricsExporter exporter, JsonCodec codec,
      Clock clock) {
    this.pools = Objects.requireNonNull(pools, "pools");
    this.exporter = Objects.requireNonNull(exporter, "exporter");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String serviceId() {
    return serviceId;
  }

  @Override
  public void parse(EndpointUrl url) {
    String scheme = url.scheme().toLowerCase(Locale.ROOT);
    boolean secure;
    switch (scheme) {
      case "json", "webhook" -> secure = false;
      case "jsons", "webhooks" -> secure = true;
      default -> throw new InvalidEndpointUrlException("Not a webhook URL: " + url.redacted());
    }
    if (!url.hasHost()) {
      throw new InvalidEndpointUrlException("Webhook URL has no host: " + url.redacted());
    }

    String requested = url.queryParam("method", "POST").toUpperCase(Locale.ROOT);
    if (!METHODS.contains(requested)) {
      throw new InvalidEndpointUrlException("Unsupported webhook method: " + requested);
    }
    String type = url.queryParam("content_type", null);
    ContentType resolvedType;
    try {
      resolvedType = type == null || type.isBlank()
          ? ContentType.APPLICATION_JSON
          : ContentType.parse(type).withCharset(StandardCharsets.UTF_8);
    } catch (RuntimeException e) {
      throw new InvalidEndpointUrlException("Invalid content_type: " + type, e);
    }

    Map<String, String> parsedHeaders = new LinkedHashMap<>();
    StringBuilder forwarded = new StringBuilder();
    for (Map.Entry<String, String> param : url.query().entrySet()) {
      String key = param.getKey();
      if (key.startsWith(HEADER_PREFIX) && key.length() > HEADER_PREFIX.length()) {
        parsedHeaders.put(key.substring(HEADER_PREFIX.length()), param.getValue());
      } else if (!RESERVED.contains(key)) {
        forwarded.append(forwarded.length() == 0 ? '?' : '&')
            .append(URLEncoder.encode(key, StandardCharsets.UTF_8))
            .append('=')
            .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
      }
    }
    String auth = authorization(url.user(), url.password());
    if (auth != null) {
      parsedHeaders.put(HttpHeaders.AUTHORIZATION, auth);
    }

    StringBuilder path = new StringBuilder();
    for (String segment : url.pathSegments()) {
      path.append('/').append(URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"));
    }
    if (path.length() == 0) {
      path.append('/');
    }
    String authority = url.host() + (url.port() > 0 ? ":" + url.port() : "");
    URI uri;
    try {
      uri = URI.create((secure ? "https://" : "http://") + authority + path + forwarded);
    } catch (IllegalArgumentException e) {
      throw new InvalidEndpointUrlException("Invalid webhook target: " + url.redacted(), e);
    }

    this.serviceId = scheme.startsWith("webhook") ? "webhook" : "json";
    this.target = uri;
    this.method = requested;
    this.contentType = resolvedType;
    this.headers.clear();
    this.headers.putAll(parsedHeaders);
  }

  @Override
  public void send(Notification notification, DeliveryContext ctx) throws DeliveryException {
    if (target == null) {
      throw new IllegalStateException("parse() has not been called");
    }
    if (ctx.isCancelled()) {
      throw new TransientDeliveryException("Delivery cancelled before request to " + target.getHost());
    }

    HttpUriRequestBase request = new HttpUriRequestBase(method, target);
    headers.forEach(request::setHeader);
    request.setEntity(new StringEntity(payload(notification), contentType));
    RequestConfig defaults = pools.requestConfig(ServiceCategory.WEBHOOK, serviceId);
    request.setConfig(RequestConfig.copy(defaults)
        .setResponseTimeout(boundedBy(defaults.getResponseTimeout(), ctx.remaining()))
        .build());
    ctx.onCancel(request::cancel);

    CloseableHttpClient client = pools.client(ServiceCategory.WEBHOOK, serviceId);
    long start = System.nanoTime();
    Response response;
    try {
      response = client.execute(request, r -> new Response(r.getCode(), errorBody(r.getEntity())));
    } catch (IOException e) {
      exporter.recordHttpRequest(method, target.getHost(), 0, elapsedMillis(start));
      if (ctx.isCancelled()) {
        throw new TransientDeliveryException("Webhook request to " + target.getHost()
            + " cancelled at deadline", e);
      }
      throw new TransientDeliveryException("Webhook request to " + target.getHost()
          + " failed: " + e.getMessage(), e);
    }
    exporter.recordHttpRequest(method, target.getHost(), response.status(), elapsedMillis(start));

    int status = response.status();
    if (status >= 200 && status < 300) {
      logger.log(Level.FINE, "Webhook {0} {1} returned {2}",
          new Object[]{method, target.getHost(), status});
      return;
    }
    String message = "Webhook " + target.getHost() + " returned HTTP " + status
        + (response.body().isEmpty() ? "" : ": " + response.body());
    if (status == 429 || status >= 500) {
      throw new TransientDeliveryException(message);
    }
    throw new PermanentDeliveryException(message);
  }

  @Override
  public int defaultPort() {
    return target != null && "https".equals(target.getScheme()) ? 443 : 80;
  }

  URI target() {
    return target;
  }

  String method() {
    return method;
  }

  Map<String, String> headers() {
    return headers;
  }

  String payload(Notification notification) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("title", notification.title());
    fields.put("message", notification.body());
    fields.put("type", notification.type().code());
    fields.put("timestamp", clock.instant().truncatedTo(ChronoUnit.SECONDS).toString());
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("service", serviceId);
    metadata.put("format", notification.bodyFormat() == null
        ? "text" : notification.bodyFormat().name().toLowerCase(Locale.ROOT));

    String head = codec.toJson(fields);
    return head.substring(0, head.length() - 1)
        + ",\"tags\":" + codec.toJsonArray(new ArrayList<>(notification.tags()))
        + ",\"metadata\":" + codec.toJson(metadata) + "}";
  }

  static String authorization(String user, String password) {
    if (user == null || user.isEmpty()) {
      return null;
    }
    if (password == null) {
      return "Bearer " + user;
    }
    String credentials = user + ":" + password;
    return "Basic " + Base64.getEncoder()
        .encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
  }

  private static Timeout boundedBy(Timeout configured, Duration remaining) {
    long left = Math.max(1, remaining.toMillis());
    if (configured == null || configured.toMilliseconds() <= 0) {
      return Timeout.ofMilliseconds(left);
    }
    return Timeout.ofMilliseconds(Math.min(configured.toMilliseconds(), left));
  }

  private static String errorBody(HttpEntity entity) throws IOException, ParseException {
    return entity == null ? "" : EntityUtils.toString(entity, MAX_ERROR_BODY).trim();
  }

  private static long elapsedMillis(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private record Response(int status, String body) {
  }

  @Override
  public String toString() {
    return "JsonWebhookEndpoint{" + method + " " + (target == null ? "-" : target.getHost()) + '}';
  }
}
