package herald.http;

import herald.spi.MetricsExporter;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared, lazily created HTTP clients keyed by {@link ServiceCategory} and service key.
 *
 * <p>Every (category, key) pair gets one pooled {@link CloseableHttpClient} that lives until
 * {@link #remove} or {@link #close}. Endpoints must not close the clients they obtain.
 *
 * <pre>{@code
 * CloseableHttpClient client = HttpClientPools.shared().client(ServiceCategory.WEBHOOK, "json");
 * }</pre>
 */
public final class HttpClientPools implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HttpClientPools.class.getName());
  public static final String ACTIVE_CONNECTIONS_GAUGE = "active.connections";
  private static final String USER_AGENT = "herald/0.1";

  private static final class Holder {
    static final HttpClientPools SHARED = new HttpClientPools();
  }

  private final Map<PoolKey, Pool> pools = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /** Process-wide instance used when endpoints are not given their own. */
  public static HttpClientPools shared() {
    return Holder.SHARED;
  }

  /**
   * Returns the client for {@code (category, key)}, creating its pool on first use.
   *
   * @throws IllegalStateException if the pools were closed
   */
  public CloseableHttpClient client(ServiceCategory category, String key) {
    return pool(category, key).client;
  }

  /** Default request settings of the pool behind {@code (category, key)}. */
  public RequestConfig requestConfig(ServiceCategory category, String key) {
    return pool(category, key).requestConfig;
  }

  private Pool pool(ServiceCategory category, String key) {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(key, "key");
    if (closed) {
      throw new IllegalStateException("HttpClientPools is closed");
    }
    return pools.computeIfAbsent(new PoolKey(category, key), HttpClientPools::create);
  }

  /** Closes idle connections of every pool; clients stay usable. */
  public void closeIdleConnections() {
    for (Pool pool : pools.values()) {
      pool.manager.closeIdle(TimeValue.ZERO_MILLISECONDS);
    }
  }

  /** Closes and forgets one client. Returns {@code false} if it did not exist. */
  public boolean remove(ServiceCategory category, String key) {
    Pool pool = pools.remove(new PoolKey(category, key));
    if (pool == null) {
      return false;
    }
    pool.client.close(CloseMode.GRACEFUL);
    return true;
  }

  /** Connections currently leased across all pools. */
  public int leasedConnections() {
    int leased = 0;
    for (Pool pool : pools.values()) {
      leased += pool.manager.getTotalStats().getLeased();
    }
    return leased;
  }

  /** Publishes {@link #leasedConnections()} as the {@code active.connections} gauge. */
  public void reportTo(MetricsExporter exporter) {
    exporter.setGauge(ACTIVE_CONNECTIONS_GAUGE, leasedConnections());
  }

  /** Number of (category, key) clients created so far. */
  public int size() {
    return pools.size();
  }

  @Override
  public void close() {
    closed = true;
    for (Map.Entry<PoolKey, Pool> entry : pools.entrySet()) {
      entry.getValue().client.close(CloseMode.GRACEFUL);
      logger.log(Level.FINE, "Closed HTTP pool {0}", entry.getKey());
    }
    pools.clear();
  }

  private static Pool create(PoolKey key) {
    ServiceCategory category = key.category();
    Timeout timeout = Timeout.ofMilliseconds(category.timeout().toMillis());
    PoolingHttpClientConnectionManager manager = PoolingHttpClientConnectionManagerBuilder.create()
        .setMaxConnTotal(category.maxTotal())
        .setMaxConnPerRoute(category.maxPerRoute())
        .setDefaultConnectionConfig(ConnectionConfig.custom()
            .setConnectTimeout(timeout)
            .setSocketTimeout(timeout)
            .build())
        .build();
    RequestConfig requestConfig = RequestConfig.custom()
        .setConnectionRequestTimeout(timeout)
        .setResponseTimeout(timeout)
        .build();
    CloseableHttpClient client = HttpClients.custom()
        .setConnectionManager(manager)
        .setDefaultRequestConfig(requestConfig)
        .setUserAgent(USER_AGENT)
        // the queue owns retries
        .disableAutomaticRetries()
        .evictExpiredConnections()
        .evictIdleConnections(TimeValue.ofMilliseconds(category.idleEviction().toMillis()))
        .build();
    logger.log(Level.FINE, "Created HTTP pool {0} (max {1}, per route {2})",
        new Object[]{key, category.maxTotal(), category.maxPerRoute()});
    return new Pool(manager, client, requestConfig);
  }

  private record PoolKey(ServiceCategory category, String key) {
    @Override
    public String toString() {
      return category.name().toLowerCase() + ":" + key;
    }
  }

  private record Pool(PoolingHttpClientConnectionManager manager, CloseableHttpClient client,
      RequestConfig requestConfig) {
  }
}
