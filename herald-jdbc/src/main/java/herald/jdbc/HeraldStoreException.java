package herald.jdbc;

import herald.QueueBackendException;

/**
 * Unchecked exception wrapping JDBC errors raised by {@link JdbcTemplate} and the stores in
 * {@link herald.jdbc.store}, or by a row that cannot be decoded.
 */
public final class HeraldStoreException extends QueueBackendException {
  public HeraldStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
