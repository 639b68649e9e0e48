package herald;

/**
 * Unchecked exception raised when durable storage (the queue, scheduled jobs, templates or
 * metrics samples) cannot be read or written.
 *
 * <p>Herald never retries these itself; callers decide. Background loops log them and try
 * again on their next cycle.
 */
public class QueueBackendException extends RuntimeException {
  public QueueBackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
