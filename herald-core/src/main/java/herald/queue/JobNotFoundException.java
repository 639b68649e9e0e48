package herald.queue;

/**
 * Thrown when a queued or scheduled job id does not exist.
 */
public class JobNotFoundException extends RuntimeException {
  public JobNotFoundException(String message) {
    super(message);
  }
}
