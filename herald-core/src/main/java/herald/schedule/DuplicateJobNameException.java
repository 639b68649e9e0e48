package herald.schedule;

/**
 * Thrown when adding or renaming a scheduled job would collide with an existing name.
 */
public class DuplicateJobNameException extends RuntimeException {
  public DuplicateJobNameException(String name) {
    super("Scheduled job name already exists: " + name);
  }
}
