package herald.schedule;

/**
 * Thrown when a cron expression cannot be parsed or can never fire.
 */
public class InvalidCronExpressionException extends IllegalArgumentException {
  public InvalidCronExpressionException(String expression, String reason) {
    super("Invalid cron expression '" + expression + "': " + reason);
  }
}
