package herald.schedule;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Ready-made cron expressions and a small builder for common schedules.
 *
 * <pre>{@code
 * String expr = CronExpressions.builder().at(9, 30).onWeekdays().build(); // "30 9 * * 1-5"
 * }</pre>
 */
public final class CronExpressions {
  public static final String EVERY_MINUTE = "* * * * *";
  public static final String EVERY_5_MINUTES = "*/5 * * * *";
  public static final String EVERY_15_MINUTES = "*/15 * * * *";
  public static final String EVERY_30_MINUTES = "*/30 * * * *";
  public static final String HOURLY = "0 * * * *";
  public static final String DAILY = "0 0 * * *";
  public static final String WEEKLY = "0 0 * * 0";
  public static final String MONTHLY = "0 0 1 * *";

  private CronExpressions() {
  }

  public static String daily(int hour, int minute) {
    return builder().at(hour, minute).build();
  }

  public static String weekly(DayOfWeek day, int hour, int minute) {
    return builder().at(hour, minute).onDays(day).build();
  }

  public static String monthly(int dayOfMonth, int hour, int minute) {
    return validated(minute + " " + hour + " " + dayOfMonth + " * *");
  }

  public static Builder builder() {
    return new Builder();
  }

  private static String validated(String expression) {
    CronExpression.parse(expression);
    return expression;
  }

  /**
   * Fluent builder; every field starts as {@code *}.
   */
  public static final class Builder {
    private String minutes = "*";
    private String hours = "*";
    private String daysOfWeek = "*";

    private Builder() {
    }

    /**
     * Repeats every {@code interval}: whole minutes below one hour, whole hours below a day.
     *
     * @throws IllegalArgumentException for intervals under a minute or of a day or more
     */
    public Builder every(Duration interval) {
      if (interval.compareTo(Duration.ofMinutes(1)) < 0) {
        throw new IllegalArgumentException("interval must be at least one minute");
      }
      if (interval.compareTo(Duration.ofHours(1)) < 0) {
        minutes = "*/" + interval.toMinutes();
      } else if (interval.compareTo(Duration.ofDays(1)) < 0) {
        hours = "*/" + interval.toHours();
        minutes = "0";
      } else {
        throw new IllegalArgumentException("interval must be less than a day; use at() for daily schedules");
      }
      return this;
    }

    public Builder at(int hour, int minute) {
      this.hours = Integer.toString(hour);
      this.minutes = Integer.toString(minute);
      return this;
    }

    public Builder onDays(DayOfWeek... days) {
      this.daysOfWeek = Arrays.stream(days)
          .map(d -> Integer.toString(d.getValue() % 7))
          .collect(Collectors.joining(","));
      return this;
    }

    public Builder onWeekdays() {
      this.daysOfWeek = "1-5";
      return this;
    }

    public Builder onWeekends() {
      this.daysOfWeek = "0,6";
      return this;
    }

    /** Clears any day-of-week restriction. */
    public Builder daily() {
      this.daysOfWeek = "*";
      return this;
    }

    /**
     * @throws InvalidCronExpressionException if the combination is out of range
     */
    public String build() {
      return validated(minutes + " " + hours + " * * " + daysOfWeek);
    }
  }
}
