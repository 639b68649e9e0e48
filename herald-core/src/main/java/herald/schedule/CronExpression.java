package herald.schedule;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Standard five-field cron expression: minute, hour, day of month, month, day of week.
 *
 * <p>Each field accepts {@code *}, {@code N}, {@code A-B}, {@code *}{@code /N}, {@code A-B/N},
 * {@code A/N} and comma-separated lists of those. Months accept {@code JAN}-{@code DEC} and days
 * of week {@code SUN}-{@code SAT}; day of week {@code 7} is Sunday. The macros {@code @yearly},
 * {@code @annually}, {@code @monthly}, {@code @weekly}, {@code @daily}, {@code @midnight} and
 * {@code @hourly} are expanded.
 *
 * <p>When both day of month and day of week are restricted, a day matches if either matches.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class CronExpression {
  private static final Map<String, String> MACROS = Map.of(
      "@yearly", "0 0 1 1 *",
      "@annually", "0 0 1 1 *",
      "@monthly", "0 0 1 * *",
      "@weekly", "0 0 * * 0",
      "@daily", "0 0 * * *",
      "@midnight", "0 0 * * *",
      "@hourly", "0 * * * *");
  private static final String[] MONTH_NAMES =
      {"JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"};
  private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT"};
  private static final int SEARCH_YEARS = 10;

  private final String expression;
  private final long minutes;
  private final long hours;
  private final long daysOfMonth;
  private final long months;
  private final long daysOfWeek;
  private final boolean domRestricted;
  private final boolean dowRestricted;

  private CronExpression(String expression, String[] fields) {
    this.expression = expression;
    this.minutes = parseField(fields[0], 0, 59, null);
    this.hours = parseField(fields[1], 0, 23, null);
    this.daysOfMonth = parseField(fields[2], 1, 31, null);
    this.months = parseField(fields[3], 1, 12, MONTH_NAMES);
    long dow = parseField(fields[4], 0, 7, DAY_NAMES);
    if ((dow & (1L << 7)) != 0) {
      dow = (dow | 1L) & ~(1L << 7);
    }
    this.daysOfWeek = dow;
    this.domRestricted = !fields[2].startsWith("*");
    this.dowRestricted = !fields[4].startsWith("*");
  }

  /**
   * Parses {@code expression}.
   *
   * @throws InvalidCronExpressionException if it is malformed, out of range or can never fire
   */
  public static CronExpression parse(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new InvalidCronExpressionException(String.valueOf(expression), "expression is empty");
    }
    String text = expression.trim();
    String expanded = text.startsWith("@") ? MACROS.get(text.toLowerCase(Locale.ROOT)) : text;
    if (expanded == null) {
      throw new InvalidCronExpressionException(text, "unknown macro");
    }
    String[] fields = expanded.split("\\s+");
    if (fields.length != 5) {
      throw new InvalidCronExpressionException(text, "expected 5 fields, got " + fields.length);
    }
    CronExpression cron;
    try {
      cron = new CronExpression(text, fields);
    } catch (IllegalArgumentException e) {
      throw new InvalidCronExpressionException(text, e.getMessage());
    }
    if (!cron.dowRestricted && !cron.hasPossibleDay()) {
      throw new InvalidCronExpressionException(text, "day of month never occurs in the selected months");
    }
    return cron;
  }

  /** Whether {@code expression} parses. */
  public static boolean isValid(String expression) {
    try {
      parse(expression);
      return true;
    } catch (InvalidCronExpressionException e) {
      return false;
    }
  }

  public String expression() {
    return expression;
  }

  /**
   * Returns the first matching minute strictly after {@code after}, in the same zone.
   *
   * @throws IllegalStateException if nothing matches within ten years
   */
  public ZonedDateTime next(ZonedDateTime after) {
    Objects.requireNonNull(after, "after");
    ZonedDateTime t = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
    int lastYear = after.getYear() + SEARCH_YEARS;
    while (t.getYear() <= lastYear) {
      if (!has(months, t.getMonthValue())) {
        t = t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
      } else if (!dayMatches(t)) {
        t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
      } else if (!has(hours, t.getHour())) {
        t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
      } else if (!has(minutes, t.getMinute())) {
        t = t.plusMinutes(1);
      } else {
        return t;
      }
    }
    throw new IllegalStateException("No occurrence of '" + expression + "' within " + SEARCH_YEARS + " years");
  }

  /** Next occurrence after {@code after}, evaluated in {@code zone}. */
  public Instant next(Instant after, ZoneId zone) {
    return next(after.atZone(zone)).toInstant();
  }

  /** Whether the minute containing {@code time} matches. */
  public boolean matches(ZonedDateTime time) {
    return has(months, time.getMonthValue()) && dayMatches(time)
        && has(hours, time.getHour()) && has(minutes, time.getMinute());
  }

  private boolean dayMatches(ZonedDateTime t) {
    boolean dom = has(daysOfMonth, t.getDayOfMonth());
    boolean dow = has(daysOfWeek, t.getDayOfWeek().getValue() % 7);
    if (domRestricted && dowRestricted) {
      return dom || dow;
    }
    return dom && dow;
  }

  private boolean hasPossibleDay() {
    for (int month = 1; month <= 12; month++) {
      if (!has(months, month)) {
        continue;
      }
      // leap year so that Feb 29 counts
      int length = YearMonth.of(2024, month).lengthOfMonth();
      for (int day = 1; day <= length; day++) {
        if (has(daysOfMonth, day)) {
          return true;
        }
      }
    }
    return false;
  }

  private static boolean has(long bits, int value) {
    return (bits & (1L << value)) != 0;
  }

  private static long parseField(String field, int min, int max, String[] names) {
    long bits = 0;
    for (String part : field.split(",", -1)) {
      if (part.isEmpty()) {
        throw new IllegalArgumentException("empty list element in '" + field + "'");
      }
      bits |= parsePart(part, min, max, names);
    }
    return bits;
  }

  private static long parsePart(String part, int min, int max, String[] names) {
    int step = 1;
    String range = part;
    int slash = part.indexOf('/');
    if (slash >= 0) {
      range = part.substring(0, slash);
      step = parseNumber(part.substring(slash + 1), 1, max - min + 1, null, 0);
    }
    int from;
    int to;
    if (range.equals("*")) {
      from = min;
      to = max;
    } else {
      int dash = range.indexOf('-');
      if (dash >= 0) {
        from = parseNumber(range.substring(0, dash), min, max, names, min);
        to = parseNumber(range.substring(dash + 1), min, max, names, min);
        if (from > to) {
          throw new IllegalArgumentException("range " + range + " is reversed");
        }
      } else {
        from = parseNumber(range, min, max, names, min);
        to = slash >= 0 ? max : from;
      }
    }
    long bits = 0;
    for (int v = from; v <= to; v += step) {
      bits |= 1L << v;
    }
    return bits;
  }

  private static int parseNumber(String text, int min, int max, String[] names, int nameBase) {
    if (names != null) {
      String upper = text.toUpperCase(Locale.ROOT);
      for (int i = 0; i < names.length; i++) {
        if (names[i].equals(upper)) {
          return i + nameBase;
        }
      }
    }
    int value;
    try {
      value = Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("'" + text + "' is not a number");
    }
    if (value < min || value > max) {
      throw new IllegalArgumentException(value + " is outside " + min + "-" + max);
    }
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CronExpression that)) return false;
    return minutes == that.minutes && hours == that.hours && daysOfMonth == that.daysOfMonth
        && months == that.months && daysOfWeek == that.daysOfWeek
        && domRestricted == that.domRestricted && dowRestricted == that.dowRestricted;
  }

  @Override
  public int hashCode() {
    return Objects.hash(minutes, hours, daysOfMonth, months, daysOfWeek, domRestricted, dowRestricted);
  }

  @Override
  public String toString() {
    return expression;
  }
}
