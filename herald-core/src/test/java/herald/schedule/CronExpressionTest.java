package herald.schedule;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class CronExpressionTest {

  private static ZonedDateTime utc(String text) {
    return ZonedDateTime.parse(text).withZoneSameInstant(ZoneOffset.UTC);
  }

  private static ZonedDateTime next(String cron, String after) {
    return CronExpression.parse(cron).next(utc(after));
  }

  @Test
  void everyMinuteIsStrictlyAfter() {
    assertEquals(utc("2024-01-01T10:01:00Z"), next("* * * * *", "2024-01-01T10:00:00Z"));
    assertEquals(utc("2024-01-01T10:01:00Z"), next("* * * * *", "2024-01-01T10:00:59.999Z"));
  }

  @Test
  void stepsInMinuteField() {
    assertEquals(utc("2024-01-01T10:05:00Z"), next("*/5 * * * *", "2024-01-01T10:00:00Z"));
    assertEquals(utc("2024-01-01T10:15:00Z"), next("*/5 * * * *", "2024-01-01T10:14:00Z"));
    assertEquals(utc("2024-01-01T11:00:00Z"), next("*/5 * * * *", "2024-01-01T10:55:00Z"));
  }

  @Test
  void rangesListsAndStepsCombine() {
    CronExpression cron = CronExpression.parse("0,30 9-17/4 * * *");

    assertTrue(cron.matches(utc("2024-01-01T09:30:00Z")));
    assertTrue(cron.matches(utc("2024-01-01T13:00:00Z")));
    assertTrue(cron.matches(utc("2024-01-01T17:30:00Z")));
    assertFalse(cron.matches(utc("2024-01-01T11:00:00Z")));
    assertFalse(cron.matches(utc("2024-01-01T09:15:00Z")));
  }

  @Test
  void dailyRollsToNextDay() {
    assertEquals(utc("2024-01-02T09:00:00Z"), next("0 9 * * *", "2024-01-01T09:00:00Z"));
  }

  @Test
  void monthlyRollsOverYearEnd() {
    assertEquals(utc("2025-01-01T00:00:00Z"), next("0 0 1 * *", "2024-12-15T08:00:00Z"));
  }

  @Test
  void weekdayNamesAndSunday() {
    // 2024-01-01 is a Monday
    assertEquals(utc("2024-01-05T08:00:00Z"), next("0 8 * * FRI", "2024-01-01T00:00:00Z"));
    assertEquals(utc("2024-01-07T08:00:00Z"), next("0 8 * * 0", "2024-01-01T00:00:00Z"));
    assertEquals(utc("2024-01-07T08:00:00Z"), next("0 8 * * 7", "2024-01-01T00:00:00Z"));
    assertEquals(utc("2024-01-01T08:00:00Z"), next("0 8 * * mon-fri", "2023-12-31T12:00:00Z"));
  }

  @Test
  void monthNames() {
    assertEquals(utc("2024-03-01T00:00:00Z"), next("0 0 1 MAR *", "2024-01-10T00:00:00Z"));
  }

  @Test
  void restrictedDayOfMonthAndWeekMatchEither() {
    CronExpression cron = CronExpression.parse("0 0 13 * FRI");

    // Friday the 5th and Saturday the 13th both fire
    assertTrue(cron.matches(utc("2024-01-05T00:00:00Z")));
    assertTrue(cron.matches(utc("2024-01-13T00:00:00Z")));
    assertFalse(cron.matches(utc("2024-01-08T00:00:00Z")));
  }

  @Test
  void wildcardDayOfWeekRequiresDayOfMonth() {
    CronExpression cron = CronExpression.parse("0 0 13 * *");

    assertFalse(cron.matches(utc("2024-01-05T00:00:00Z")));
    assertTrue(cron.matches(utc("2024-01-13T00:00:00Z")));
  }

  @Test
  void leapDayIsFound() {
    assertEquals(utc("2028-02-29T00:00:00Z"), next("0 0 29 2 *", "2024-03-01T00:00:00Z"));
  }

  @Test
  void macrosExpand() {
    assertEquals(CronExpression.parse("@daily").next(utc("2024-01-01T05:00:00Z")),
        utc("2024-01-02T00:00:00Z"));
    assertEquals(utc("2024-01-01T06:00:00Z"), next("@hourly", "2024-01-01T05:10:00Z"));
    assertEquals(utc("2024-01-07T00:00:00Z"), next("@weekly", "2024-01-01T05:10:00Z"));
    assertEquals(utc("2025-01-01T00:00:00Z"), next("@yearly", "2024-01-01T05:10:00Z"));
  }

  @Test
  void evaluatesInGivenZone() {
    CronExpression cron = CronExpression.parse("0 9 * * *");

    Instant next = cron.next(Instant.parse("2024-01-01T00:00:00Z"), ZoneId.of("America/New_York"));

    assertEquals(Instant.parse("2024-01-01T14:00:00Z"), next);
  }

  @Test
  void rejectsInvalidExpressions() {
    String[] invalid = {
        null, "", "* * * *", "* * * * * *", "60 * * * *", "* 24 * * *", "* * 0 * *",
        "* * * 13 *", "* * * * 8", "5-1 * * * *", "*/0 * * * *", "a * * * *", "1,,2 * * * *",
        "@reboot", "0 0 30 2 *", "0 0 31 4,6 *"
    };
    for (String expression : invalid) {
      assertFalse(CronExpression.isValid(expression), "should reject: " + expression);
    }
  }

  @Test
  void invalidExpressionCarriesText() {
    InvalidCronExpressionException e = assertThrows(InvalidCronExpressionException.class,
        () -> CronExpression.parse("61 * * * *"));

    assertTrue(e.getMessage().contains("61 * * * *"));
  }

  @Test
  void impossibleDayIsAllowedWhenWeekdayCanFire() {
    assertTrue(CronExpression.isValid("0 0 30 2 MON"));
  }

  @Test
  void equalityUsesExpressionText() {
    assertEquals(CronExpression.parse("*/5 * * * *"), CronExpression.parse(" */5 * * * * "));
    assertEquals("*/5 * * * *", CronExpression.parse("*/5 * * * *").expression());
  }
}
