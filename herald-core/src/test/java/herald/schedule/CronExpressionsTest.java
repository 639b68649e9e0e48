package herald.schedule;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CronExpressionsTest {

  @Test
  void helpersProduceValidExpressions() {
    assertEquals("30 9 * * *", CronExpressions.daily(9, 30));
    assertEquals("0 8 * * 1", CronExpressions.weekly(DayOfWeek.MONDAY, 8, 0));
    assertEquals("0 8 * * 0", CronExpressions.weekly(DayOfWeek.SUNDAY, 8, 0));
    assertEquals("15 6 1 * *", CronExpressions.monthly(1, 6, 15));
    assertTrue(CronExpression.isValid(CronExpressions.EVERY_15_MINUTES));
  }

  @Test
  void helpersValidateRanges() {
    assertThrows(InvalidCronExpressionException.class, () -> CronExpressions.daily(25, 0));
    assertThrows(InvalidCronExpressionException.class, () -> CronExpressions.monthly(32, 0, 0));
  }

  @Test
  void builderComposesFields() {
    assertEquals("*/10 * * * *", CronExpressions.builder().every(Duration.ofMinutes(10)).build());
    assertEquals("0 */2 * * *", CronExpressions.builder().every(Duration.ofHours(2)).build());
    assertEquals("0 9 * * 1-5", CronExpressions.builder().at(9, 0).onWeekdays().build());
    assertEquals("0 10 * * 0,6", CronExpressions.builder().at(10, 0).onWeekends().build());
    assertEquals("30 7 * * 2,4",
        CronExpressions.builder().at(7, 30).onDays(DayOfWeek.TUESDAY, DayOfWeek.THURSDAY).build());
    assertEquals("0 7 * * *", CronExpressions.builder().at(7, 0).onWeekdays().daily().build());
  }

  @Test
  void builderRejectsUnsupportedIntervals() {
    assertThrows(IllegalArgumentException.class,
        () -> CronExpressions.builder().every(Duration.ofSeconds(30)));
    assertThrows(IllegalArgumentException.class,
        () -> CronExpressions.builder().every(Duration.ofDays(1)));
  }
}
