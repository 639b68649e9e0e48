package herald.dispatch;

import herald.queue.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeAggregatorTest {
  private static final Duration TOOK = Duration.ofMillis(12);

  @Test
  void allSuccessCompletesWithoutMessage() {
    Aggregation result = OutcomeAggregator.aggregate(List.of(
        Outcome.success("json", "json://a", TOOK),
        Outcome.success("slack", "slack://b", TOOK)), 0, 3);

    assertEquals(JobStatus.COMPLETED, result.status());
    assertNull(result.message());
  }

  @Test
  void partialSuccessCompletesWithWarning() {
    Aggregation result = OutcomeAggregator.aggregate(List.of(
        Outcome.success("json", "json://a", TOOK),
        Outcome.failure("slack", "slack://b", "HTTP 500", true, TOOK)), 0, 3);

    assertEquals(JobStatus.COMPLETED, result.status());
    assertEquals("Partial success: 1/2 services failed: [slack: HTTP 500]", result.message());
  }

  @Test
  void allFailedWithAttemptsLeftRetries() {
    Aggregation result = OutcomeAggregator.aggregate(List.of(
        Outcome.failure("json", "json://a", "HTTP 503", true, TOOK),
        Outcome.failure("slack", "slack://b", "HTTP 401", false, TOOK)), 2, 3);

    assertEquals(JobStatus.RETRYING, result.status());
    assertEquals("All services failed: [json: HTTP 503; slack: HTTP 401]", result.message());
  }

  @Test
  void allFailedWithoutAttemptsLeftFails() {
    Aggregation result = OutcomeAggregator.aggregate(List.of(
        Outcome.failure("json", "json://a", "HTTP 503", true, TOOK)), 3, 3);

    assertEquals(JobStatus.FAILED, result.status());
  }

  @Test
  void permanentErrorsStillRetry() {
    Aggregation result = OutcomeAggregator.aggregate(List.of(
        Outcome.failure("json", "json://a", "HTTP 404", false, TOOK)), 0, 1);

    assertEquals(JobStatus.RETRYING, result.status());
  }

  @Test
  void cancelledOutcomesCountAsFailures() {
    Aggregation result = OutcomeAggregator.aggregate(List.of(
        Outcome.cancelled("json", "json://a", TOOK)), 0, 0);

    assertEquals(JobStatus.FAILED, result.status());
    assertTrue(result.message().contains(Outcome.CANCELLED));
  }

  @Test
  void emptyOutcomesAreNotASuccess() {
    Aggregation result = OutcomeAggregator.aggregate(List.of(), 0, 3);

    assertEquals(JobStatus.RETRYING, result.status());
    assertEquals("No deliverable services", result.message());
  }
}
