package herald.benchmarks;

import herald.schedule.CronExpression;
import org.openjdk.jmh.annotations.*;

import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.TimeUnit;

/**
 * Measures next-fire computation for common and sparse cron expressions.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar CronNextBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
@Fork(1)
public class CronNextBenchmark {

  private static final Instant START = Instant.parse("2024-01-15T10:17:00Z");

  @Param({"*/5 * * * *", "0 2 * * *", "30 9 * * 1-5", "0 0 29 2 *"})
  private String expression;

  @Param({"UTC", "America/New_York"})
  private String zone;

  private CronExpression cron;
  private ZoneId zoneId;

  @Setup(Level.Trial)
  public void setup() {
    cron = CronExpression.parse(expression);
    zoneId = ZoneId.of(zone);
  }

  @Benchmark
  public Instant next() {
    return cron.next(START, zoneId);
  }

  @Benchmark
  public CronExpression parse() {
    return CronExpression.parse(expression);
  }
}
