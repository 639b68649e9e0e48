package herald.benchmarks;

import herald.template.CompiledTemplate;
import herald.template.DefaultTemplates;
import herald.template.Template;
import herald.template.TemplateParser;
import org.openjdk.jmh.annotations.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Measures template parsing and rendering of the built-in backup template.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar TemplateRenderBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
@Fork(1)
public class TemplateRenderBenchmark {

  private String bodySource;
  private CompiledTemplate body;
  private Map<String, String> variables;

  @Param({"true", "false"})
  private boolean withLocation;

  @Setup(Level.Trial)
  public void setup() {
    Template backup = DefaultTemplates.all().stream()
        .filter(t -> t.name().equals(DefaultTemplates.BACKUP_STATUS))
        .findFirst()
        .orElseThrow();
    bodySource = backup.bodyTemplate();
    body = TemplateParser.parse(bodySource);
    variables = new LinkedHashMap<>(backup.variables());
    variables.put("database", "orders");
    variables.put("backup_size", "12 GB");
    variables.put("timestamp", "2024-05-01 02:00:00");
    if (withLocation) {
      variables.put("backup_location", "s3://backups/orders");
    }
  }

  @Benchmark
  public CompiledTemplate parse() {
    return TemplateParser.parse(bodySource);
  }

  @Benchmark
  public String render() {
    return body.render(variables);
  }
}
