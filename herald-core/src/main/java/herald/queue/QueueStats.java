package herald.queue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Job counts per {@link JobStatus}. Statuses with no jobs report zero.
 */
public final class QueueStats {
  private final Map<JobStatus, Long> counts;

  public QueueStats(Map<JobStatus, Long> counts) {
    EnumMap<JobStatus, Long> copy = new EnumMap<>(JobStatus.class);
    for (JobStatus status : JobStatus.values()) {
      copy.put(status, counts.getOrDefault(status, 0L));
    }
    this.counts = Collections.unmodifiableMap(copy);
  }

  public long count(JobStatus status) {
    return counts.get(status);
  }

  public long total() {
    return counts.values().stream().mapToLong(Long::longValue).sum();
  }

  /** Jobs that are waiting to run: pending plus retrying. */
  public long backlog() {
    return count(JobStatus.PENDING) + count(JobStatus.RETRYING);
  }

  public Map<JobStatus, Long> counts() {
    return counts;
  }

  /** Counts keyed by status code, plus a {@code total} entry. */
  public Map<String, Long> asMap() {
    Map<String, Long> map = new LinkedHashMap<>();
    counts.forEach((status, count) -> map.put(status.code(), count));
    map.put("total", total());
    return map;
  }

  @Override
  public String toString() {
    return "QueueStats" + asMap();
  }
}
