package herald.metrics;

import herald.NotifyType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One durable delivery record. Samples are append-only; reports are computed from them.
 *
 * @param id               database id, {@code null} until stored
 * @param jobId            queued job that produced the delivery, if any
 * @param scheduledJobId   scheduled job behind the queued job, if any
 * @param serviceId        endpoint service id
 * @param serviceUrl       redacted service URL
 * @param notificationType notification type
 * @param status           success or failed
 * @param durationMs       time spent in the endpoint
 * @param errorMessage     failure text, {@code null} on success
 * @param metadata         free-form labels
 * @param timestamp        when the delivery finished
 */
public record MetricsSample(
    Long id,
    Long jobId,
    Long scheduledJobId,
    String serviceId,
    String serviceUrl,
    NotifyType notificationType,
    SampleStatus status,
    long durationMs,
    String errorMessage,
    Map<String, String> metadata,
    Instant timestamp) {

  public MetricsSample {
    Objects.requireNonNull(serviceId, "serviceId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(timestamp, "timestamp");
    serviceUrl = serviceUrl == null ? "" : serviceUrl;
    notificationType = notificationType == null ? NotifyType.INFO : notificationType;
    metadata = metadata == null || metadata.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    if (durationMs < 0) {
      throw new IllegalArgumentException("durationMs must be >= 0");
    }
  }

  public boolean isSuccess() {
    return status == SampleStatus.SUCCESS;
  }

  public MetricsSample withId(Long newId) {
    return new MetricsSample(newId, jobId, scheduledJobId, serviceId, serviceUrl, notificationType,
        status, durationMs, errorMessage, metadata, timestamp);
  }
}
