package herald.queue;

import herald.Notification;
import herald.NotifyType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What a job delivers: shared by {@link QueuedJob} and {@link herald.schedule.ScheduledJob}.
 *
 * <p>{@code services} are endpoint URLs, resolved through the
 * {@link herald.endpoint.EndpointRegistry} at dispatch time. When {@code templateName} is set
 * the title and body are rendered from that template with {@code metadata} as variables.
 *
 * @param title        notification title (may be empty)
 * @param body         notification body (may be empty when a template supplies it)
 * @param notifyType   notification severity
 * @param services     endpoint URLs, in dispatch order
 * @param tags         free-form tags
 * @param metadata     string metadata; also the variable map for template rendering. Entries
 *                     with a {@code null} value are dropped, as the stored JSON cannot hold them
 * @param templateName optional template to render before sending
 */
public record JobPayload(
    String title,
    String body,
    NotifyType notifyType,
    List<String> services,
    List<String> tags,
    Map<String, String> metadata,
    String templateName) {

  public JobPayload {
    title = title == null ? "" : title;
    body = body == null ? "" : body;
    notifyType = notifyType == null ? NotifyType.INFO : notifyType;
    services = services == null ? List.of() : List.copyOf(services);
    tags = tags == null ? List.of() : List.copyOf(tags);
    metadata = metadata == null || metadata.isEmpty() ? Map.of() : copyNonNull(metadata);
    if (templateName != null && templateName.isBlank()) {
      templateName = null;
    }
  }

  private static Map<String, String> copyNonNull(Map<String, String> source) {
    Map<String, String> copy = new LinkedHashMap<>();
    source.forEach((key, value) -> {
      if (value != null) {
        copy.put(Objects.requireNonNull(key, "metadata key"), value);
      }
    });
    return Collections.unmodifiableMap(copy);
  }

  public static JobPayload of(String title, String body, NotifyType type, List<String> services) {
    return new JobPayload(title, body, type, services, List.of(), Map.of(), null);
  }

  public boolean hasTemplate() {
    return templateName != null;
  }

  /** Returns a copy with the given title and body and no template reference. */
  public JobPayload rendered(String renderedTitle, String renderedBody) {
    return new JobPayload(renderedTitle, renderedBody, notifyType, services, tags, metadata, null);
  }

  public JobPayload withServices(List<String> newServices) {
    return new JobPayload(title, body, notifyType, newServices, tags, metadata, templateName);
  }

  public Notification toNotification() {
    return Notification.builder(body)
        .title(title)
        .type(notifyType)
        .tags(tags)
        .build();
  }

  /** Reads an integer from {@link #metadata()}, falling back when absent or malformed. */
  public int metadataInt(String key, int fallback) {
    Objects.requireNonNull(key, "key");
    String raw = metadata.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      return fallback;
    }
  }
}
