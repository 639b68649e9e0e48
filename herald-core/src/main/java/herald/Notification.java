package herald;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable notification handed to every {@link herald.endpoint.DeliveryEndpoint} of a dispatch.
 *
 * <p>Only {@code body} is mandatory; {@code title} defaults to the empty string and
 * {@code type} to {@link NotifyType#INFO}. Use {@link #builder(String)} to create instances.
 */
public final class Notification {
  /** Appended to bodies cut down to an endpoint's maximum length. */
  public static final String TRUNCATION_MARKER = "...";

  private final String title;
  private final String body;
  private final NotifyType type;
  private final Set<String> tags;
  private final BodyFormat bodyFormat;
  private final AttachmentHandle attachment;
  private final String sourceUrl;

  private Notification(Builder builder) {
    this.body = Objects.requireNonNull(builder.body, "body");
    this.title = builder.title == null ? "" : builder.title;
    this.type = builder.type == null ? NotifyType.INFO : builder.type;
    this.tags = builder.tags.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
    this.bodyFormat = builder.bodyFormat;
    this.attachment = builder.attachment;
    this.sourceUrl = builder.sourceUrl;
  }

  public static Builder builder(String body) {
    return new Builder(body);
  }

  public String title() {
    return title;
  }

  public String body() {
    return body;
  }

  public NotifyType type() {
    return type;
  }

  public Set<String> tags() {
    return tags;
  }

  /** Returns the body markup, or {@code null} when the sender did not specify one. */
  public BodyFormat bodyFormat() {
    return bodyFormat;
  }

  public AttachmentHandle attachment() {
    return attachment;
  }

  public String sourceUrl() {
    return sourceUrl;
  }

  /**
   * Returns a copy whose body fits in {@code maxLength} characters, ending with
   * {@link #TRUNCATION_MARKER} when it had to be cut. A surrogate pair at the cut is dropped
   * whole, so the body may come out one character shorter. Returns {@code this} when
   * {@code maxLength <= 0} (unlimited) or the body already fits.
   *
   * @param maxLength maximum body length in characters
   * @return a notification whose body is at most {@code maxLength} characters
   */
  public Notification truncatedTo(int maxLength) {
    if (maxLength <= 0 || body.length() <= maxLength) {
      return this;
    }
    boolean marked = maxLength > TRUNCATION_MARKER.length();
    int end = marked ? maxLength - TRUNCATION_MARKER.length() : maxLength;
    // never split a surrogate pair
    if (Character.isHighSurrogate(body.charAt(end - 1))) {
      end--;
    }
    String cut = marked ? body.substring(0, end) + TRUNCATION_MARKER : body.substring(0, end);
    return toBuilder().body(cut).build();
  }

  public Builder toBuilder() {
    Builder builder = new Builder(body)
        .title(title)
        .type(type)
        .bodyFormat(bodyFormat)
        .attachment(attachment)
        .sourceUrl(sourceUrl);
    builder.tags.addAll(tags);
    return builder;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Notification that)) return false;
    return title.equals(that.title) && body.equals(that.body) && type == that.type
        && tags.equals(that.tags) && bodyFormat == that.bodyFormat
        && Objects.equals(attachment, that.attachment) && Objects.equals(sourceUrl, that.sourceUrl);
  }

  @Override
  public int hashCode() {
    return Objects.hash(title, body, type, tags, bodyFormat, attachment, sourceUrl);
  }

  @Override
  public String toString() {
    return "Notification{type=" + type.code() + ", title=" + title
        + ", bodyLength=" + body.length() + ", tags=" + tags + '}';
  }

  /** Builder for {@link Notification}. */
  public static final class Builder {
    private String title;
    private String body;
    private NotifyType type;
    private final Set<String> tags = new LinkedHashSet<>();
    private BodyFormat bodyFormat;
    private AttachmentHandle attachment;
    private String sourceUrl;

    private Builder(String body) {
      this.body = body;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder body(String body) {
      this.body = body;
      return this;
    }

    public Builder type(NotifyType type) {
      this.type = type;
      return this;
    }

    public Builder tag(String tag) {
      this.tags.add(Objects.requireNonNull(tag, "tag"));
      return this;
    }

    public Builder tags(Iterable<String> tags) {
      if (tags != null) {
        tags.forEach(this::tag);
      }
      return this;
    }

    public Builder bodyFormat(BodyFormat bodyFormat) {
      this.bodyFormat = bodyFormat;
      return this;
    }

    public Builder attachment(AttachmentHandle attachment) {
      this.attachment = attachment;
      return this;
    }

    public Builder sourceUrl(String sourceUrl) {
      this.sourceUrl = sourceUrl;
      return this;
    }

    /**
     * @throws NullPointerException if {@code body} is null
     */
    public Notification build() {
      return new Notification(this);
    }
  }
}
