package herald;

import java.util.Locale;

/**
 * Severity of a notification. Persisted by its lower-case {@link #code()}.
 */
public enum NotifyType {
  INFO("info"),
  SUCCESS("success"),
  WARNING("warning"),
  ERROR("error");

  private final String code;

  NotifyType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Resolves a type from its code, ignoring case. {@code null} and blank map to {@link #INFO}.
   *
   * @throws IllegalArgumentException for unknown codes
   */
  public static NotifyType fromCode(String code) {
    if (code == null || code.isBlank()) {
      return INFO;
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    for (NotifyType type : values()) {
      if (type.code.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown notify type: " + code);
  }
}
