package herald.metrics;

/** Outcome stored in the {@code status} column of {@code notification_metrics}. */
public enum SampleStatus {
  SUCCESS("success"),
  FAILED("failed");

  private final String code;

  SampleStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static SampleStatus of(boolean success) {
    return success ? SUCCESS : FAILED;
  }

  public static SampleStatus fromCode(String code) {
    for (SampleStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown sample status: " + code);
  }
}
