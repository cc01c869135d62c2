package mailqueue.model;

public enum ProcessingStatus {
  PENDING("pending"),
  PROCESSED("processed"),
  FAILED("failed"),
  SKIPPED("skipped");

  private final String code;

  ProcessingStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static ProcessingStatus fromCode(String code) {
    for (ProcessingStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown processing status: " + code);
  }
}
