package mailqueue.model;

public enum SentEmailStatus {
  DRAFT("draft"),
  QUEUED("queued"),
  SENDING("sending"),
  SENT("sent"),
  FAILED("failed");

  private final String code;

  SentEmailStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static SentEmailStatus fromCode(String code) {
    for (SentEmailStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown sent email status: " + code);
  }
}
