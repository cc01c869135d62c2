package mailqueue.model;

public enum JobStatus {
  PENDING("pending"),
  PROCESSING("processing"),
  COMPLETED("completed"),
  FAILED("failed"),
  DEAD("dead");

  private final String code;

  JobStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static JobStatus fromCode(String code) {
    for (JobStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status: " + code);
  }
}
