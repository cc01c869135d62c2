package mailqueue.model;

/**
 * Kinds of background work carried by the job queue. The wire name is what gets persisted in
 * the {@code job_type} column.
 */
public enum JobType {
  PROCESS_EMAIL("process_email"),
  SEND_EMAIL("send_email"),
  SYNC_FOLDER("sync_folder"),
  RENEW_SUBSCRIPTION("renew_subscription"),
  PROCESS_AI("process_ai");

  private final String wireName;

  JobType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static JobType fromWireName(String wireName) {
    for (JobType type : values()) {
      if (type.wireName.equals(wireName)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown job type: " + wireName);
  }
}
