package mailqueue.model;

public enum ConnectionStatus {
  ACTIVE("active"),
  EXPIRED("expired"),
  REVOKED("revoked"),
  ERROR("error");

  private final String code;

  ConnectionStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static ConnectionStatus fromCode(String code) {
    for (ConnectionStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown connection status: " + code);
  }
}
