package mailqueue.sending;

public record SendEmailResult(boolean success, Long sentEmailId, String error) {

  public static SendEmailResult success(long sentEmailId) {
    return new SendEmailResult(true, sentEmailId, null);
  }

  public static SendEmailResult failure(Long sentEmailId, String error) {
    return new SendEmailResult(false, sentEmailId, error);
  }
}
