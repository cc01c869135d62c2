package mailqueue.webhook;

/**
 * A notification that fails validation. The message becomes the entry in
 * {@link WebhookResult#errors()}.
 */
public class NotificationRejectedException extends RuntimeException {

  public NotificationRejectedException(String message) {
    super(message);
  }
}
