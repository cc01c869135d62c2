package mailqueue.webhook;

import java.util.List;

/**
 * Outcome of one webhook request. A validation result carries the token to echo back; any
 * other result carries the number of enqueued notifications and one error per rejection.
 */
public record WebhookResult(String validationToken, int processedCount, List<String> errors) {

  public WebhookResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static WebhookResult validation(String validationToken) {
    return new WebhookResult(validationToken, 0, List.of());
  }

  public static WebhookResult processed(int processedCount, List<String> errors) {
    return new WebhookResult(null, processedCount, errors);
  }

  public boolean isValidation() {
    return validationToken != null;
  }
}
