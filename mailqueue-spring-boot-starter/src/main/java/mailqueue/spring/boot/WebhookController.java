package mailqueue.spring.boot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import mailqueue.subscription.SubscriptionManager;
import mailqueue.util.JacksonJsonCodec;
import mailqueue.webhook.NotificationBatch;
import mailqueue.webhook.WebhookReceiver;
import mailqueue.webhook.WebhookResult;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP endpoint the mail provider posts change notifications to.
 *
 * <p>A request with a {@code validationToken} query parameter is a subscription handshake and
 * gets the token echoed as {@code text/plain}. Any other request is acknowledged with
 * {@code 202 Accepted}; per-notification problems are reported in the body, never as an error
 * status, so the provider does not retry them.
 */
@RestController
public class WebhookController {
  private static final Logger logger = Logger.getLogger(WebhookController.class.getName());

  private final WebhookReceiver receiver;
  private final ObjectMapper mapper = JacksonJsonCodec.defaultMapper();

  public WebhookController(WebhookReceiver receiver) {
    this.receiver = Objects.requireNonNull(receiver, "receiver");
  }

  @PostMapping(SubscriptionManager.WEBHOOK_PATH)
  public ResponseEntity<?> receive(
      @RequestParam(name = "validationToken", required = false) String validationToken,
      @RequestBody(required = false) String body) {
    WebhookResult result = receiver.handle(validationToken, validationToken != null ? null : parse(body));
    if (result.isValidation()) {
      return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(result.validationToken());
    }
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("processedCount", result.processedCount());
    response.put("errors", result.errors());
    return ResponseEntity.status(HttpStatus.ACCEPTED).contentType(MediaType.APPLICATION_JSON).body(response);
  }

  private NotificationBatch parse(String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return mapper.readValue(body, NotificationBatch.class);
    } catch (JsonProcessingException e) {
      logger.log(Level.WARNING, "Unparseable webhook body: {0}", e.getOriginalMessage());
      return null;
    }
  }
}
