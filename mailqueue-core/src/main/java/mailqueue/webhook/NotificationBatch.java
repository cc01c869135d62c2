package mailqueue.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Body of a notification POST: {@code {"value": [...]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationBatch(List<Notification> value) {
}
