package mailqueue.testing;

import mailqueue.model.AttachmentInfo;
import mailqueue.model.MailAddress;
import mailqueue.model.MailMessage;
import mailqueue.model.OutboundMessage;
import mailqueue.model.ProviderSubscription;
import mailqueue.model.SubscriptionRequest;
import mailqueue.spi.MailProvider;
import mailqueue.spi.MailProviderException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Scriptable provider that records every call. */
public class StubMailProvider implements MailProvider {
  public final Map<String, MailMessage> messages = new ConcurrentHashMap<>();
  public final Map<String, List<AttachmentInfo>> attachments = new ConcurrentHashMap<>();
  public final List<OutboundMessage> sent = new CopyOnWriteArrayList<>();
  public final List<String> accessTokens = new CopyOnWriteArrayList<>();
  public final List<SubscriptionRequest> createdSubscriptions = new CopyOnWriteArrayList<>();
  public final List<String> deletedSubscriptions = new CopyOnWriteArrayList<>();
  public final AtomicInteger getMessageCalls = new AtomicInteger();
  public final AtomicInteger renewCalls = new AtomicInteger();

  public volatile RuntimeException sendFailure;
  public volatile RuntimeException renewFailure;
  public volatile RuntimeException deleteFailure;
  private final AtomicInteger subscriptionIds = new AtomicInteger();

  public static MailMessage message(String id, String from, String contentType, String body) {
    return new MailMessage(id, "conv-" + id, "<" + id + "@example.com>", new MailAddress("Sender", from),
        List.of(new MailAddress("Agent", "agent@example.com")), List.of(), List.of(), "Subject " + id,
        "preview", contentType, body, false, List.of(), Instant.parse("2024-03-01T09:00:00Z"),
        Instant.parse("2024-03-01T08:59:00Z"), "normal", List.of(), false, false, "inbox");
  }

  @Override
  public MailMessage getMessage(String accessToken, String messageId) {
    getMessageCalls.incrementAndGet();
    accessTokens.add(accessToken);
    MailMessage message = messages.get(messageId);
    if (message == null) {
      throw new MailProviderException(404, "Graph API error (404): message not found");
    }
    return message;
  }

  @Override
  public List<AttachmentInfo> getAttachments(String accessToken, String messageId) {
    return attachments.getOrDefault(messageId, List.of());
  }

  @Override
  public void sendMail(String accessToken, OutboundMessage message) {
    accessTokens.add(accessToken);
    if (sendFailure != null) {
      throw sendFailure;
    }
    sent.add(message);
  }

  @Override
  public ProviderSubscription createSubscription(String accessToken, SubscriptionRequest request) {
    createdSubscriptions.add(request);
    return new ProviderSubscription("provider-sub-" + subscriptionIds.incrementAndGet(), request.resource(),
        request.changeType(), request.notificationUrl(), request.expirationDateTime(), request.clientState());
  }

  @Override
  public ProviderSubscription renewSubscription(String accessToken, String subscriptionId, Instant expiration) {
    renewCalls.incrementAndGet();
    if (renewFailure != null) {
      throw renewFailure;
    }
    return new ProviderSubscription(subscriptionId, null, null, null, expiration, null);
  }

  @Override
  public void deleteSubscription(String accessToken, String subscriptionId) {
    if (deleteFailure != null) {
      throw deleteFailure;
    }
    deletedSubscriptions.add(subscriptionId);
  }
}
