package mailqueue.spi;

import mailqueue.model.AttachmentInfo;
import mailqueue.model.MailMessage;
import mailqueue.model.OutboundMessage;
import mailqueue.model.ProviderSubscription;
import mailqueue.model.SubscriptionRequest;

import java.time.Instant;
import java.util.List;

/**
 * Port to the external mail provider. Every call takes a plaintext access token for the mailbox
 * it acts on.
 *
 * <p>Implementations throw {@link MailProviderException} on any non-success response.
 *
 * @see mailqueue.graph.GraphApiClient
 */
public interface MailProvider {

    MailMessage getMessage(String accessToken, String messageId);

    List<AttachmentInfo> getAttachments(String accessToken, String messageId);

    void sendMail(String accessToken, OutboundMessage message);

    ProviderSubscription createSubscription(String accessToken, SubscriptionRequest request);

    ProviderSubscription renewSubscription(String accessToken, String subscriptionId, Instant expiration);

    void deleteSubscription(String accessToken, String subscriptionId);
}
