package mailqueue.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import mailqueue.model.AttachmentInfo;
import mailqueue.model.MailAddress;
import mailqueue.model.MailMessage;
import mailqueue.model.OutboundAttachment;
import mailqueue.model.OutboundMessage;
import mailqueue.model.ProviderSubscription;
import mailqueue.model.SubscriptionRequest;
import mailqueue.spi.MailProvider;
import mailqueue.spi.MailProviderException;
import mailqueue.util.JacksonJsonCodec;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MailProvider} backed by the Microsoft Graph v1.0 REST API.
 *
 * <p>All mailbox calls go through {@code /me}, so the access token decides which mailbox is
 * read or written. Any non-2xx response raises a {@link MailProviderException} carrying the
 * status and the {@code error.message} of the Graph error body when there is one.
 */
public final class GraphApiClient implements MailProvider {
    private static final Logger logger = Logger.getLogger(GraphApiClient.class.getName());

    public static final String DEFAULT_BASE_URL = "https://graph.microsoft.com/v1.0";

    static final String MESSAGE_FIELDS = String.join(",",
            "id", "subject", "bodyPreview", "from", "sender", "toRecipients", "ccRecipients",
            "bccRecipients", "replyTo", "receivedDateTime", "sentDateTime", "hasAttachments",
            "importance", "isRead", "isDraft", "conversationId", "internetMessageId",
            "parentFolderId", "categories", "webLink", "body");

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration requestTimeout;

    private GraphApiClient(Builder builder) {
        this.baseUrl = stripTrailingSlash(builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL);
        this.httpClient = builder.httpClient != null ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        this.mapper = builder.mapper != null ? builder.mapper : JacksonJsonCodec.defaultMapper();
        this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : Duration.ofSeconds(30);
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be > 0");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public MailMessage getMessage(String accessToken, String messageId) {
        JsonNode node = call(accessToken, "GET",
                "/me/messages/" + encode(messageId) + "?$select=" + MESSAGE_FIELDS, null);
        return toMessage(node);
    }

    @Override
    public List<AttachmentInfo> getAttachments(String accessToken, String messageId) {
        JsonNode node = call(accessToken, "GET", "/me/messages/" + encode(messageId) + "/attachments", null);
        List<AttachmentInfo> attachments = new ArrayList<>();
        for (JsonNode item : node.path("value")) {
            attachments.add(new AttachmentInfo(
                    text(item, "id"),
                    text(item, "name"),
                    text(item, "contentType"),
                    item.path("size").asLong(0L),
                    text(item, "contentId")));
        }
        return attachments;
    }

    @Override
    public void sendMail(String accessToken, OutboundMessage message) {
        ObjectNode body = mapper.createObjectNode();
        body.set("message", toGraphMessage(message));
        body.put("saveToSentItems", message.saveToSentItems());
        call(accessToken, "POST", "/me/sendMail", body);
        logger.log(Level.FINE, "Sent mail to {0} recipient(s)", message.to().size());
    }

    @Override
    public ProviderSubscription createSubscription(String accessToken, SubscriptionRequest request) {
        ObjectNode body = mapper.createObjectNode();
        body.put("changeType", request.changeType());
        body.put("notificationUrl", request.notificationUrl());
        body.put("resource", request.resource());
        body.put("expirationDateTime", request.expirationDateTime().toString());
        body.put("clientState", request.clientState());
        return toSubscription(call(accessToken, "POST", "/subscriptions", body));
    }

    @Override
    public ProviderSubscription renewSubscription(String accessToken, String subscriptionId, Instant expiration) {
        ObjectNode body = mapper.createObjectNode();
        body.put("expirationDateTime", expiration.toString());
        return toSubscription(call(accessToken, "PATCH", "/subscriptions/" + encode(subscriptionId), body));
    }

    @Override
    public void deleteSubscription(String accessToken, String subscriptionId) {
        call(accessToken, "DELETE", "/subscriptions/" + encode(subscriptionId), null);
    }

    private JsonNode call(String accessToken, String method, String path, JsonNode body) {
        Objects.requireNonNull(accessToken, "accessToken");
        HttpRequest.BodyPublisher publisher;
        try {
            publisher = body == null ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new MailProviderException("Failed to encode Graph request body", e);
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + accessToken)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .method(method, publisher)
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new MailProviderException("Graph API request failed: " + method + " " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MailProviderException("Interrupted calling Graph API: " + method + " " + path, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String message = errorMessage(response.body());
            logger.log(Level.WARNING, "Graph API {0} {1} returned {2}: {3}",
                    new Object[]{method, path, status, message});
            throw new MailProviderException(status, "Graph API error (" + status + "): " + message);
        }
        if (status == 204 || response.body() == null || response.body().isEmpty()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new MailProviderException("Unreadable Graph API response for " + method + " " + path, e);
        }
    }

    private String errorMessage(String responseBody) {
        if (responseBody == null) {
            return "";
        }
        try {
            JsonNode message = mapper.readTree(responseBody).path("error").path("message");
            return message.isTextual() ? message.asText() : responseBody;
        } catch (JsonProcessingException e) {
            return responseBody;
        }
    }

    private ObjectNode toGraphMessage(OutboundMessage message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("subject", message.subject());
        ObjectNode body = node.putObject("body");
        boolean html = message.bodyHtml() != null && !message.bodyHtml().isEmpty();
        body.put("contentType", html ? "html" : "text");
        body.put("content", html ? message.bodyHtml() : message.bodyText() != null ? message.bodyText() : "");
        node.set("toRecipients", recipients(message.to()));
        node.put("importance", message.importance() != null ? message.importance() : "normal");
        if (!message.cc().isEmpty()) {
            node.set("ccRecipients", recipients(message.cc()));
        }
        if (!message.bcc().isEmpty()) {
            node.set("bccRecipients", recipients(message.bcc()));
        }
        if (!message.replyTo().isEmpty()) {
            node.set("replyTo", recipients(message.replyTo()));
        }
        if (!message.attachments().isEmpty()) {
            ArrayNode attachments = node.putArray("attachments");
            for (OutboundAttachment attachment : message.attachments()) {
                ObjectNode item = attachments.addObject();
                item.put("@odata.type", "#microsoft.graph.fileAttachment");
                item.put("name", attachment.name());
                item.put("contentType", attachment.contentType());
                item.put("contentBytes", attachment.contentBytes());
            }
        }
        return node;
    }

    private ArrayNode recipients(List<String> addresses) {
        ArrayNode array = mapper.createArrayNode();
        for (String address : addresses) {
            array.addObject().putObject("emailAddress").put("address", address);
        }
        return array;
    }

    private static MailMessage toMessage(JsonNode node) {
        JsonNode body = node.path("body");
        List<String> categories = new ArrayList<>();
        for (JsonNode category : node.path("categories")) {
            categories.add(category.asText());
        }
        return new MailMessage(
                text(node, "id"),
                text(node, "conversationId"),
                text(node, "internetMessageId"),
                address(node.path("from")),
                addresses(node.path("toRecipients")),
                addresses(node.path("ccRecipients")),
                addresses(node.path("bccRecipients")),
                text(node, "subject"),
                text(node, "bodyPreview"),
                text(body, "contentType"),
                text(body, "content"),
                node.path("hasAttachments").asBoolean(false),
                List.of(),
                instant(node, "receivedDateTime"),
                instant(node, "sentDateTime"),
                text(node, "importance"),
                categories,
                node.path("isRead").asBoolean(false),
                node.path("isDraft").asBoolean(false),
                text(node, "parentFolderId"));
    }

    private static ProviderSubscription toSubscription(JsonNode node) {
        return new ProviderSubscription(
                text(node, "id"),
                text(node, "resource"),
                text(node, "changeType"),
                text(node, "notificationUrl"),
                instant(node, "expirationDateTime"),
                text(node, "clientState"));
    }

    private static MailAddress address(JsonNode recipient) {
        JsonNode email = recipient.path("emailAddress");
        if (email.isMissingNode() || email.isNull()) {
            return null;
        }
        return new MailAddress(text(email, "name"), text(email, "address"));
    }

    private static List<MailAddress> addresses(JsonNode recipients) {
        List<MailAddress> result = new ArrayList<>();
        for (JsonNode recipient : recipients) {
            MailAddress address = address(recipient);
            if (address != null) {
                result.add(address);
            }
        }
        return result;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isEmpty()) {
            return null;
        }
        return Instant.parse(value);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(Objects.requireNonNull(segment, "id"), StandardCharsets.UTF_8)
                .replace("+", "%20");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Builder for {@link GraphApiClient}.
     */
    public static final class Builder {
        private String baseUrl;
        private HttpClient httpClient;
        private ObjectMapper mapper;
        private Duration requestTimeout;

        private Builder() {
        }

        /**
         * Graph root including the version segment. Defaults to {@value GraphApiClient#DEFAULT_BASE_URL}.
         */
        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public GraphApiClient build() {
            return new GraphApiClient(this);
        }
    }
}
