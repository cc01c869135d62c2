package mailqueue.graph;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import mailqueue.model.AttachmentInfo;
import mailqueue.model.MailMessage;
import mailqueue.model.OutboundAttachment;
import mailqueue.model.OutboundMessage;
import mailqueue.model.ProviderSubscription;
import mailqueue.model.SubscriptionRequest;
import mailqueue.spi.MailProviderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphApiClientTest {
  private static final String TOKEN = "access-token-1";

  private WireMockServer server;
  private GraphApiClient client;

  @BeforeEach
  void setUp() {
    server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
    server.start();
    client = GraphApiClient.builder()
        .baseUrl(server.baseUrl() + "/v1.0/")
        .httpClient(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build())
        .build();
  }

  @AfterEach
  void tearDown() {
    server.stop();
  }

  @Test
  void getMessageMapsGraphFields() {
    server.stubFor(get(urlPathEqualTo("/v1.0/me/messages/AAMk1"))
        .withQueryParam("$select", containing("body"))
        .withHeader("Authorization", equalTo("Bearer " + TOKEN))
        .willReturn(okJson("{"
            + "\"id\":\"AAMk1\",\"conversationId\":\"conv-1\",\"internetMessageId\":\"<abc@example.com>\","
            + "\"subject\":\"Viewing on Saturday?\",\"bodyPreview\":\"Hi\","
            + "\"body\":{\"contentType\":\"html\",\"content\":\"<p>Hi</p>\"},"
            + "\"from\":{\"emailAddress\":{\"name\":\"Buyer\",\"address\":\"buyer@example.com\"}},"
            + "\"toRecipients\":[{\"emailAddress\":{\"address\":\"agent@example.com\"}}],"
            + "\"ccRecipients\":[],"
            + "\"receivedDateTime\":\"2024-03-01T09:00:00Z\",\"sentDateTime\":\"2024-03-01T08:59:30Z\","
            + "\"hasAttachments\":true,\"importance\":\"high\",\"isRead\":false,\"isDraft\":false,"
            + "\"parentFolderId\":\"inbox-id\",\"categories\":[\"Blue category\"],\"webLink\":\"https://x\"}")));

    MailMessage message = client.getMessage(TOKEN, "AAMk1");

    assertEquals("AAMk1", message.id());
    assertEquals("conv-1", message.conversationId());
    assertEquals("buyer@example.com", message.fromAddress());
    assertEquals("Buyer", message.from().name());
    assertEquals("agent@example.com", message.toRecipients().get(0).address());
    assertTrue(message.ccRecipients().isEmpty());
    assertTrue(message.isHtml());
    assertEquals("<p>Hi</p>", message.bodyContent());
    assertTrue(message.hasAttachments());
    assertTrue(message.attachments().isEmpty());
    assertEquals(Instant.parse("2024-03-01T09:00:00Z"), message.receivedAt());
    assertEquals("high", message.importance());
    assertEquals(List.of("Blue category"), message.categories());
    assertEquals("inbox-id", message.parentFolderId());
  }

  @Test
  void getAttachmentsReturnsMetadata() {
    server.stubFor(get(urlPathEqualTo("/v1.0/me/messages/AAMk1/attachments"))
        .willReturn(okJson("{\"value\":[{\"@odata.type\":\"#microsoft.graph.fileAttachment\",\"id\":\"att-1\","
            + "\"name\":\"plan.pdf\",\"contentType\":\"application/pdf\",\"size\":2048,\"contentBytes\":\"AAAA\"}]}")));

    List<AttachmentInfo> attachments = client.getAttachments(TOKEN, "AAMk1");

    assertEquals(List.of(new AttachmentInfo("att-1", "plan.pdf", "application/pdf", 2048L, null)), attachments);
  }

  @Test
  void sendMailPostsGraphMessage() {
    server.stubFor(post(urlPathEqualTo("/v1.0/me/sendMail")).willReturn(aResponse().withStatus(202)));
    OutboundMessage message = new OutboundMessage(List.of("buyer@example.com"), List.of("office@example.com"),
        List.of(), "Viewing confirmed", "Plain", "<p>See you</p>", null, List.of("agent@example.com"),
        List.of(OutboundAttachment.ofBase64("brochure.pdf", "application/pdf", "AAAAAAAA")), true);

    client.sendMail(TOKEN, message);

    server.verify(postRequestedFor(urlPathEqualTo("/v1.0/me/sendMail"))
        .withHeader("Authorization", equalTo("Bearer " + TOKEN))
        .withRequestBody(matchingJsonPath("$.saveToSentItems", equalTo("true")))
        .withRequestBody(matchingJsonPath("$.message.body.contentType", equalTo("html")))
        .withRequestBody(matchingJsonPath("$.message.body.content", equalTo("<p>See you</p>")))
        .withRequestBody(matchingJsonPath("$.message.importance", equalTo("normal")))
        .withRequestBody(matchingJsonPath("$.message.toRecipients[0].emailAddress.address",
            equalTo("buyer@example.com")))
        .withRequestBody(matchingJsonPath("$.message.replyTo[0].emailAddress.address",
            equalTo("agent@example.com")))
        .withRequestBody(matchingJsonPath("$.message.attachments[0]['@odata.type']",
            equalTo("#microsoft.graph.fileAttachment")))
        .withRequestBody(notContaining("bccRecipients")));
  }

  @Test
  void plainTextBodyWhenNoHtml() {
    server.stubFor(post(urlPathEqualTo("/v1.0/me/sendMail")).willReturn(aResponse().withStatus(202)));

    client.sendMail(TOKEN, new OutboundMessage(List.of("buyer@example.com"), null, null, "Hello", "Plain body",
        null, "low", null, null, false));

    server.verify(postRequestedFor(urlPathEqualTo("/v1.0/me/sendMail"))
        .withRequestBody(matchingJsonPath("$.message.body.contentType", equalTo("text")))
        .withRequestBody(matchingJsonPath("$.message.body.content", equalTo("Plain body")))
        .withRequestBody(matchingJsonPath("$.message.importance", equalTo("low")))
        .withRequestBody(matchingJsonPath("$.saveToSentItems", equalTo("false"))));
  }

  @Test
  void subscriptionLifecycle() {
    Instant expiry = Instant.parse("2024-03-04T08:30:00Z");
    server.stubFor(post(urlPathEqualTo("/v1.0/subscriptions"))
        .willReturn(aResponse().withStatus(201).withHeader("Content-Type", "application/json")
            .withBody("{\"id\":\"sub-1\",\"resource\":\"users/ms-1/mailFolders/inbox/messages\","
                + "\"changeType\":\"created,updated\",\"notificationUrl\":\"https://crm.example.com/hook\","
                + "\"expirationDateTime\":\"2024-03-04T08:30:00.0000000Z\",\"clientState\":\"c0ffee\"}")));
    server.stubFor(patch(urlPathEqualTo("/v1.0/subscriptions/sub-1"))
        .willReturn(okJson("{\"id\":\"sub-1\",\"expirationDateTime\":\"2024-03-07T08:30:00Z\"}")));
    server.stubFor(delete(urlPathEqualTo("/v1.0/subscriptions/sub-1")).willReturn(aResponse().withStatus(204)));

    ProviderSubscription created = client.createSubscription(TOKEN, new SubscriptionRequest("created,updated",
        "https://crm.example.com/hook", "users/ms-1/mailFolders/inbox/messages", expiry, "c0ffee"));
    assertEquals("sub-1", created.id());
    assertEquals(expiry, created.expirationDateTime());
    server.verify(postRequestedFor(urlPathEqualTo("/v1.0/subscriptions"))
        .withRequestBody(matchingJsonPath("$.expirationDateTime", equalTo("2024-03-04T08:30:00Z")))
        .withRequestBody(matchingJsonPath("$.clientState", equalTo("c0ffee"))));

    ProviderSubscription renewed = client.renewSubscription(TOKEN, "sub-1", Instant.parse("2024-03-07T08:30:00Z"));
    assertEquals(Instant.parse("2024-03-07T08:30:00Z"), renewed.expirationDateTime());

    client.deleteSubscription(TOKEN, "sub-1");
    server.verify(deleteRequestedFor(urlPathEqualTo("/v1.0/subscriptions/sub-1")));
  }

  @Test
  void errorBodyMessageIsReported() {
    server.stubFor(get(urlPathEqualTo("/v1.0/me/messages/gone"))
        .willReturn(aResponse().withStatus(404).withHeader("Content-Type", "application/json")
            .withBody("{\"error\":{\"code\":\"ErrorItemNotFound\",\"message\":\"The specified object was not found.\"}}")));

    MailProviderException e = assertThrows(MailProviderException.class, () -> client.getMessage(TOKEN, "gone"));

    assertEquals(404, e.statusCode());
    assertEquals("Graph API error (404): The specified object was not found.", e.getMessage());
  }

  @Test
  void nonJsonErrorBodyIsReportedVerbatim() {
    server.stubFor(post(urlPathEqualTo("/v1.0/me/sendMail"))
        .willReturn(aResponse().withStatus(503).withBody("Service Unavailable")));

    MailProviderException e = assertThrows(MailProviderException.class,
        () -> client.sendMail(TOKEN, new OutboundMessage(List.of("a@example.com"), null, null, "s", "b", null,
            null, null, null, true)));

    assertEquals(503, e.statusCode());
    assertEquals("Graph API error (503): Service Unavailable", e.getMessage());
  }

  @Test
  void unreachableProviderHasNoStatus() {
    server.stop();

    MailProviderException e = assertThrows(MailProviderException.class, () -> client.getMessage(TOKEN, "AAMk1"));

    assertEquals(-1, e.statusCode());
  }
}
