package mailqueue.processing;

import mailqueue.auth.AccessTokenManager;
import mailqueue.model.AttachmentInfo;
import mailqueue.model.ConnectionStatus;
import mailqueue.model.EmailAnalysis;
import mailqueue.model.EmailConnection;
import mailqueue.model.MailMessage;
import mailqueue.model.ProcessedEmail;
import mailqueue.model.ProcessingStatus;
import mailqueue.spi.CrmDirectory;
import mailqueue.spi.EmailAnalysisException;
import mailqueue.testing.InMemoryEmailConnections;
import mailqueue.testing.InMemoryProcessedEmails;
import mailqueue.testing.MutableClock;
import mailqueue.testing.PlainTokenCipher;
import mailqueue.testing.StubMailProvider;
import mailqueue.testing.StubTokenRefresher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EmailProcessorTest {
  private MutableClock clock;
  private InMemoryEmailConnections connections;
  private InMemoryProcessedEmails processedEmails;
  private StubMailProvider provider;
  private StubTokenRefresher refresher;
  private AccessTokenManager tokens;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-03-01T10:00:00Z");
    connections = new InMemoryEmailConnections();
    connections.put(InMemoryEmailConnections.activeConnection(7L, 42L, clock.instant().plus(Duration.ofHours(1))));
    processedEmails = new InMemoryProcessedEmails();
    provider = new StubMailProvider();
    refresher = new StubTokenRefresher(clock);
    tokens = new AccessTokenManager(connections, refresher, new PlainTokenCipher(), clock);
  }

  private EmailProcessor.Builder processor() {
    return EmailProcessor.builder()
        .connections(connections)
        .processedEmails(processedEmails)
        .tokens(tokens)
        .mailProvider(provider)
        .clock(clock);
  }

  private static CrmDirectory directory(Long conversation, Long enquiry, Long lead) {
    return new CrmDirectory() {
      @Override
      public OptionalLong findConversationId(String emailAddress) {
        return conversation == null ? OptionalLong.empty() : OptionalLong.of(conversation);
      }

      @Override
      public OptionalLong findEnquiryId(String emailAddress) {
        return enquiry == null ? OptionalLong.empty() : OptionalLong.of(enquiry);
      }

      @Override
      public OptionalLong findLeadId(String emailAddress) {
        return lead == null ? OptionalLong.empty() : OptionalLong.of(lead);
      }
    };
  }

  @Test
  void storesHtmlMessageAndMarksConnectionHealthy() {
    provider.messages.put("msg-1", StubMailProvider.message("msg-1", "buyer@example.com", "html", "<p>Hi</p>"));
    connections.recordError(7L, "previous failure");

    ProcessEmailResult result = processor().build().processEmail("msg-1", 7L, 42L);

    assertTrue(result.success());
    ProcessedEmail stored = processedEmails.findById(result.processedEmailId()).orElseThrow();
    assertEquals("<p>Hi</p>", stored.bodyHtml());
    assertNull(stored.bodyText());
    assertEquals("buyer@example.com", stored.fromAddress());
    assertEquals(List.of("agent@example.com"), stored.toAddresses());
    assertEquals(ProcessingStatus.PENDING, stored.processingStatus());
    assertEquals("access-7", provider.accessTokens.get(0));

    EmailConnection connection = connections.get(7L);
    assertEquals(0, connection.errorCount());
    assertNull(connection.lastError());
    assertEquals(clock.instant(), connection.lastSyncAt());
  }

  @Test
  void plainTextBodyGoesToBodyText() {
    provider.messages.put("msg-1", StubMailProvider.message("msg-1", "buyer@example.com", "text", "Hello"));

    ProcessEmailResult result = processor().build().processEmail("msg-1", 7L, 42L);

    ProcessedEmail stored = processedEmails.findById(result.processedEmailId()).orElseThrow();
    assertEquals("Hello", stored.bodyText());
    assertNull(stored.bodyHtml());
  }

  @Test
  void alreadyStoredMessageIsNotFetchedAgain() {
    provider.messages.put("msg-1", StubMailProvider.message("msg-1", "buyer@example.com", "text", "Hello"));
    EmailProcessor processor = processor().build();

    ProcessEmailResult first = processor.processEmail("msg-1", 7L, 42L);
    ProcessEmailResult second = processor.processEmail("msg-1", 7L, 42L);

    assertTrue(second.success());
    assertEquals(first.processedEmailId(), second.processedEmailId());
    assertEquals(1, provider.getMessageCalls.get());
    assertEquals(1, processedEmails.all().size());
  }

  @Test
  void leadOverridesEnquiryAsContact() {
    provider.messages.put("msg-1", StubMailProvider.message("msg-1", "Buyer@Example.com", "text", "Hello"));

    ProcessEmailResult result = processor().crmDirectory(directory(11L, 22L, 33L)).build()
        .processEmail("msg-1", 7L, 42L);

    assertEquals(11L, result.linkedConversationId());
    assertEquals(33L, result.linkedContactId());
    ProcessedEmail stored = processedEmails.findById(result.processedEmailId()).orElseThrow();
    assertEquals(11L, stored.links().conversationId());
    assertEquals(22L, stored.links().enquiryId());
    assertEquals(33L, stored.links().contactId());
  }

  @Test
  void enquiryIsContactWhenNoLead() {
    provider.messages.put("msg-1", StubMailProvider.message("msg-1", "buyer@example.com", "text", "Hello"));

    ProcessEmailResult result = processor().crmDirectory(directory(null, 22L, null)).build()
        .processEmail("msg-1", 7L, 42L);

    assertNull(result.linkedConversationId());
    assertEquals(22L, result.linkedContactId());
  }

  @Test
  void analysisIsStoredWhenAnalyzerConfigured() {
    provider.messages.put("msg-1", StubMailProvider.message("msg-1", "buyer@example.com", "text", "Can I view?"));
    EmailAnalysis analysis = new EmailAnalysis("viewing_request", "positive", "high", "Wants a viewing",
        Map.of("dates", List.of("Saturday")), List.of());

    ProcessEmailResult result = processor().analyzer(message -> analysis).build().processEmail("msg-1", 7L, 42L);

    assertEquals(analysis, result.analysis());
    ProcessedEmail stored = processedEmails.findById(result.processedEmailId()).orElseThrow();
    assertTrue(stored.aiProcessed());
    assertEquals(ProcessingStatus.PROCESSED, stored.processingStatus());
    assertEquals(clock.instant(), stored.aiProcessedAt());
    assertEquals("viewing_request", stored.analysis().category());
  }

  @Test
  void analyzerFailureDoesNotFailProcessing() {
    provider.messages.put("msg-1", StubMailProvider.message("msg-1", "buyer@example.com", "text", "Hello"));

    ProcessEmailResult result = processor()
        .analyzer(message -> {
          throw new EmailAnalysisException("OpenAI API error (500)");
        })
        .build()
        .processEmail("msg-1", 7L, 42L);

    assertTrue(result.success());
    assertNull(result.analysis());
    assertFalse(processedEmails.findById(result.processedEmailId()).orElseThrow().aiProcessed());
  }

  @Test
  void emptyBodySkipsAnalysis() {
    provider.messages.put("msg-1", StubMailProvider.message("msg-1", "buyer@example.com", "text", "  "));
    AtomicInteger calls = new AtomicInteger();

    processor().analyzer(message -> {
      calls.incrementAndGet();
      return null;
    }).build().processEmail("msg-1", 7L, 42L);

    assertEquals(0, calls.get());
  }

  @Test
  void attachmentMetadataIsFetched() {
    MailMessage message = StubMailProvider.message("msg-1", "buyer@example.com", "text", "See attached");
    provider.messages.put("msg-1", new MailMessage(message.id(), message.conversationId(),
        message.internetMessageId(), message.from(), message.toRecipients(), List.of(), List.of(),
        message.subject(), message.bodyPreview(), "text", "See attached", true, List.of(), message.receivedAt(),
        message.sentAt(), "normal", List.of(), false, false, "inbox"));
    provider.attachments.put("msg-1", List.of(new AttachmentInfo("att-1", "plan.pdf", "application/pdf", 2048, null)));

    ProcessEmailResult result = processor().build().processEmail("msg-1", 7L, 42L);

    ProcessedEmail stored = processedEmails.findById(result.processedEmailId()).orElseThrow();
    assertTrue(stored.hasAttachments());
    assertEquals("plan.pdf", stored.attachments().get(0).name());
  }

  @Test
  void inactiveConnectionFailsWithoutFetching() {
    connections.setStatus(7L, ConnectionStatus.REVOKED);

    ProcessEmailResult result = processor().build().processEmail("msg-1", 7L, 42L);

    assertFalse(result.success());
    assertEquals(0, provider.getMessageCalls.get());
  }

  @Test
  void missingConnectionFails() {
    ProcessEmailResult result = processor().build().processEmail("msg-1", 99L, 42L);

    assertFalse(result.success());
    assertEquals("Connection not found", result.error());
  }

  @Test
  void providerErrorIsRecordedOnConnection() {
    ProcessEmailResult result = processor().build().processEmail("missing", 7L, 42L);

    assertFalse(result.success());
    assertTrue(result.error().contains("404"));
    EmailConnection connection = connections.get(7L);
    assertEquals(1, connection.errorCount());
    assertEquals(result.error(), connection.lastError());
  }

  @Test
  void expiringTokenIsRefreshedBeforeFetch() {
    connections.put(InMemoryEmailConnections.activeConnection(7L, 42L, clock.instant().plus(Duration.ofMinutes(2))));
    provider.messages.put("msg-1", StubMailProvider.message("msg-1", "buyer@example.com", "text", "Hello"));

    assertTrue(processor().build().processEmail("msg-1", 7L, 42L).success());

    assertEquals(1, refresher.calls.get());
    assertEquals("fresh-access-1", provider.accessTokens.get(0));
  }
}
