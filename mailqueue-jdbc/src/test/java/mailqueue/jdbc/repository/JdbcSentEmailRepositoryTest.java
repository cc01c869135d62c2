package mailqueue.jdbc.repository;

import mailqueue.jdbc.DataSourceConnectionProvider;
import mailqueue.jdbc.H2Databases;
import mailqueue.model.OutboundAttachment;
import mailqueue.model.SentEmail;
import mailqueue.model.SentEmailStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSentEmailRepositoryTest {
  private static final Instant CREATED = Instant.parse("2024-03-01T10:00:00Z");

  private JdbcSentEmailRepository repository;

  @BeforeEach
  void setUp() {
    repository = new JdbcSentEmailRepository(new DataSourceConnectionProvider(H2Databases.newDatabase()));
  }

  private static SentEmail email(long userId, String subject, Instant createdAt) {
    return new SentEmail(0L, 7L, userId, List.of("buyer@example.com"), List.of("office@example.com"), List.of(),
        List.of("agent@example.com"), subject, "Hello", "<p>Hello</p>", null,
        List.of(OutboundAttachment.ofBase64("brochure.pdf", "application/pdf", "AAAAAAAA")),
        SentEmailStatus.QUEUED, null, null, null, "<abc@example.com>", 11L, null, 99L, "viewing-confirmation",
        createdAt);
  }

  @Test
  void insertRoundTrips() {
    long id = repository.insert(email(42L, "Viewing confirmed", CREATED));

    SentEmail loaded = repository.findById(id).orElseThrow();
    assertEquals(List.of("buyer@example.com"), loaded.toAddresses());
    assertEquals(List.of("office@example.com"), loaded.ccAddresses());
    assertEquals(List.of("agent@example.com"), loaded.replyTo());
    assertEquals("normal", loaded.importance());
    assertEquals(SentEmailStatus.QUEUED, loaded.status());
    assertEquals("brochure.pdf", loaded.attachments().get(0).name());
    assertEquals("AAAAAAAA", loaded.attachments().get(0).contentBytes());
    assertEquals(11L, loaded.linkedConversationId());
    assertNull(loaded.linkedContactId());
    assertEquals(99L, loaded.linkedPropertyId());
    assertEquals(CREATED, loaded.createdAt());
    assertTrue(repository.findById(id + 1).isEmpty());
  }

  @Test
  void statusTransitions() {
    long id = repository.insert(email(42L, "Viewing confirmed", CREATED));

    repository.markSending(id);
    assertEquals(SentEmailStatus.SENDING, repository.findById(id).orElseThrow().status());

    Instant failedAt = CREATED.plusSeconds(5);
    repository.markFailed(id, "Graph API error (503)", failedAt);
    SentEmail failed = repository.findById(id).orElseThrow();
    assertEquals(SentEmailStatus.FAILED, failed.status());
    assertEquals("Graph API error (503)", failed.failureReason());
    assertEquals(failedAt, failed.failedAt());

    repository.resetToQueued(id);
    SentEmail queued = repository.findById(id).orElseThrow();
    assertEquals(SentEmailStatus.QUEUED, queued.status());
    assertNull(queued.failureReason());
    assertNull(queued.failedAt());

    Instant sentAt = CREATED.plusSeconds(60);
    repository.markSent(id, sentAt);
    SentEmail sent = repository.findById(id).orElseThrow();
    assertEquals(SentEmailStatus.SENT, sent.status());
    assertEquals(sentAt, sent.sentAt());
  }

  @Test
  void listsNewestFirstWithStatusFilterAndPaging() {
    long first = repository.insert(email(42L, "first", CREATED));
    long second = repository.insert(email(42L, "second", CREATED.plusSeconds(10)));
    long third = repository.insert(email(42L, "third", CREATED.plusSeconds(20)));
    repository.insert(email(43L, "other user", CREATED.plusSeconds(30)));
    repository.markSent(second, CREATED.plusSeconds(40));

    List<SentEmail> all = repository.findByUserId(42L, null, 10, 0);
    assertEquals(List.of(third, second, first), all.stream().map(SentEmail::id).toList());

    List<SentEmail> page = repository.findByUserId(42L, null, 1, 1);
    assertEquals(1, page.size());
    assertEquals(second, page.get(0).id());

    List<SentEmail> sent = repository.findByUserId(42L, SentEmailStatus.SENT, 10, 0);
    assertEquals(1, sent.size());
    assertEquals("second", sent.get(0).subject());
  }
}
