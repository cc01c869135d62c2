package mailqueue.testing;

import mailqueue.model.SentEmail;
import mailqueue.model.SentEmailStatus;
import mailqueue.spi.SentEmailRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemorySentEmails implements SentEmailRepository {
  private final Map<Long, SentEmail> rows = new ConcurrentHashMap<>();
  private final AtomicLong ids = new AtomicLong();

  public SentEmail get(long id) {
    return rows.get(id);
  }

  @Override
  public long insert(SentEmail e) {
    long id = ids.incrementAndGet();
    rows.put(id, copy(e, id, e.status(), e.sentAt(), e.failedAt(), e.failureReason()));
    return id;
  }

  @Override
  public Optional<SentEmail> findById(long id) {
    return Optional.ofNullable(rows.get(id));
  }

  @Override
  public List<SentEmail> findByUserId(long userId, SentEmailStatus status, int limit, int offset) {
    return rows.values().stream()
        .filter(e -> e.userId() == userId && (status == null || e.status() == status))
        .sorted(Comparator.comparingLong(SentEmail::id).reversed())
        .skip(offset)
        .limit(limit)
        .toList();
  }

  @Override
  public void markSending(long id) {
    SentEmail e = rows.get(id);
    rows.put(id, copy(e, id, SentEmailStatus.SENDING, e.sentAt(), e.failedAt(), e.failureReason()));
  }

  @Override
  public void markSent(long id, Instant sentAt) {
    SentEmail e = rows.get(id);
    rows.put(id, copy(e, id, SentEmailStatus.SENT, sentAt, e.failedAt(), e.failureReason()));
  }

  @Override
  public void markFailed(long id, String failureReason, Instant failedAt) {
    SentEmail e = rows.get(id);
    rows.put(id, copy(e, id, SentEmailStatus.FAILED, e.sentAt(), failedAt, failureReason));
  }

  @Override
  public void resetToQueued(long id) {
    SentEmail e = rows.get(id);
    rows.put(id, copy(e, id, SentEmailStatus.QUEUED, e.sentAt(), null, null));
  }

  private static SentEmail copy(SentEmail e, long id, SentEmailStatus status, Instant sentAt, Instant failedAt,
      String failureReason) {
    return new SentEmail(id, e.connectionId(), e.userId(), e.toAddresses(), e.ccAddresses(), e.bccAddresses(),
        e.replyTo(), e.subject(), e.bodyText(), e.bodyHtml(), e.importance(), e.attachments(), status, sentAt,
        failedAt, failureReason, e.inReplyTo(), e.linkedConversationId(), e.linkedContactId(),
        e.linkedPropertyId(), e.templateUsed(), e.createdAt());
  }
}
