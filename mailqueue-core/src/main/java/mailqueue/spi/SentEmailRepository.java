package mailqueue.spi;

import mailqueue.model.SentEmail;
import mailqueue.model.SentEmailStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SentEmailRepository {

    /**
     * Inserts an outbound email; the {@code id} of the argument is ignored.
     *
     * @return the generated id
     */
    long insert(SentEmail email);

    Optional<SentEmail> findById(long id);

    /**
     * Lists a user's emails, newest first.
     *
     * @param status optional filter, {@code null} for all
     */
    List<SentEmail> findByUserId(long userId, SentEmailStatus status, int limit, int offset);

    void markSending(long id);

    void markSent(long id, Instant sentAt);

    void markFailed(long id, String failureReason, Instant failedAt);

    /**
     * Returns a failed email to queued and clears failedAt and failureReason.
     */
    void resetToQueued(long id);
}
