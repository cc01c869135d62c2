package mailqueue.spi;

import mailqueue.model.CrmLinks;
import mailqueue.model.EmailAnalysis;
import mailqueue.model.ProcessedEmail;

import java.time.Instant;
import java.util.Optional;

public interface ProcessedEmailRepository {

    Optional<ProcessedEmail> findById(long id);

    Optional<ProcessedEmail> findByGraphMessageId(long connectionId, String graphMessageId);

    /**
     * Inserts a processed email; the {@code id} of the argument is ignored.
     *
     * @return the generated id
     * @throws JobStoreException when (connectionId, graphMessageId) already exists
     */
    long insert(ProcessedEmail email);

    void updateLinks(long id, CrmLinks links);

    /**
     * Stores an analysis and marks the email processed with aiProcessed true.
     */
    void updateAnalysis(long id, EmailAnalysis analysis, Instant analyzedAt);
}
