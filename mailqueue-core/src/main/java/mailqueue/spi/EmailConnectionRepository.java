package mailqueue.spi;

import mailqueue.model.EmailConnection;

import java.time.Instant;
import java.util.Optional;

/**
 * Access to mailbox connection records. Connections are created by the OAuth consent flow,
 * which lives outside this library; here they are only read and kept healthy.
 */
public interface EmailConnectionRepository {

    Optional<EmailConnection> findById(long connectionId);

    /**
     * Stores freshly refreshed tokens. Both tokens are ciphertext.
     */
    void updateTokens(long connectionId, String encryptedAccessToken, String encryptedRefreshToken,
                      Instant expiresAt);

    /**
     * Clears the error state after a successful sync: errorCount 0, lastError null, lastSyncAt now.
     */
    void markSyncSuccess(long connectionId, Instant now);

    /**
     * Increments errorCount and sets lastError.
     */
    void recordError(long connectionId, String error);
}
