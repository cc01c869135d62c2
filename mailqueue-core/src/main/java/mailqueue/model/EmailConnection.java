package mailqueue.model;

import java.time.Instant;

/**
 * A user's linked mailbox. Token fields hold ciphertext produced by a {@code TokenCipher}.
 */
public record EmailConnection(
    long id,
    long userId,
    String provider,
    String tenantId,
    String mailboxUpn,
    String microsoftUserId,
    String accessToken,
    String refreshToken,
    Instant tokenExpiresAt,
    ConnectionStatus status,
    boolean syncEnabled,
    Instant lastSyncAt,
    String lastError,
    int errorCount) {

  public boolean isActive() {
    return status == ConnectionStatus.ACTIVE;
  }
}
