package mailqueue.auth;

import mailqueue.model.EmailConnection;
import mailqueue.model.TokenGrant;
import mailqueue.spi.EmailConnectionRepository;
import mailqueue.spi.TokenCipher;
import mailqueue.spi.TokenRefresher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hands out usable access tokens for a connection, refreshing them shortly before expiry.
 *
 * <p>A token is refreshed when it expires within {@link #REFRESH_BUFFER}. The refreshed pair is
 * encrypted and written back to the connection; concurrent refreshes are last-writer-wins.
 */
public final class AccessTokenManager {
  private static final Logger logger = Logger.getLogger(AccessTokenManager.class.getName());

  public static final Duration REFRESH_BUFFER = Duration.ofMinutes(5);

  private final EmailConnectionRepository connections;
  private final TokenRefresher refresher;
  private final TokenCipher cipher;
  private final Clock clock;

  public AccessTokenManager(EmailConnectionRepository connections, TokenRefresher refresher,
      TokenCipher cipher, Clock clock) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.refresher = Objects.requireNonNull(refresher, "refresher");
    this.cipher = Objects.requireNonNull(cipher, "cipher");
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  /**
   * Returns a plaintext access token for the connection.
   *
   * @throws mailqueue.spi.TokenRefreshException if a needed refresh is refused
   */
  public String getValidAccessToken(EmailConnection connection) {
    Instant now = clock.instant();
    Instant expiresAt = connection.tokenExpiresAt();
    if (expiresAt != null && !expiresAt.minus(REFRESH_BUFFER).isBefore(now)) {
      return cipher.decrypt(connection.accessToken());
    }

    logger.log(Level.INFO, "Refreshing access token for connection {0}", connection.id());
    String refreshToken = cipher.decrypt(connection.refreshToken());
    TokenGrant grant = refresher.refresh(refreshToken, connection.tenantId());
    String encryptedAccess = cipher.encrypt(grant.accessToken());
    String encryptedRefresh = grant.refreshToken() != null
        ? cipher.encrypt(grant.refreshToken())
        : connection.refreshToken();
    connections.updateTokens(connection.id(), encryptedAccess, encryptedRefresh, grant.expiresAt());
    return grant.accessToken();
  }
}
