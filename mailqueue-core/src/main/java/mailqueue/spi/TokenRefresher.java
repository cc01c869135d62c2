package mailqueue.spi;

import mailqueue.model.TokenGrant;

/**
 * Exchanges a refresh token for a new access token.
 *
 * @see mailqueue.graph.GraphTokenRefresher
 */
public interface TokenRefresher {

    /**
     * @param refreshToken plaintext refresh token
     * @param tenantId     directory tenant, {@code null} for the common endpoint
     * @throws TokenRefreshException when the provider refuses the refresh
     */
    TokenGrant refresh(String refreshToken, String tenantId);
}
