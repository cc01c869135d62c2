package mailqueue.spi;

/**
 * Raised when an OAuth refresh fails. A message of {@link #REFRESH_TOKEN_REVOKED} means the user
 * has to reconnect the mailbox.
 */
public class TokenRefreshException extends RuntimeException {
    public static final String REFRESH_TOKEN_REVOKED = "REFRESH_TOKEN_REVOKED";

    public TokenRefreshException(String message) {
        super(message);
    }

    public TokenRefreshException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRevoked() {
        return REFRESH_TOKEN_REVOKED.equals(getMessage());
    }
}
