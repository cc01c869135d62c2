package mailqueue.model;

import java.time.Instant;

/**
 * Plaintext result of an OAuth refresh.
 *
 * @param refreshToken the rotated refresh token, or {@code null} when the server kept the old one
 */
public record TokenGrant(String accessToken, String refreshToken, Instant expiresAt) {
}
