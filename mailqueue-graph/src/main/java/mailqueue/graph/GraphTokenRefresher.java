package mailqueue.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import mailqueue.model.TokenGrant;
import mailqueue.spi.TokenRefreshException;
import mailqueue.spi.TokenRefresher;
import mailqueue.util.JacksonJsonCodec;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * {@link TokenRefresher} against the Microsoft identity platform v2.0 token endpoint.
 *
 * <p>A 400 or 401 answer means the refresh token is no longer usable and is reported as
 * {@link TokenRefreshException#REFRESH_TOKEN_REVOKED}. When the endpoint does not rotate the
 * refresh token the returned grant carries {@code null} and the caller keeps the old one.
 */
public final class GraphTokenRefresher implements TokenRefresher {
    private static final Logger logger = Logger.getLogger(GraphTokenRefresher.class.getName());

    public static final String DEFAULT_AUTHORITY_URL = "https://login.microsoftonline.com";
    static final String COMMON_TENANT = "common";

    public static final List<String> SCOPES = List.of(
            "offline_access", "User.Read", "Mail.Read", "Mail.ReadWrite", "Mail.Send", "MailboxSettings.Read");

    private final String clientId;
    private final String clientSecret;
    private final String authorityUrl;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Clock clock;

    private GraphTokenRefresher(Builder builder) {
        this.clientId = Objects.requireNonNull(builder.clientId, "clientId");
        this.clientSecret = Objects.requireNonNull(builder.clientSecret, "clientSecret");
        if (clientId.isEmpty()) {
            throw new IllegalArgumentException("clientId must not be empty");
        }
        String authority = builder.authorityUrl != null ? builder.authorityUrl : DEFAULT_AUTHORITY_URL;
        this.authorityUrl = authority.endsWith("/") ? authority.substring(0, authority.length() - 1) : authority;
        this.httpClient = builder.httpClient != null ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        this.mapper = builder.mapper != null ? builder.mapper : JacksonJsonCodec.defaultMapper();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public TokenGrant refresh(String refreshToken, String tenantId) {
        Objects.requireNonNull(refreshToken, "refreshToken");
        String tenant = tenantId == null || tenantId.isEmpty() ? COMMON_TENANT : tenantId;

        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", clientId);
        form.put("client_secret", clientSecret);
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        form.put("scope", String.join(" ", SCOPES));

        HttpRequest request = HttpRequest.newBuilder(
                        URI.create(authorityUrl + "/" + encode(tenant) + "/oauth2/v2.0/token"))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
                .build();

        Instant requestedAt = clock.instant();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TokenRefreshException("Token refresh failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TokenRefreshException("Token refresh interrupted", e);
        }

        int status = response.statusCode();
        if (status == 400 || status == 401) {
            logger.log(Level.WARNING, "Token refresh refused for tenant {0}: {1}",
                    new Object[]{tenant, response.body()});
            throw new TokenRefreshException(TokenRefreshException.REFRESH_TOKEN_REVOKED);
        }
        if (status < 200 || status >= 300) {
            logger.log(Level.WARNING, "Token refresh failed for tenant {0} with status {1}",
                    new Object[]{tenant, status});
            throw new TokenRefreshException("Token refresh failed: " + status);
        }

        JsonNode tokens;
        try {
            tokens = mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new TokenRefreshException("Unreadable token response", e);
        }
        JsonNode accessToken = tokens.path("access_token");
        if (!accessToken.isTextual() || accessToken.asText().isEmpty()) {
            throw new TokenRefreshException("Token response carries no access_token");
        }
        JsonNode newRefreshToken = tokens.path("refresh_token");
        long expiresIn = tokens.path("expires_in").asLong(3600L);
        return new TokenGrant(
                accessToken.asText(),
                newRefreshToken.isTextual() && !newRefreshToken.asText().isEmpty() ? newRefreshToken.asText() : null,
                requestedAt.plusSeconds(expiresIn));
    }

    private static String formEncode(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Builder for {@link GraphTokenRefresher}.
     */
    public static final class Builder {
        private String clientId;
        private String clientSecret;
        private String authorityUrl;
        private HttpClient httpClient;
        private ObjectMapper mapper;
        private Clock clock;

        private Builder() {
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder authorityUrl(String authorityUrl) {
            this.authorityUrl = authorityUrl;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public GraphTokenRefresher build() {
            return new GraphTokenRefresher(this);
        }
    }
}
