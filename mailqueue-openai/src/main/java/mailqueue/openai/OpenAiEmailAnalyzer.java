package mailqueue.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import mailqueue.model.EmailAnalysis;
import mailqueue.model.MailMessage;
import mailqueue.spi.EmailAnalysisException;
import mailqueue.spi.EmailAnalyzer;
import mailqueue.util.JacksonJsonCodec;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EmailAnalyzer} that asks an OpenAI chat-completions model for a JSON classification.
 *
 * <p>The request uses JSON mode, temperature {@value #TEMPERATURE} and at most
 * {@value #MAX_TOKENS} completion tokens. Only the first {@value #MAX_BODY_CHARS} characters
 * of the body are sent.
 */
public final class OpenAiEmailAnalyzer implements EmailAnalyzer {
    private static final Logger logger = Logger.getLogger(OpenAiEmailAnalyzer.class.getName());

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    static final double TEMPERATURE = 0.3;
    static final int MAX_TOKENS = 1000;
    static final int MAX_BODY_CHARS = 4000;
    private static final String SYSTEM_PROMPT_RESOURCE = "system-prompt.txt";

    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration requestTimeout;
    private final String systemPrompt;

    private OpenAiEmailAnalyzer(Builder builder) {
        this.apiKey = Objects.requireNonNull(builder.apiKey, "apiKey");
        if (apiKey.isEmpty()) {
            throw new IllegalArgumentException("apiKey must not be empty");
        }
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.httpClient = builder.httpClient != null ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        this.mapper = builder.mapper != null ? builder.mapper : JacksonJsonCodec.defaultMapper();
        this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : Duration.ofSeconds(60);
        this.systemPrompt = loadSystemPrompt();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public EmailAnalysis analyze(MailMessage message) {
        String body;
        try {
            body = mapper.writeValueAsString(completionRequest(message));
        } catch (JsonProcessingException e) {
            throw new EmailAnalysisException("Failed to encode completion request", e);
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/chat/completions"))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EmailAnalysisException("Completion request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmailAnalysisException("Completion request interrupted", e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new EmailAnalysisException("Completion API error (" + response.statusCode() + ")");
        }

        String content = completionContent(response.body());
        try {
            EmailAnalysis analysis = mapper.readValue(content, EmailAnalysis.class);
            logger.log(Level.FINE, "Message {0} classified as {1}", new Object[]{message.id(), analysis.category()});
            return analysis;
        } catch (JsonProcessingException e) {
            throw new EmailAnalysisException("Model answered with unusable JSON", e);
        }
    }

    ObjectNode completionRequest(MailMessage message) {
        ObjectNode root = mapper.createObjectNode();
        root.put("model", model);
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userPrompt(message));
        root.putObject("response_format").put("type", "json_object");
        root.put("temperature", TEMPERATURE);
        root.put("max_tokens", MAX_TOKENS);
        return root;
    }

    static String userPrompt(MailMessage message) {
        String content = message.bodyContent() != null ? message.bodyContent()
                : message.bodyPreview() != null ? message.bodyPreview() : "";
        if (content.length() > MAX_BODY_CHARS) {
            content = content.substring(0, MAX_BODY_CHARS);
        }
        String from = message.fromAddress() != null ? message.fromAddress() : "";
        String subject = message.subject() != null ? message.subject() : "";
        return "Analyze this email:\n\nFrom: " + from + "\nSubject: " + subject + "\n\nBody:\n" + content;
    }

    private String completionContent(String responseBody) {
        JsonNode content;
        try {
            content = mapper.readTree(responseBody).path("choices").path(0).path("message").path("content");
        } catch (JsonProcessingException e) {
            throw new EmailAnalysisException("Unreadable completion response", e);
        }
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new EmailAnalysisException("No response from AI");
        }
        return content.asText();
    }

    private static String loadSystemPrompt() {
        try (InputStream in = OpenAiEmailAnalyzer.class.getResourceAsStream(SYSTEM_PROMPT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + SYSTEM_PROMPT_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + SYSTEM_PROMPT_RESOURCE, e);
        }
    }

    /**
     * Builder for {@link OpenAiEmailAnalyzer}.
     */
    public static final class Builder {
        private String apiKey;
        private String baseUrl;
        private String model;
        private HttpClient httpClient;
        private ObjectMapper mapper;
        private Duration requestTimeout;

        private Builder() {
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
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

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public OpenAiEmailAnalyzer build() {
            return new OpenAiEmailAnalyzer(this);
        }
    }
}
