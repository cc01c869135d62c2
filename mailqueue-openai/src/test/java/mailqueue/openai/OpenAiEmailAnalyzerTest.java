package mailqueue.openai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import mailqueue.model.EmailAnalysis;
import mailqueue.model.MailAddress;
import mailqueue.model.MailMessage;
import mailqueue.model.SuggestedAction;
import mailqueue.spi.EmailAnalysisException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

class OpenAiEmailAnalyzerTest {
  private final ObjectMapper mapper = new ObjectMapper();
  private WireMockServer server;
  private OpenAiEmailAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
    server.start();
    analyzer = OpenAiEmailAnalyzer.builder()
        .apiKey("sk-test")
        .baseUrl(server.baseUrl() + "/v1")
        .httpClient(HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build())
        .build();
  }

  @AfterEach
  void tearDown() {
    server.stop();
  }

  private static MailMessage message(String body) {
    return new MailMessage("AAMk1", "conv-1", null, new MailAddress("Buyer", "buyer@example.com"),
        List.of(), List.of(), List.of(), "Viewing on Saturday?", "preview", "text", body, false, List.of(),
        Instant.parse("2024-03-01T09:00:00Z"), null, "normal", List.of(), false, false, "inbox");
  }

  private String completion(String content) throws Exception {
    ObjectNode root = mapper.createObjectNode();
    root.putArray("choices").addObject().putObject("message").put("role", "assistant").put("content", content);
    return mapper.writeValueAsString(root);
  }

  @Test
  void parsesModelClassification() throws Exception {
    String content = "{\"category\":\"viewing_request\",\"sentiment\":\"positive\",\"priority\":\"high\","
        + "\"summary\":\"Buyer wants a Saturday viewing.\","
        + "\"extractedEntities\":{\"dates\":[\"Saturday\"],\"names\":[]},"
        + "\"suggestedActions\":[{\"action\":\"schedule_viewing\",\"confidence\":0.92,\"details\":\"AM\"}],"
        + "\"classification\":\"sales\"}";
    server.stubFor(post(urlPathEqualTo("/v1/chat/completions")).willReturn(okJson(completion(content))));

    EmailAnalysis analysis = analyzer.analyze(message("Could we view on Saturday?"));

    assertEquals("viewing_request", analysis.category());
    assertEquals("positive", analysis.sentiment());
    assertEquals("high", analysis.priority());
    assertEquals(List.of("Saturday"), analysis.extractedEntities().get("dates"));
    assertEquals(List.of(new SuggestedAction("schedule_viewing", 0.92, "AM")), analysis.suggestedActions());
    server.verify(postRequestedFor(urlPathEqualTo("/v1/chat/completions"))
        .withHeader("Authorization", equalTo("Bearer sk-test"))
        .withRequestBody(matchingJsonPath("$.model", equalTo("gpt-4o-mini")))
        .withRequestBody(matchingJsonPath("$.response_format.type", equalTo("json_object")))
        .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("1000")))
        .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("system")))
        .withRequestBody(matchingJsonPath("$.messages[0].content", containing("viewing_request")))
        .withRequestBody(matchingJsonPath("$.messages[1].content", containing("From: buyer@example.com"))));
  }

  @Test
  void userPromptTruncatesLongBodies() {
    String body = "x".repeat(5000);

    String prompt = OpenAiEmailAnalyzer.userPrompt(message(body));

    assertTrue(prompt.startsWith("Analyze this email:\n\nFrom: buyer@example.com\nSubject: Viewing on Saturday?"));
    assertTrue(prompt.endsWith("Body:\n" + "x".repeat(OpenAiEmailAnalyzer.MAX_BODY_CHARS)));
  }

  @Test
  void userPromptFallsBackToPreview() {
    assertTrue(OpenAiEmailAnalyzer.userPrompt(message(null)).endsWith("Body:\npreview"));
  }

  @Test
  void emptyAnswerIsAnError() throws Exception {
    server.stubFor(post(urlPathEqualTo("/v1/chat/completions")).willReturn(okJson(completion(""))));

    EmailAnalysisException e = assertThrows(EmailAnalysisException.class, () -> analyzer.analyze(message("hi")));
    assertEquals("No response from AI", e.getMessage());
  }

  @Test
  void nonJsonAnswerIsAnError() throws Exception {
    server.stubFor(post(urlPathEqualTo("/v1/chat/completions"))
        .willReturn(okJson(completion("I think this is a viewing request."))));

    assertThrows(EmailAnalysisException.class, () -> analyzer.analyze(message("hi")));
  }

  @Test
  void httpErrorIsAnError() {
    server.stubFor(post(urlPathEqualTo("/v1/chat/completions")).willReturn(aResponse().withStatus(429)));

    EmailAnalysisException e = assertThrows(EmailAnalysisException.class, () -> analyzer.analyze(message("hi")));
    assertEquals("Completion API error (429)", e.getMessage());
  }

  @Test
  void apiKeyIsRequired() {
    assertThrows(NullPointerException.class, () -> OpenAiEmailAnalyzer.builder().build());
    assertThrows(IllegalArgumentException.class, () -> OpenAiEmailAnalyzer.builder().apiKey("").build());
  }
}
