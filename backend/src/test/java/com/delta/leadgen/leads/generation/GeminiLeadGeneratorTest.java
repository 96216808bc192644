package com.delta.leadgen.leads.generation;

import com.delta.leadgen.config.LeadGenConfig;
import com.delta.leadgen.config.LeadGeneratorProperties;
import com.delta.leadgen.leads.model.LeadBatch;
import com.delta.leadgen.leads.model.LeadRequest;
import com.delta.leadgen.leads.retry.BackoffClassifier;
import com.delta.leadgen.leads.retry.ExternalServiceException;
import com.delta.leadgen.leads.retry.FailureClass;
import com.delta.leadgen.leads.retry.RateLimitedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeminiLeadGeneratorTest {

    private static final LeadRequest REQUEST = new LeadRequest("robotics", 3, "Germany", false);

    private final ObjectMapper objectMapper = new LeadGenConfig().objectMapper();
    private final ExecutorService httpExecutor = Executors.newFixedThreadPool(2);
    private MockWebServer server;
    private LeadGeneratorProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        properties = new LeadGeneratorProperties();
        properties.getGemini().setBaseUrl(server.url("/v1/").toString());
        properties.getGemini().setApiKey("test-key");
        properties.getGemini().setModel("gemini-test");
        properties.getGemini().setTimeoutSeconds(5);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        httpExecutor.shutdownNow();
    }

    @Test
    void parsesFencedCompaniesFromChatCompletion() throws Exception {
        String content = "Here you go:\n```json\n"
            + "{\"companies\":["
            + "{\"company_name\":\"Kuka\",\"website_url\":\"https://kuka.com\",\"notable_customers\":[\"BMW\"],"
            + "\"social_media\":{\"linkedin\":\"https://linkedin.com/company/kuka\"}},"
            + "{\"company_name\":\"Festo\",\"website_url\":\"https://festo.com\",\"unexpected_field\":1}"
            + "]}\n```";
        server.enqueue(jsonResponse(200, chatCompletion(content)));

        LeadBatch batch = generator().generate(REQUEST);

        assertThat(batch.size()).isEqualTo(2);
        assertThat(batch.companies().get(0).companyName()).isEqualTo("Kuka");
        assertThat(batch.companies().get(0).notableCustomers()).containsExactly("BMW");
        assertThat(batch.companies().get(0).socialMedia().linkedin()).isEqualTo("https://linkedin.com/company/kuka");
        assertThat(batch.companies().get(1).websiteUrl()).isEqualTo("https://festo.com");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer test-key");
        String body = recorded.getBody().readUtf8();
        assertThat(body).contains("\"model\":\"gemini-test\"").contains("robotics").contains("Germany");
    }

    @Test
    void serviceUnavailableCarriesStatusCode() {
        server.enqueue(jsonResponse(503, "{\"error\":{\"message\":\"The model is overloaded. Please try again later.\"}}"));

        assertThatThrownBy(() -> generator().generate(REQUEST))
            .isInstanceOfSatisfying(ExternalServiceException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(503);
                assertThat(e.getMessage()).contains("HTTP 503").contains("overloaded");
                assertThat(BackoffClassifier.classify(e)).isEqualTo(FailureClass.RETRYABLE_OVERLOAD);
            });
    }

    @Test
    void tooManyRequestsIsRateLimited() {
        server.enqueue(jsonResponse(429, "[{\"error\":{\"message\":\"Resource has been exhausted\"}}]"));

        assertThatThrownBy(() -> generator().generate(REQUEST))
            .isInstanceOfSatisfying(RateLimitedException.class, e ->
                assertThat(BackoffClassifier.classify(e)).isEqualTo(FailureClass.RETRYABLE_RATE_LIMIT));
    }

    @Test
    void droppedConnectionIsRetryable() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AFTER_REQUEST));

        assertThatThrownBy(() -> generator().generate(REQUEST))
            .isInstanceOfSatisfying(IOException.class, e ->
                assertThat(BackoffClassifier.classify(e)).isEqualTo(FailureClass.RETRYABLE_CONNECTION));
    }

    @Test
    void clientErrorIsPermanent() {
        server.enqueue(jsonResponse(401, "{\"error\":{\"message\":\"API key not valid\"}}"));

        assertThatThrownBy(() -> generator().generate(REQUEST))
            .isInstanceOfSatisfying(ExternalServiceException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(401);
                assertThat(BackoffClassifier.classify(e)).isEqualTo(FailureClass.PERMANENT);
            });
    }

    @Test
    void unparseableContentIsPermanentEvenWhenItMentionsTransientWords() {
        server.enqueue(jsonResponse(200, chatCompletion("Sorry, a network timeout left me overloaded {not json")));

        assertThatThrownBy(() -> generator().generate(REQUEST))
            .isInstanceOfSatisfying(GenerationParseException.class, e -> {
                assertThat(e.getMessage()).doesNotContain("overloaded").doesNotContain("timeout");
                assertThat(BackoffClassifier.classify(e)).isEqualTo(FailureClass.PERMANENT);
            });
    }

    @Test
    void missingCompaniesArrayIsRejected() {
        server.enqueue(jsonResponse(200, chatCompletion("{\"leads\":[]}")));

        assertThatThrownBy(() -> generator().generate(REQUEST))
            .isInstanceOf(GenerationParseException.class)
            .hasMessageContaining("companies");
    }

    @Test
    void unconfiguredGeneratorMakesNoRequest() {
        properties.getGemini().setApiKey("");

        assertThat(generator().isConfigured()).isFalse();
        assertThatThrownBy(() -> generator().generate(REQUEST)).isInstanceOf(GeneratorNotConfiguredException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void stripsPlainFencesAndLeavesBareJsonAlone() {
        assertThat(GeminiLeadGenerator.stripCodeFences("```\n{\"companies\":[]}\n```")).isEqualTo("{\"companies\":[]}");
        assertThat(GeminiLeadGenerator.stripCodeFences("  {\"companies\":[]} ")).isEqualTo("{\"companies\":[]}");
    }

    private GeminiLeadGenerator generator() {
        return new GeminiLeadGenerator(properties, objectMapper, httpExecutor);
    }

    private String chatCompletion(String content) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode message = root.putArray("choices").addObject().putObject("message");
        message.put("role", "assistant");
        message.put("content", content);
        return root.toString();
    }

    private static MockResponse jsonResponse(int status, String body) {
        return new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }
}
