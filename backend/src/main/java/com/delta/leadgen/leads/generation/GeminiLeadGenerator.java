package com.delta.leadgen.leads.generation;

import com.delta.leadgen.config.LeadGeneratorProperties;
import com.delta.leadgen.leads.model.CompanyLead;
import com.delta.leadgen.leads.model.LeadBatch;
import com.delta.leadgen.leads.model.LeadRequest;
import com.delta.leadgen.leads.retry.ExternalServiceException;
import com.delta.leadgen.leads.retry.RateLimitedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Calls an OpenAI-compatible chat completions endpoint (Gemini by default) and reads the reply as a
 * {@link LeadBatch}.
 */
@Service
public class GeminiLeadGenerator implements LeadGenerator {
    private static final Logger log = LoggerFactory.getLogger(GeminiLeadGenerator.class);
    private static final int MAX_ERROR_DETAIL = 300;
    private static final TypeReference<List<CompanyLead>> COMPANY_LIST = new TypeReference<>() {};

    private final LeadGeneratorProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public GeminiLeadGenerator(
        LeadGeneratorProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public boolean isConfigured() {
        return properties.getGemini().isConfigured();
    }

    @Override
    public LeadBatch generate(LeadRequest request) throws IOException, InterruptedException {
        if (!isConfigured()) {
            throw new GeneratorNotConfiguredException("Generation API key is not configured (set GEMINI_API_KEY)");
        }
        LeadGeneratorProperties.Gemini gemini = properties.getGemini();
        HttpRequest httpRequest = HttpRequest.newBuilder(completionsUri(gemini.getBaseUrl()))
            .timeout(Duration.ofSeconds(gemini.getTimeoutSeconds()))
            .header("Authorization", "Bearer " + gemini.getApiKey())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header("User-Agent", properties.getUserAgent())
            .POST(HttpRequest.BodyPublishers.ofString(requestBody(gemini.getModel(), request), StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response = client.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        int status = response.statusCode();
        if (status == 429) {
            throw new RateLimitedException(errorMessage(status, response.body()));
        }
        if (status < 200 || status >= 300) {
            throw new ExternalServiceException(errorMessage(status, response.body()), status);
        }
        LeadBatch batch = parseBatch(stripCodeFences(messageContent(response.body())));
        log.info(
            "Generated {} companies for industry={} country={} (requested {})",
            batch.size(),
            request.industry(),
            request.country(),
            request.count()
        );
        return batch;
    }

    private String requestBody(String model, LeadRequest request) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        ArrayNode messages = root.putArray("messages");
        ObjectNode message = messages.addObject();
        message.put("role", "user");
        message.put("content", LeadPromptBuilder.build(request));
        return objectMapper.writeValueAsString(root);
    }

    private String messageContent(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new GenerationParseException("Generation response was not valid JSON");
        }
        JsonNode content = root == null ? null : root.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual() || content.asText().isBlank()) {
            throw new GenerationParseException("Generation response had no message content");
        }
        return content.asText();
    }

    static String stripCodeFences(String text) {
        String candidate = text.trim();
        int jsonFence = candidate.indexOf("```json");
        if (jsonFence >= 0) {
            return between(candidate, jsonFence + "```json".length());
        }
        int fence = candidate.indexOf("```");
        if (fence >= 0) {
            return between(candidate, fence + 3);
        }
        return candidate;
    }

    private static String between(String text, int start) {
        int end = text.indexOf("```", start);
        return (end < 0 ? text.substring(start) : text.substring(start, end)).trim();
    }

    // Parser messages quote the offending input, which could mislead the retry classifier. Only the position is kept.
    private LeadBatch parseBatch(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable generation output: {}", e.getOriginalMessage());
            String location = e.getLocation() == null
                ? ""
                : " at line " + e.getLocation().getLineNr() + ", column " + e.getLocation().getColumnNr();
            throw new GenerationParseException("Failed to parse generation output as JSON" + location);
        }
        JsonNode companies = root == null ? null : root.get("companies");
        if (companies == null || !companies.isArray()) {
            throw new GenerationParseException("Generation output did not contain a companies array");
        }
        try {
            return new LeadBatch(objectMapper.convertValue(companies, COMPANY_LIST));
        } catch (IllegalArgumentException e) {
            log.warn("Company records did not match the expected shape: {}", e.getMessage());
            throw new GenerationParseException("Generation output contained malformed company records");
        }
    }

    private String errorMessage(int status, String body) {
        String detail = extractErrorDetail(body);
        return "Generation service returned HTTP " + status + (detail.isEmpty() ? "" : ": " + detail);
    }

    private String extractErrorDetail(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String detail = body.trim();
        try {
            JsonNode root = objectMapper.readTree(detail);
            JsonNode error = root.isArray() ? root.path(0).path("error") : root.path("error");
            if (error.path("message").isTextual()) {
                detail = error.path("message").asText();
            } else if (error.isTextual()) {
                detail = error.asText();
            }
        } catch (JsonProcessingException ignored) {
            // Plain-text error bodies are used as-is.
        }
        return detail.length() > MAX_ERROR_DETAIL ? detail.substring(0, MAX_ERROR_DETAIL) : detail;
    }

    private URI completionsUri(String baseUrl) {
        String base = baseUrl == null || baseUrl.isBlank()
            ? "https://generativelanguage.googleapis.com/v1beta/openai/"
            : baseUrl.trim();
        if (!base.endsWith("/")) {
            base = base + "/";
        }
        return URI.create(base + "chat/completions");
    }
}
