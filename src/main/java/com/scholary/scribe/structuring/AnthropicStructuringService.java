package com.scholary.scribe.structuring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.scribe.logging.StructuredLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structuring service backed by the Anthropic messages API.
 *
 * <p>Sends one user message holding the instructions and the transcript and returns the text
 * blocks of the reply. Rate limiting (429), overload and 5xx responses and I/O errors are retried
 * with exponential backoff; any other error status fails immediately.
 */
public class AnthropicStructuringService implements StructuringService {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnthropicStructuringService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String API_VERSION = "2023-06-01";

  private final HttpClient httpClient;
  private final StructuringProperties properties;
  private final ObjectMapper objectMapper;

  public AnthropicStructuringService(StructuringProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build(),
        properties,
        objectMapper);
  }

  AnthropicStructuringService(
      HttpClient httpClient, StructuringProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;

    LOGGER.info(
        "Initialized structuring client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  @Override
  public String structure(String text, String template) {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new StructuringUnavailableException("Structuring API key not configured", 401);
    }

    String body = requestBody(template, text);
    StructuringUnavailableException lastFailure = null;

    for (int attempt = 1; attempt <= properties.maxRetries(); attempt++) {
      try {
        return attemptStructure(body);
      } catch (StructuringUnavailableException e) {
        if (!isRetryable(e.getStatusCode())) {
          throw e;
        }
        lastFailure = e;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          STRUCTURED_LOGGER.logCallRetry(
              "structuring",
              attempt,
              properties.maxRetries(),
              backoffMs,
              String.valueOf(e.getStatusCode()),
              e.getMessage());
          sleep(backoffMs);
        }
      }
    }

    throw new StructuringUnavailableException(
        String.format("Structuring failed after %d attempts", properties.maxRetries()),
        lastFailure);
  }

  private String attemptStructure(String body) {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v1/messages"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("x-api-key", properties.apiKey())
            .header("anthropic-version", API_VERSION)
            .header("content-type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new StructuringUnavailableException("Cannot reach structuring service", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StructuringUnavailableException("Structuring request interrupted", 0);
    }

    if (response.statusCode() != 200) {
      throw new StructuringUnavailableException(
          String.format(
              "Structuring service returned status %d: %s",
              response.statusCode(), response.body()),
          response.statusCode());
    }
    return extractText(response.body());
  }

  private String requestBody(String instructions, String transcript) {
    ObjectNode root = objectMapper.createObjectNode();
    root.put("model", properties.model());
    root.put("max_tokens", properties.maxTokens());
    ObjectNode message = root.putArray("messages").addObject();
    message.put("role", "user");
    message.put("content", instructions + "\n\nTranscript:\n" + transcript);
    try {
      return objectMapper.writeValueAsString(root);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot serialize structuring request", e);
    }
  }

  private String extractText(String responseBody) {
    JsonNode root;
    try {
      root = objectMapper.readTree(responseBody);
    } catch (IOException e) {
      throw new StructuringUnavailableException("Unreadable structuring response", e);
    }

    StringBuilder text = new StringBuilder();
    for (JsonNode block : root.path("content")) {
      if ("text".equals(block.path("type").asText())) {
        text.append(block.path("text").asText());
      }
    }
    LOGGER.info(
        "Structuring complete: stopReason={}, {} chars",
        root.path("stop_reason").asText(),
        text.length());
    return text.toString();
  }

  /** I/O failures (-1), rate limiting, overload and server errors are worth another attempt. */
  static boolean isRetryable(int statusCode) {
    return statusCode == -1 || statusCode == 429 || statusCode >= 500;
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new StructuringUnavailableException("Structuring request interrupted", ie);
    }
  }
}
