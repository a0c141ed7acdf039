package com.scholary.scribe.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the Plaud consumer API.
 *
 * <p>Regional endpoints may answer with {@code status: -302} and a {@code data.domains.api} field
 * naming the domain that holds the account. The client switches its base URL once and repeats the
 * request.
 */
public class PlaudRecordingSource implements RecordingSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlaudRecordingSource.class);

  static final int REGION_REDIRECT_STATUS = -302;

  private final HttpClient httpClient;
  private final SourceProperties properties;
  private final ObjectMapper objectMapper;
  private final String authorization;

  private volatile String baseUrl;

  public PlaudRecordingSource(SourceProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        properties,
        objectMapper);
  }

  PlaudRecordingSource(
      HttpClient httpClient, SourceProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.baseUrl = stripTrailingSlash(properties.baseUrl());
    this.authorization = bearer(properties.token());

    LOGGER.info("Initialized recording source client: baseUrl={}", baseUrl);
  }

  @Override
  public RecordingPage listRecordings(int page) {
    int limit = properties.pageSize();
    String query =
        String.format(
            "skip=%d&limit=%d&is_trash=0&sort_by=%s&is_desc=true",
            (long) page * limit, limit, URLEncoder.encode("edit_time", StandardCharsets.UTF_8));

    JsonNode body = getJson("/file/simple/web?" + query);
    if (followRegionRedirect(body)) {
      body = getJson("/file/simple/web?" + query);
    }
    if (body.path("status").asInt(0) != 0) {
      throw new SourceUnavailableException(
          "Recording source error: " + body.path("msg").asText("unknown"));
    }

    List<RecordingSummary> items = new ArrayList<>();
    for (JsonNode node : body.path("data_file_list")) {
      items.add(toSummary(node));
    }

    long total = body.path("data_file_total").asLong(-1);
    boolean more =
        total >= 0 ? (long) page * limit + items.size() < total : items.size() == limit;
    LOGGER.debug("Listed page {}: {} recordings, more={}", page, items.size(), more);
    return new RecordingPage(items, more && !items.isEmpty() ? page + 1 : null);
  }

  @Override
  public InputStream openDownload(String recordingId) {
    String path = "/file/download/" + URLEncoder.encode(recordingId, StandardCharsets.UTF_8);
    LOGGER.info("Downloading recording {}", recordingId);
    try {
      HttpResponse<InputStream> response =
          httpClient.send(request(path), HttpResponse.BodyHandlers.ofInputStream());
      if (response.statusCode() != 200) {
        response.body().close();
        throw new SourceUnavailableException(
            String.format(
                "Download of %s failed with status %d", recordingId, response.statusCode()));
      }
      return response.body();
    } catch (IOException e) {
      throw new SourceUnavailableException("Cannot download recording " + recordingId, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SourceUnavailableException("Download interrupted: " + recordingId, e);
    }
  }

  private JsonNode getJson(String path) {
    try {
      HttpResponse<String> response =
          httpClient.send(request(path), HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() == 401 || response.statusCode() == 403) {
        throw new SourceUnavailableException(
            String.format("Token rejected by recording source (%d)", response.statusCode()));
      }
      if (response.statusCode() != 200) {
        throw new SourceUnavailableException(
            String.format(
                "Recording source returned status %d: %s",
                response.statusCode(), response.body()));
      }
      return objectMapper.readTree(response.body());
    } catch (IOException e) {
      throw new SourceUnavailableException("Cannot reach recording source at " + baseUrl, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SourceUnavailableException("Recording source request interrupted", e);
    }
  }

  private boolean followRegionRedirect(JsonNode body) {
    if (body.path("status").asInt(0) != REGION_REDIRECT_STATUS) {
      return false;
    }
    String domain = body.path("data").path("domains").path("api").asText("");
    if (domain.isBlank()) {
      return false;
    }
    String previous = baseUrl;
    baseUrl = stripTrailingSlash(domain.startsWith("http") ? domain : "https://" + domain);
    LOGGER.info("Recording source region redirect: {} -> {}", previous, baseUrl);
    return true;
  }

  private HttpRequest request(String path) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .GET();
    if (authorization != null) {
      builder.header("Authorization", authorization);
    }
    return builder.build();
  }

  private RecordingSummary toSummary(JsonNode node) {
    String id = node.path("id").asText();
    String filename = node.path("filename").asText(id);
    long startMillis = node.path("start_time").asLong(0);
    Instant startTime = startMillis > 0 ? Instant.ofEpochMilli(startMillis) : null;
    return new RecordingSummary(id, filename, startTime, node.path("duration").asLong(0));
  }

  static String bearer(String token) {
    if (token == null || token.isBlank()) {
      return null;
    }
    String trimmed = token.strip();
    return trimmed.toLowerCase(Locale.ROOT).startsWith("bearer ") ? trimmed : "bearer " + trimmed;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
