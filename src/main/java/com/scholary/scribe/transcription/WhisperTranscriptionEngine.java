package com.scholary.scribe.transcription;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.scribe.logging.StructuredLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for a local faster-whisper transcription server.
 *
 * <p>Builds the multipart request by hand, retries transient failures with exponential backoff and
 * jitter, and flattens the returned segments into {@code [MM:SS] text} lines.
 */
public class WhisperTranscriptionEngine implements TranscriptionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperTranscriptionEngine.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperTranscriptionEngine(WhisperProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build(),
        properties,
        objectMapper);
  }

  WhisperTranscriptionEngine(
      HttpClient httpClient, WhisperProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;

    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String transcribe(Path audioFile, String language) {
    LOGGER.info("Transcribing: file={}, language={}", audioFile.getFileName(), language);

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return format(attemptTranscribe(audioFile, language));
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          STRUCTURED_LOGGER.logCallRetry(
              "whisper",
              attempt,
              properties.maxRetries(),
              backoffMs,
              e.getClass().getSimpleName(),
              e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TranscriptionException("Transcription interrupted", e);
      }
    }

    throw new TranscriptionException(
        String.format("Transcription failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private WhisperResponse attemptTranscribe(Path audioFile, String language)
      throws IOException, InterruptedException {
    String boundary = UUID.randomUUID().toString();
    BodyPublisher bodyPublisher = buildMultipartBody(audioFile, language, boundary);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(bodyPublisher)
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }

    WhisperResponse whisperResponse =
        objectMapper.readValue(response.body(), WhisperResponse.class);

    LOGGER.info(
        "Transcription successful: {} segments, language={}",
        whisperResponse.segments() == null ? 0 : whisperResponse.segments().size(),
        whisperResponse.language());

    return whisperResponse;
  }

  /**
   * Format segments as one {@code [MM:SS] text} line each. Falls back to the plain text when the
   * server returned no segments.
   */
  static String format(WhisperResponse response) {
    List<TranscriptSegment> segments = response.segments();
    if (segments == null || segments.isEmpty()) {
      return response.text() == null ? "" : response.text().strip();
    }
    StringBuilder sb = new StringBuilder();
    for (TranscriptSegment segment : segments) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      int start = (int) segment.start();
      sb.append(String.format("[%02d:%02d] ", start / 60, start % 60))
          .append(segment.text() == null ? "" : segment.text().strip());
    }
    return sb.toString();
  }

  /**
   * Build a multipart/form-data body with the audio file and an optional language part.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="recording.mp3"
   * Content-Type: application/octet-stream
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="language"
   *
   * en
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(Path audioFile, String language, String boundary)
      throws IOException {
    String filename = audioFile.getFileName().toString();
    byte[] fileBytes = Files.readAllBytes(audioFile);

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename.replace("\"", ""))
        .append("\"\r\n");
    sb.append("Content-Type: application/octet-stream\r\n\r\n");
    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    if (language != null && !language.isBlank()) {
      sb.append("--").append(boundary).append("\r\n");
      sb.append("Content-Disposition: form-data; name=\"language\"\r\n\r\n");
      sb.append(language).append("\r\n");
    }
    sb.append("--").append(boundary).append("--\r\n");
    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + fileBytes.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(fileBytes, 0, body, prefix.length, fileBytes.length);
    System.arraycopy(suffix, 0, body, prefix.length + fileBytes.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new TranscriptionException("Transcription interrupted", ie);
    }
  }
}
