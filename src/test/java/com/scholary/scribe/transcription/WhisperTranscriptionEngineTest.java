package com.scholary.scribe.transcription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.scribe.PipelineFixtures;
import com.scholary.scribe.StubHttpServer;
import com.scholary.scribe.StubHttpServer.Response;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WhisperTranscriptionEngineTest {

  @TempDir Path tempDir;

  @Test
  void transcribe_shouldPostMultipartAndFormatSegments() throws Exception {
    Path audio = tempDir.resolve("Standup.mp3");
    Files.write(audio, new byte[] {7, 7, 7});
    String reply =
        "{\"language\":\"en\",\"text\":\"ignored\",\"segments\":["
            + "{\"start\":0.4,\"end\":3.0,\"text\":\" Hello team \"},"
            + "{\"start\":75.9,\"end\":80.0,\"text\":\"Next item\",\"words\":[]}]}";

    try (StubHttpServer server =
        new StubHttpServer("/api/v1/transcribe", (exchange, n) -> Response.json(200, reply))) {
      String transcript = engine(server.baseUrl(), 1).transcribe(audio, "en");

      assertThat(transcript).isEqualTo("[00:00] Hello team\n[01:15] Next item");
      StubHttpServer.Recorded request = server.requests().get(0);
      assertThat(request.method()).isEqualTo("POST");
      assertThat(request.header("Content-Type")).startsWith("multipart/form-data; boundary=");
      assertThat(request.bodyText())
          .contains("name=\"file\"; filename=\"Standup.mp3\"")
          .contains("name=\"language\"\r\n\r\nen\r\n");
    }
  }

  @Test
  void transcribe_shouldFailAfterRetriesAreExhausted() throws Exception {
    Path audio = tempDir.resolve("a.mp3");
    Files.write(audio, new byte[] {1});

    try (StubHttpServer server =
        new StubHttpServer("/api/v1/transcribe", (exchange, n) -> Response.json(503, "busy"))) {
      assertThatThrownBy(() -> engine(server.baseUrl(), 1).transcribe(audio, null))
          .isInstanceOf(TranscriptionException.class)
          .hasMessageContaining("after 1 attempts")
          .hasRootCauseMessage("Whisper API returned status 503: busy");
      assertThat(server.requests().get(0).bodyText()).doesNotContain("name=\"language\"");
    }
  }

  @Test
  void format_shouldFallBackToPlainText() {
    assertThat(WhisperTranscriptionEngine.format(new WhisperResponse(List.of(), " hi ", "en")))
        .isEqualTo("hi");
    assertThat(WhisperTranscriptionEngine.format(new WhisperResponse(null, null, null))).isEmpty();
  }

  @Test
  void format_shouldPadMinutesAndSeconds() {
    WhisperResponse response =
        new WhisperResponse(
            List.of(new TranscriptSegment(3725.0, 3730.0, "late")), null, "en");

    assertThat(WhisperTranscriptionEngine.format(response)).isEqualTo("[62:05] late");
  }

  private static WhisperTranscriptionEngine engine(String baseUrl, int maxRetries) {
    return new WhisperTranscriptionEngine(
        new WhisperProperties(baseUrl, 5, 5, maxRetries), PipelineFixtures.objectMapper());
  }
}
