package com.scholary.scribe.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.scribe.PipelineFixtures;
import com.scholary.scribe.StubHttpServer;
import com.scholary.scribe.StubHttpServer.Response;
import java.io.InputStream;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class PlaudRecordingSourceTest {

  private static final String LISTING =
      "{\"status\":0,\"data_file_total\":3,\"data_file_list\":["
          + "{\"id\":\"r1\",\"filename\":\"Standup\",\"start_time\":1736500000000,"
          + "\"duration\":60000},"
          + "{\"id\":\"r2\",\"filename\":\"1:1 with Ann\"}]}";

  @Test
  void listRecordings_shouldParsePageAndSendToken() throws Exception {
    try (StubHttpServer server =
        new StubHttpServer("/", (exchange, n) -> Response.json(200, LISTING))) {
      PlaudRecordingSource source = source(server.baseUrl(), "tok");

      RecordingPage page = source.listRecordings(0);

      assertThat(page.items())
          .containsExactly(
              new RecordingSummary("r1", "Standup", Instant.ofEpochMilli(1736500000000L), 60000),
              new RecordingSummary("r2", "1:1 with Ann", null, 0));
      assertThat(page.nextPage()).isEqualTo(1);
      StubHttpServer.Recorded request = server.requests().get(0);
      assertThat(request.uri()).startsWith("/file/simple/web?skip=0&limit=2&is_trash=0");
      assertThat(request.header("Authorization")).isEqualTo("bearer tok");
    }
  }

  @Test
  void listRecordings_shouldStopAtTotal() throws Exception {
    try (StubHttpServer server =
        new StubHttpServer("/", (exchange, n) -> Response.json(200, LISTING))) {
      RecordingPage page = source(server.baseUrl(), "tok").listRecordings(1);

      assertThat(page.hasNext()).isFalse();
      assertThat(server.requests().get(0).uri()).contains("skip=2&limit=2");
    }
  }

  @Test
  void listRecordings_shouldFollowRegionRedirectOnce() throws Exception {
    try (StubHttpServer regional =
            new StubHttpServer("/", (exchange, n) -> Response.json(200, LISTING));
        StubHttpServer global =
            new StubHttpServer(
                "/",
                (exchange, n) ->
                    Response.json(
                        200,
                        "{\"status\":-302,\"msg\":\"region mismatch\",\"data\":{\"domains\":"
                            + "{\"api\":\"" + regional.baseUrl() + "\"}}}"))) {
      PlaudRecordingSource source = source(global.baseUrl(), "tok");

      assertThat(source.listRecordings(0).items()).hasSize(2);
      source.listRecordings(0);

      assertThat(global.requests()).hasSize(1);
      assertThat(regional.requests()).hasSize(2);
    }
  }

  @Test
  void listRecordings_shouldReportRejectedToken() throws Exception {
    try (StubHttpServer server =
        new StubHttpServer("/", (exchange, n) -> Response.json(401, "{}"))) {
      assertThatThrownBy(() -> source(server.baseUrl(), "bad").listRecordings(0))
          .isInstanceOf(SourceUnavailableException.class)
          .hasMessageContaining("401");
    }
  }

  @Test
  void listRecordings_shouldReportApiError() throws Exception {
    try (StubHttpServer server =
        new StubHttpServer(
            "/", (exchange, n) -> Response.json(200, "{\"status\":-1,\"msg\":\"expired\"}"))) {
      assertThatThrownBy(() -> source(server.baseUrl(), "tok").listRecordings(0))
          .isInstanceOf(SourceUnavailableException.class)
          .hasMessageContaining("expired");
    }
  }

  @Test
  void openDownload_shouldStreamAudio() throws Exception {
    byte[] audio = {1, 2, 3, 4, 5};
    try (StubHttpServer server =
        new StubHttpServer("/file/download", (exchange, n) -> new Response(200, audio))) {
      try (InputStream in = source(server.baseUrl(), "tok").openDownload("r1")) {
        assertThat(in.readAllBytes()).isEqualTo(audio);
      }
      assertThat(server.requests().get(0).uri()).isEqualTo("/file/download/r1");
    }
  }

  @Test
  void openDownload_shouldFailOnMissingRecording() throws Exception {
    try (StubHttpServer server =
        new StubHttpServer("/file/download", (exchange, n) -> Response.json(404, "{}"))) {
      assertThatThrownBy(() -> source(server.baseUrl(), "tok").openDownload("gone"))
          .isInstanceOf(SourceUnavailableException.class)
          .hasMessageContaining("404");
    }
  }

  @Test
  void bearer_shouldNormalizePrefix() {
    assertThat(PlaudRecordingSource.bearer("abc")).isEqualTo("bearer abc");
    assertThat(PlaudRecordingSource.bearer("Bearer abc")).isEqualTo("Bearer abc");
    assertThat(PlaudRecordingSource.bearer(" ")).isNull();
  }

  private static PlaudRecordingSource source(String baseUrl, String token) {
    return new PlaudRecordingSource(
        new SourceProperties(baseUrl + "/", token, 2, 5, 5), PipelineFixtures.objectMapper());
  }
}
