package com.scholary.scribe;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.scribe.api.JobView;
import com.scholary.scribe.job.JobStatus;
import com.scholary.scribe.service.RecordingPoller;
import com.scholary.scribe.stage.StageExecutor;
import com.scholary.scribe.storage.FileSystemRemoteStorage;
import com.scholary.scribe.storage.RemoteStorage;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.ApplicationContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class ScribePipelineApplicationTest {

  @Autowired private ApplicationContext context;

  @Autowired private TestRestTemplate restTemplate;

  @Test
  void context_shouldWireAllStagesAndFileSystemStorage() {
    assertThat(context.getBeansOfType(StageExecutor.class)).hasSize(4);
    assertThat(context.getBean(RemoteStorage.class)).isInstanceOf(FileSystemRemoteStorage.class);
    assertThat(context.getBeanProvider(RecordingPoller.class).getIfAvailable()).isNull();
  }

  @Test
  void jobsApi_shouldRegisterAndReturnJob() {
    String id = "context-" + UUID.randomUUID();

    ResponseEntity<JobView> created =
        restTemplate.postForEntity(
            "/jobs", Map.of("id", id, "filename", "Standup.mp3"), JobView.class);
    ResponseEntity<JobView> fetched = restTemplate.getForEntity("/jobs/" + id, JobView.class);

    assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    assertThat(fetched.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(fetched.getBody().status()).isEqualTo(JobStatus.NEW);
    assertThat(fetched.getBody().busy()).isFalse();
  }

  @Test
  void jobsApi_shouldReturn404ForUnknownJob() {
    ResponseEntity<String> response =
        restTemplate.getForEntity("/jobs/" + UUID.randomUUID(), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }
}
