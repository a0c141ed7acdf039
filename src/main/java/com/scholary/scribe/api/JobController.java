package com.scholary.scribe.api;

import com.scholary.scribe.job.ArtifactKind;
import com.scholary.scribe.job.JobNotFoundException;
import com.scholary.scribe.job.RecordingJob;
import com.scholary.scribe.service.PipelineOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API behind the dashboard.
 *
 * <p>Processing requests are accepted and run in the background; poll {@code GET /jobs/{id}} for
 * progress. A request for a recording that is already being worked on is refused with 409.
 */
@RestController
@RequestMapping("/jobs")
@Tag(name = "Jobs", description = "Recording pipeline jobs")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final PipelineOrchestrator orchestrator;

  public JobController(PipelineOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping
  @Operation(summary = "List jobs", description = "All known recordings, oldest first")
  public List<JobView> list() {
    return orchestrator.list().stream().map(this::view).toList();
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get job", description = "Current status and artifacts of one recording")
  public JobView get(@PathVariable String id) {
    return view(orchestrator.find(id).orElseThrow(() -> new JobNotFoundException(id)));
  }

  @PostMapping
  @Operation(summary = "Register job", description = "Start tracking a recording in NEW")
  public ResponseEntity<JobView> register(@Valid @RequestBody RegisterJobRequest request) {
    RecordingJob job = orchestrator.register(request.id(), request.filename());
    return ResponseEntity.status(HttpStatus.CREATED).body(view(job));
  }

  @PostMapping("/{id}/process")
  @Operation(
      summary = "Process now",
      description = "Run the remaining stages in the background until the job completes or fails")
  public ResponseEntity<JobView> process(@PathVariable String id) {
    orchestrator
        .process(id)
        .whenComplete(
            (job, error) -> {
              if (error != null) {
                LOGGER.error("Processing of {} ended with an error", id, error);
              }
            });
    return ResponseEntity.accepted().body(get(id));
  }

  @PostMapping("/{id}/reprocess")
  @Operation(
      summary = "Reprocess",
      description =
          "Reset the job to the furthest point its valid artifacts allow and process it again")
  public ResponseEntity<JobView> reprocess(@PathVariable String id) {
    orchestrator
        .submitReprocess(id)
        .whenComplete(
            (job, error) -> {
              if (error != null) {
                LOGGER.error("Reprocessing of {} ended with an error", id, error);
              }
            });
    return ResponseEntity.accepted().body(get(id));
  }

  @DeleteMapping("/{id}/artifacts")
  @Operation(
      summary = "Delete artifacts",
      description = "Delete local artifacts and step the job back to what the rest supports")
  public JobView deleteArtifacts(
      @PathVariable String id, @RequestParam("kinds") List<ArtifactKind> kinds) {
    return view(orchestrator.deleteArtifacts(id, kinds));
  }

  private JobView view(RecordingJob job) {
    return JobView.of(job, orchestrator.isBusy(job.getId()));
  }
}
