package com.scholary.scribe.api;

import com.scholary.scribe.job.HistoryEntry;
import com.scholary.scribe.service.PipelineOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Instant;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Processing history: one entry per completed or failed run. */
@RestController
@RequestMapping("/history")
@Validated
@Tag(name = "History", description = "Terminal outcomes of pipeline runs")
public class HistoryController {

  private final PipelineOrchestrator orchestrator;

  public HistoryController(PipelineOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping
  @Operation(summary = "Recent history", description = "Newest entries first")
  public List<HistoryEntry> recent(
      @RequestParam(defaultValue = "50") @Min(1) @Max(1000) int limit) {
    return orchestrator.history(limit);
  }

  @DeleteMapping
  @Operation(
      summary = "Purge history",
      description = "Delete entries older than 'before', or all entries when it is omitted")
  public PurgeResponse purge(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant before) {
    return new PurgeResponse(orchestrator.purgeHistory(before));
  }
}
