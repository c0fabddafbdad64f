package com.scholary.oralhistory.api;

import com.scholary.oralhistory.job.CaptioningJob;
import com.scholary.oralhistory.job.CaptioningJobRunner;
import com.scholary.oralhistory.job.JobRepository;
import com.scholary.oralhistory.service.CaptioningException;
import com.scholary.oralhistory.service.CaptioningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for caption generation.
 *
 * <ul>
 *   <li>Synchronous captioning of an alignment sent in the request
 *   <li>Asynchronous captioning of a stored alignment (returns job ID immediately)
 *   <li>Job status polling
 * </ul>
 */
@RestController
@Tag(name = "Captions", description = "Caption generation from forced alignments")
public class CaptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionController.class);

  private final CaptioningService captioningService;
  private final CaptioningJobRunner jobRunner;
  private final JobRepository jobRepository;

  public CaptionController(
      CaptioningService captioningService,
      CaptioningJobRunner jobRunner,
      JobRepository jobRepository) {
    this.captioningService = captioningService;
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
  }

  @PostMapping("/api/captions")
  @Operation(
      summary = "Caption an alignment",
      description = "Format the alignment, build caption cues and return them with VTT output")
  public ResponseEntity<CaptionResponse> caption(@Valid @RequestBody CaptionRequest request) {
    LOGGER.info(
        "Caption request: words={}, durationMs={}",
        request.alignment().words().size(),
        request.durationMs());
    return ResponseEntity.ok(
        captioningService.caption(request.alignment(), request.durationMs()));
  }

  @PostMapping("/api/captions/jobs")
  @Operation(
      summary = "Start captioning job",
      description = "Caption a stored alignment asynchronously and return a job ID for polling")
  public ResponseEntity<AsyncJobResponse> startJob(
      @Valid @RequestBody StoredCaptionRequest request) {
    String jobId = UUID.randomUUID().toString();
    LOGGER.info(
        "Captioning job request: bucket={}, key={}", request.bucket(), request.alignmentKey());

    CaptioningJob job = new CaptioningJob(jobId, request);
    jobRepository.save(job);
    LOGGER.info("Created async captioning job: {}", jobId);

    jobRunner.run(job);
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  /**
   * Get job status.
   *
   * <p>If the job is completed, includes the full caption result.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a captioning job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getProgress(),
                        job.getResult(),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }

  @ExceptionHandler(CaptioningException.class)
  public ResponseEntity<ErrorResponse> handleCaptioningFailure(CaptioningException e) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(new ErrorResponse(e.getMessage()));
  }
}
