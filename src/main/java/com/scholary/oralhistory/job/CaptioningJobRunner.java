package com.scholary.oralhistory.job;

import com.scholary.oralhistory.api.CaptionResponse;
import com.scholary.oralhistory.api.JobStatusResponse.Status;
import com.scholary.oralhistory.logging.StructuredLogger;
import com.scholary.oralhistory.service.CaptioningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Runs captioning jobs on the task executor. The job's status is updated as processing
 * progresses.
 */
@Component
public class CaptioningJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptioningJobRunner.class);

  private final CaptioningService captioningService;
  private final JobRepository jobRepository;

  public CaptioningJobRunner(CaptioningService captioningService, JobRepository jobRepository) {
    this.captioningService = captioningService;
    this.jobRepository = jobRepository;
  }

  @Async
  public void run(CaptioningJob job) {
    StructuredLogger.setJobContext(
        job.getJobId(), job.getRequest().bucket(), job.getRequest().alignmentKey());
    LOGGER.info("Starting async processing for job: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      job.setProgress(10);
      jobRepository.save(job);

      CaptionResponse result = captioningService.captionStoredAlignment(job.getRequest());

      job.setStatus(Status.COMPLETED);
      job.setProgress(100);
      job.setResult(result);
      jobRepository.save(job);

      LOGGER.info("Completed async processing for job: {}", job.getJobId());

    } catch (Exception e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }
}
