package com.scholary.oralhistory.job;

import com.scholary.oralhistory.api.CaptionResponse;
import com.scholary.oralhistory.api.JobStatusResponse.Status;
import com.scholary.oralhistory.api.StoredCaptionRequest;
import java.time.Instant;

/** An async captioning job: its request, state and, once done, result or error. */
public class CaptioningJob {

  private final String jobId;
  private final StoredCaptionRequest request;
  private final Instant createdAt;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile CaptionResponse result;
  private volatile String error;

  public CaptioningJob(String jobId, StoredCaptionRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public StoredCaptionRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public CaptionResponse getResult() {
    return result;
  }

  public void setResult(CaptionResponse result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
