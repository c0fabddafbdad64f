package com.scholary.oralhistory.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request to caption an alignment JSON held in object storage.
 *
 * <p>Captioning jobs are asynchronous - a job ID is returned immediately and the client polls
 * /api/jobs/{id} for the result.
 */
public record StoredCaptionRequest(
    @NotBlank String bucket,
    @NotBlank String alignmentKey,
    @NotNull @Min(1) Integer durationMs,
    Boolean save) {

  public StoredCaptionRequest {
    if (save == null) {
      save = true;
    }
  }
}
