package com.scholary.oralhistory.api;

import com.scholary.oralhistory.alignment.AlignmentResult;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Request to caption an alignment supplied inline.
 *
 * @param durationMs length of the segment's video, used to bound interpolated timings
 */
public record CaptionRequest(
    @NotNull AlignmentResult alignment, @NotNull @Min(1) Integer durationMs) {}
