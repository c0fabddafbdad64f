package com.scholary.oralhistory.captions;

import java.util.List;

/**
 * The cues for one segment plus the validation counts taken after they were built.
 *
 * @param endOffset length of the transcript the cues were built from
 * @param endTimeMs length of the segment's media
 */
public record TextCaptions(
    List<CaptionCue> cues, CaptionValidationReport validation, int endOffset, int endTimeMs) {

  public TextCaptions {
    cues = List.copyOf(cues);
  }
}
