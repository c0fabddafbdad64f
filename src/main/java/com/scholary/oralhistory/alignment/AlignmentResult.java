package com.scholary.oralhistory.alignment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Forced-aligner output for one segment: the transcript it aligned and its words in order. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlignmentResult(String transcript, List<AlignedWord> words) {

  public AlignmentResult {
    if (transcript == null) {
      transcript = "";
    }
    words = words == null ? List.of() : List.copyOf(words);
  }
}
