package com.scholary.oralhistory.alignment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One word as reported by the forced aligner.
 *
 * <p>Times are in seconds and are absent for words the aligner could not place. Offsets index into
 * the full transcript.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AlignedWord(
    String word,
    @JsonProperty("case") String alignmentCase,
    Double start,
    Double end,
    int startOffset,
    int endOffset) {

  public static final String SUCCESS = "success";

  public boolean isAligned() {
    return SUCCESS.equals(alignmentCase);
  }

  public static AlignedWord aligned(String word, double start, double end, int startOffset) {
    return new AlignedWord(word, SUCCESS, start, end, startOffset, startOffset + word.length());
  }

  public static AlignedWord unaligned(String word, int startOffset) {
    return new AlignedWord(
        word, "not-found-in-audio", null, null, startOffset, startOffset + word.length());
  }
}
