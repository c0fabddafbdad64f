package com.scholary.oralhistory.captions;

/** Counts of cues and lines outside the configured caption bounds. */
public record CaptionValidationReport(
    int cueCount,
    int tooShort,
    int tooLong,
    int tooFewLines,
    int tooManyLines,
    int emptyLines,
    int overlongLines) {

  public boolean isClean() {
    return tooShort + tooLong + tooFewLines + tooManyLines + emptyLines + overlongLines == 0;
  }
}
