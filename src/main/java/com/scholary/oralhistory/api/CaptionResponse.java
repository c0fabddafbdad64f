package com.scholary.oralhistory.api;

import com.scholary.oralhistory.captions.CaptionCue;
import com.scholary.oralhistory.captions.CaptionValidationReport;
import com.scholary.oralhistory.captions.TimingSyncPair;
import java.util.List;

/**
 * Captions for one segment, with the rendered VTT and where the files were stored, if they were.
 */
public record CaptionResponse(
    List<CaptionCue> cues,
    CaptionValidationReport validation,
    String vtt,
    List<TimingSyncPair> timingSync,
    StorageInfo storage) {

  public record StorageInfo(
      String bucket,
      String vttKey,
      String timingSyncKey,
      String vttUrl,
      String timingSyncUrl,
      boolean vttWritten,
      boolean timingSyncWritten) {}
}
