package com.scholary.oralhistory.captions;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One on-screen caption: one or more lines shown together.
 *
 * <p>Lines are combined while short cues are coalesced; adjacent lines of the same speaker are then
 * folded into a single line.
 */
public class CaptionCue {

  private final List<CueText> lines = new ArrayList<>();

  public CaptionCue(CueText line) {
    lines.add(line);
  }

  public List<CueText> getLines() {
    return Collections.unmodifiableList(lines);
  }

  // Lines without words carry no time.
  public int getTimeStart() {
    int start = Integer.MAX_VALUE;
    for (CueText line : lines) {
      if (!line.getWords().isEmpty()) {
        start = Math.min(start, line.getTimeStart());
      }
    }
    return start == Integer.MAX_VALUE ? 0 : start;
  }

  public int getTimeEnd() {
    int end = 0;
    for (CueText line : lines) {
      if (!line.getWords().isEmpty()) {
        end = Math.max(end, line.getTimeEnd());
      }
    }
    return end;
  }

  @JsonIgnore
  public int duration() {
    return getTimeEnd() - getTimeStart();
  }

  /** Offset of the cue's first word in the full transcript. */
  public int getTranscriptOffset() {
    for (CueText line : lines) {
      if (!line.getWords().isEmpty()) {
        return line.getWords().get(0).getOriginalStartOffset();
      }
    }
    return 0;
  }

  /** Append {@code other}'s lines after this cue's lines. */
  void absorb(CaptionCue other) {
    lines.addAll(other.lines);
    collapseSameSpeakerLines();
  }

  private void collapseSameSpeakerLines() {
    List<CueText> collapsed = new ArrayList<>();
    for (CueText line : lines) {
      int last = collapsed.size() - 1;
      if (last >= 0 && collapsed.get(last).getSpeaker().equals(line.getSpeaker())) {
        collapsed.set(last, collapsed.get(last).append(line));
      } else {
        collapsed.add(line);
      }
    }
    lines.clear();
    lines.addAll(collapsed);
  }
}
