package com.scholary.oralhistory.captions;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.scholary.oralhistory.alignment.TimedText;
import java.util.ArrayList;
import java.util.List;

/** One caption line: a speaker tag and the words spoken on it. */
public class CueText {

  private final String speaker;
  private final List<TimedText> words;

  public CueText(String speaker, List<TimedText> words) {
    this.speaker = speaker;
    this.words = List.copyOf(words);
  }

  /** "S1", "S2", or empty for a line with no speaker. */
  public String getSpeaker() {
    return speaker;
  }

  public List<TimedText> getWords() {
    return words;
  }

  public String getText() {
    StringBuilder text = new StringBuilder();
    for (TimedText word : words) {
      text.append(word.getText());
    }
    return text.toString().trim();
  }

  @JsonIgnore
  public int length() {
    return getText().length();
  }

  public int getTimeStart() {
    return words.isEmpty() ? 0 : words.get(0).getTimeStart();
  }

  public int getTimeEnd() {
    return words.isEmpty() ? 0 : words.get(words.size() - 1).getTimeEnd();
  }

  @JsonIgnore
  public int duration() {
    return getTimeEnd() - getTimeStart();
  }

  /** A line with this line's words followed by {@code other}'s, keeping this speaker. */
  CueText append(CueText other) {
    List<TimedText> combined = new ArrayList<>(words);
    combined.addAll(other.words);
    return new CueText(speaker, combined);
  }
}
