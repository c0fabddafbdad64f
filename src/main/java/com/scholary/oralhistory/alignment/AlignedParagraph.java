package com.scholary.oralhistory.alignment;

import java.util.ArrayList;
import java.util.List;

/**
 * One transcript paragraph with its words.
 *
 * <p>The original offsets index into the full transcript. Word offsets are relative to the cleaned
 * {@link #getText() text}, and after formatting the word ranges partition that text.
 */
public class AlignedParagraph {

  private final int originalStartOffset;
  private final int originalEndOffset;
  private final String originalText;
  private String text;
  private final List<TimedText> words = new ArrayList<>();

  public AlignedParagraph(int originalStartOffset, int originalEndOffset, String originalText) {
    this.originalStartOffset = originalStartOffset;
    this.originalEndOffset = originalEndOffset;
    this.originalText = originalText;
    this.text = originalText;
  }

  public int getOriginalStartOffset() {
    return originalStartOffset;
  }

  public int getOriginalEndOffset() {
    return originalEndOffset;
  }

  public String getOriginalText() {
    return originalText;
  }

  public String getText() {
    return text;
  }

  void setText(String text) {
    this.text = text;
  }

  public List<TimedText> getWords() {
    return words;
  }

  public int length() {
    return text.length();
  }

  /** Time span from the first word's start to the last word's end, 0 when there are no words. */
  public int duration() {
    if (words.isEmpty()) {
      return 0;
    }
    return words.get(words.size() - 1).getTimeEnd() - words.get(0).getTimeStart();
  }

  public boolean isNoNarration() {
    return words.size() == 1 && words.get(0).getTextCase() == TextCase.NO_NARRATION;
  }
}
