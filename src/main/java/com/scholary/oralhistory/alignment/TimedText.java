package com.scholary.oralhistory.alignment;

/**
 * A word or span with a character range and a time range in milliseconds.
 *
 * <p>Instances are mutated while the formatter repairs them. The offsets given at construction are
 * kept as the original offsets into the full transcript.
 */
public class TimedText {

  private String text;
  private int offsetStart;
  private int offsetEnd;
  private final int originalStartOffset;
  private final int originalEndOffset;
  private int timeStart;
  private int timeEnd;
  private TextCase textCase;

  public TimedText(
      String text, int offsetStart, int offsetEnd, int timeStart, int timeEnd, TextCase textCase) {
    this.text = text;
    this.offsetStart = offsetStart;
    this.offsetEnd = offsetEnd;
    this.originalStartOffset = offsetStart;
    this.originalEndOffset = offsetEnd;
    this.timeStart = timeStart;
    this.timeEnd = timeEnd;
    this.textCase = textCase;
  }

  public String getText() {
    return text;
  }

  public void setText(String text) {
    this.text = text;
  }

  public int getOffsetStart() {
    return offsetStart;
  }

  public void setOffsetStart(int offsetStart) {
    this.offsetStart = offsetStart;
  }

  public int getOffsetEnd() {
    return offsetEnd;
  }

  public void setOffsetEnd(int offsetEnd) {
    this.offsetEnd = offsetEnd;
  }

  public int getOriginalStartOffset() {
    return originalStartOffset;
  }

  public int getOriginalEndOffset() {
    return originalEndOffset;
  }

  public int getTimeStart() {
    return timeStart;
  }

  public void setTimeStart(int timeStart) {
    this.timeStart = timeStart;
  }

  public int getTimeEnd() {
    return timeEnd;
  }

  public void setTimeEnd(int timeEnd) {
    this.timeEnd = timeEnd;
  }

  public TextCase getTextCase() {
    return textCase;
  }

  public void setTextCase(TextCase textCase) {
    this.textCase = textCase;
  }

  public int length() {
    return offsetEnd - offsetStart;
  }

  public int duration() {
    return timeEnd - timeStart;
  }

  @Override
  public String toString() {
    return String.format(
        "%s [%d-%d) %d-%dms %s", text, offsetStart, offsetEnd, timeStart, timeEnd, textCase);
  }
}
