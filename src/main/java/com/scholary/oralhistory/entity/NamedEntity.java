package com.scholary.oralhistory.entity;

/**
 * A named-entity candidate found in one story's transcript.
 *
 * @param text the mention as extracted
 * @param contextualizedText the mention with its surrounding bracketed annotation, may equal text
 * @param startOffset where the mention starts in the transcript
 * @param length characters covered in the transcript, annotation included
 * @param type coarse entity type
 * @param sourceHint type label assigned by the extracting tool, if any
 * @param duelCoverage whether two extraction tools both reported this mention
 * @param confidence 0 to 3
 */
public record NamedEntity(
    String text,
    String contextualizedText,
    int startOffset,
    int length,
    EntityType type,
    String sourceHint,
    boolean duelCoverage,
    int confidence) {

  public NamedEntity {
    if (text == null) {
      text = "";
    }
    if (contextualizedText == null || contextualizedText.isBlank()) {
      contextualizedText = text;
    }
    if (type == null) {
      type = EntityType.UNSET;
    }
  }

  public NamedEntity(
      String text, String contextualizedText, int startOffset, int length, EntityType type) {
    this(text, contextualizedText, startOffset, length, type, null, false, EntityConfidence.NONE);
  }

  public boolean hasDistinctContext() {
    return !text.equals(contextualizedText);
  }
}
