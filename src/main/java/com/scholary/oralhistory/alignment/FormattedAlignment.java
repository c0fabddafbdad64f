package com.scholary.oralhistory.alignment;

import java.util.List;

/** Caption-ready paragraphs together with the (possibly truncated) transcript they came from. */
public record FormattedAlignment(String transcript, List<AlignedParagraph> paragraphs) {

  public FormattedAlignment {
    paragraphs = List.copyOf(paragraphs);
  }
}
