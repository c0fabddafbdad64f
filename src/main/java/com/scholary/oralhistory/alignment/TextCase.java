package com.scholary.oralhistory.alignment;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a word's timing was obtained. */
public enum TextCase {
  ALIGNED("aligned"),
  UNALIGNED("unaligned"),
  INTERPOLATED("interpolated"),
  NO_NARRATION("no-narration");

  private final String value;

  TextCase(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
