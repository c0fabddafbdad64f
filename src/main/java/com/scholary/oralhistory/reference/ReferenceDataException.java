package com.scholary.oralhistory.reference;

/** Thrown when a required reference table is missing, empty or unreadable. */
public class ReferenceDataException extends RuntimeException {

  public ReferenceDataException(String message) {
    super(message);
  }

  public ReferenceDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
