package com.scholary.oralhistory.service;

/** An alignment that cannot be turned into captions. */
public class CaptioningException extends RuntimeException {

  public CaptioningException(String message) {
    super(message);
  }

  public CaptioningException(String message, Throwable cause) {
    super(message, cause);
  }
}
