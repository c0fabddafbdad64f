package com.scholary.oralhistory.api;

/** Body returned when a request cannot be processed. */
public record ErrorResponse(String error) {}
