package com.scholary.oralhistory.api;

/** Response for an async captioning request: the job ID to poll. */
public record AsyncJobResponse(String jobId) {}
