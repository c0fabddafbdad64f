package com.scholary.oralhistory.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets {@code event_type} plus its own fields for the duration of a single log call,
 * so they can be queried in the log search backend. Unit-of-work context (segment, story, job) is
 * set separately and stays in place until cleared.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log the outcome of the first captioning pass. */
  public void logCueGenerationSummary(int paragraphCount, int cueCount, String leadSpeaker) {
    try {
      MDC.put("event_type", "cue_generation_summary");
      MDC.put("paragraphCount", String.valueOf(paragraphCount));
      MDC.put("cueCount", String.valueOf(cueCount));
      MDC.put("leadSpeaker", leadSpeaker);

      logger.debug(
          "Cues generated: paragraphs={}, cues={}, leadSpeaker={}",
          paragraphCount,
          cueCount,
          leadSpeaker);
    } finally {
      clearEventFields();
    }
  }

  /** Log a short cue that no neighbour could absorb. */
  public void logCoalesceFailed(int cueIndex, int durationMs) {
    try {
      MDC.put("event_type", "cue_coalesce_failed");
      MDC.put("cueIndex", String.valueOf(cueIndex));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.warn(
          "Short cue left as-is, no eligible neighbour: index={}, duration={}ms",
          cueIndex,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log the caption validation counts. */
  public void logCaptionValidation(
      int cueCount,
      int tooShort,
      int tooLong,
      int tooFewLines,
      int tooManyLines,
      int emptyLines,
      int overlongLines) {
    try {
      MDC.put("event_type", "caption_validation_summary");
      MDC.put("cueCount", String.valueOf(cueCount));
      MDC.put("tooShort", String.valueOf(tooShort));
      MDC.put("tooLong", String.valueOf(tooLong));
      MDC.put("tooFewLines", String.valueOf(tooFewLines));
      MDC.put("tooManyLines", String.valueOf(tooManyLines));
      MDC.put("emptyLines", String.valueOf(emptyLines));
      MDC.put("overlongLines", String.valueOf(overlongLines));

      int problems = tooShort + tooLong + tooFewLines + tooManyLines + emptyLines + overlongLines;
      String message =
          "Caption validation: cues={}, tooShort={}, tooLong={}, tooFewLines={}, tooManyLines={},"
              + " emptyLines={}, overlongLines={}";
      Object[] args = {
        cueCount, tooShort, tooLong, tooFewLines, tooManyLines, emptyLines, overlongLines
      };
      if (problems > 0) {
        logger.warn(message, args);
      } else {
        logger.info(message, args);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log trailing unaligned words that were dropped instead of interpolated. */
  public void logTrailingWordsDropped(int droppedCount, int truncatedAtOffset) {
    try {
      MDC.put("event_type", "trailing_words_dropped");
      MDC.put("droppedCount", String.valueOf(droppedCount));
      MDC.put("truncatedAtOffset", String.valueOf(truncatedAtOffset));

      logger.warn(
          "Dropping {} trailing unaligned words, transcript truncated at offset {}",
          droppedCount,
          truncatedAtOffset);
    } finally {
      clearEventFields();
    }
  }

  /** Log the resolution summary for one story. */
  public void logStoryResolved(
      String entityKind, int candidateCount, int resolvedCount, int unresolvedCount) {
    try {
      MDC.put("event_type", "story_resolved");
      MDC.put("entityKind", entityKind);
      MDC.put("candidateCount", String.valueOf(candidateCount));
      MDC.put("resolvedCount", String.valueOf(resolvedCount));
      MDC.put("unresolvedCount", String.valueOf(unresolvedCount));

      logger.info(
          "Resolved {}: candidates={}, resolved={}, unresolved={}",
          entityKind,
          candidateCount,
          resolvedCount,
          unresolvedCount);
    } finally {
      clearEventFields();
    }
  }

  /** Log two different authority ids claimed by the same mention text. */
  public void logOrganizationConflict(String text, String firstId, String secondId) {
    try {
      MDC.put("event_type", "organization_conflict");
      MDC.put("text", text);
      MDC.put("firstId", firstId);
      MDC.put("secondId", secondId);

      logger.error(
          "Organization '{}' resolved to both {} and {}, story not resolved",
          text,
          firstId,
          secondId);
    } finally {
      clearEventFields();
    }
  }

  /** Log a token that could not be found in the transcript. */
  public void logNerDesync(String token, int scanOffset) {
    try {
      MDC.put("event_type", "ner_desync");
      MDC.put("token", token);
      MDC.put("scanOffset", String.valueOf(scanOffset));

      logger.error("NER token '{}' not found in transcript at or after {}", token, scanOffset);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String bucket, String key) {
    MDC.put("jobId", jobId);
    MDC.put("bucket", bucket);
    MDC.put("key", key);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("bucket");
    MDC.remove("key");
  }

  public static void setStoryContext(String storyId) {
    MDC.put("storyId", storyId);
  }

  public static void clearStoryContext() {
    MDC.remove("storyId");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("paragraphCount");
    MDC.remove("cueCount");
    MDC.remove("leadSpeaker");
    MDC.remove("cueIndex");
    MDC.remove("durationMs");
    MDC.remove("tooShort");
    MDC.remove("tooLong");
    MDC.remove("tooFewLines");
    MDC.remove("tooManyLines");
    MDC.remove("emptyLines");
    MDC.remove("overlongLines");
    MDC.remove("droppedCount");
    MDC.remove("truncatedAtOffset");
    MDC.remove("entityKind");
    MDC.remove("candidateCount");
    MDC.remove("resolvedCount");
    MDC.remove("unresolvedCount");
    MDC.remove("text");
    MDC.remove("firstId");
    MDC.remove("secondId");
    MDC.remove("token");
    MDC.remove("scanOffset");
  }
}
