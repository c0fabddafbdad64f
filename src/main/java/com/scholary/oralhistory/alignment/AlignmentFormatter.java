package com.scholary.oralhistory.alignment;

import com.scholary.oralhistory.common.ProcessingResult;
import com.scholary.oralhistory.config.CaptioningProperties;
import com.scholary.oralhistory.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns raw forced-alignment words into caption-ready paragraphs.
 *
 * <p>The aligner's output is repaired before it is used:
 *
 * <ol>
 *   <li>Aligned words with inverted, overlapping or out-of-range times are fixed up.
 *   <li>Runs of unaligned words get interpolated times. A long unaligned tail is dropped and the
 *       transcript is cut where it starts.
 *   <li>The transcript is split into paragraphs on blank lines and each word is assigned to the
 *       paragraph that contains it.
 *   <li>Each paragraph's text loses its bracketed annotations, word offsets are relocated in the
 *       cleaned text, and word ranges are widened until they cover the whole paragraph.
 * </ol>
 *
 * <p>The only unrecoverable case is a word that cannot be found again in its cleaned paragraph,
 * which means the transcript and the alignment disagree. That is reported as a failed result.
 */
@Component
public class AlignmentFormatter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlignmentFormatter.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  public static final String NO_NARRATION_TEXT = "(no narration)";

  private static final String PARAGRAPH_BREAK = "\n\n";
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("\\s(?=[.?,;!])");

  private final int maxUnalignedTrailingWords;

  public AlignmentFormatter(CaptioningProperties properties) {
    this.maxUnalignedTrailingWords = properties.maxUnalignedTrailingWordsAllowed();
  }

  /**
   * Format one segment's alignment.
   *
   * @param alignment the aligner output, may be null or have no words
   * @param durationMs length of the media clip
   * @return the paragraphs, or a failure when a word cannot be relocated in its paragraph
   */
  public ProcessingResult<FormattedAlignment> format(AlignmentResult alignment, int durationMs) {
    if (alignment == null || alignment.words().isEmpty()) {
      LOGGER.debug("No aligned words, emitting no-narration paragraph for {}ms", durationMs);
      return ProcessingResult.success(noNarration(durationMs));
    }

    List<TimedText> words = toTimedText(alignment.words());
    fixKnownDataBugs(words, durationMs);
    String transcript = interpolateUnaligned(words, alignment.transcript(), durationMs);

    List<AlignedParagraph> paragraphs = splitParagraphs(transcript, words);
    for (AlignedParagraph paragraph : paragraphs) {
      paragraph.setText(cleanText(paragraph.getOriginalText()));

      Optional<TimedText> unmatched = relocateWordOffsets(paragraph);
      if (unmatched.isPresent()) {
        TimedText word = unmatched.get();
        String message =
            String.format(
                "Word '%s' at transcript offset %d not found in cleaned paragraph starting at %d",
                word.getText(), word.getOriginalStartOffset(), paragraph.getOriginalStartOffset());
        LOGGER.error(message);
        return ProcessingResult.failure(message);
      }

      expandWordBoundaries(paragraph);
    }

    LOGGER.debug("Formatted {} words into {} paragraphs", words.size(), paragraphs.size());
    return ProcessingResult.success(new FormattedAlignment(transcript, paragraphs));
  }

  static FormattedAlignment noNarration(int durationMs) {
    AlignedParagraph paragraph =
        new AlignedParagraph(0, NO_NARRATION_TEXT.length(), NO_NARRATION_TEXT);
    paragraph
        .getWords()
        .add(
            new TimedText(
                NO_NARRATION_TEXT,
                0,
                NO_NARRATION_TEXT.length(),
                0,
                durationMs,
                TextCase.NO_NARRATION));
    return new FormattedAlignment(NO_NARRATION_TEXT, List.of(paragraph));
  }

  private static List<TimedText> toTimedText(List<AlignedWord> alignedWords) {
    List<TimedText> words = new ArrayList<>(alignedWords.size());
    for (AlignedWord word : alignedWords) {
      words.add(
          new TimedText(
              word.word() == null ? "" : word.word(),
              word.startOffset(),
              word.endOffset(),
              toMillis(word.start()),
              toMillis(word.end()),
              word.isAligned() ? TextCase.ALIGNED : TextCase.UNALIGNED));
    }
    return words;
  }

  private static int toMillis(Double seconds) {
    return seconds == null ? 0 : (int) Math.round(seconds * 1000);
  }

  // Repairs apply to aligned words only; unaligned ones get their times later.
  static void fixKnownDataBugs(List<TimedText> words, int durationMs) {
    List<TimedText> aligned = new ArrayList<>();
    for (TimedText word : words) {
      if (word.getTextCase() == TextCase.ALIGNED) {
        aligned.add(word);
      }
    }

    if (aligned.size() > 1) {
      repairNonMonotonicTimes(aligned);
      repairOverlaps(aligned);
    }
    if (!aligned.isEmpty()) {
      repairIllegalEndTimes(aligned, durationMs);
    }
  }

  /**
   * Give each word the times found at its position in start-time order. The list itself keeps its
   * text order. The last word keeps its own
   * times.
   */
  private static void repairNonMonotonicTimes(List<TimedText> aligned) {
    List<TimedText> sorted = new ArrayList<>(aligned);
    sorted.sort(Comparator.comparingInt(TimedText::getTimeStart));

    int[] starts = new int[sorted.size()];
    int[] ends = new int[sorted.size()];
    for (int i = 0; i < sorted.size(); i++) {
      starts[i] = sorted.get(i).getTimeStart();
      ends[i] = sorted.get(i).getTimeEnd();
    }

    int repaired = 0;
    for (int i = 0; i < aligned.size() - 1; i++) {
      TimedText word = aligned.get(i);
      if (word != sorted.get(i)) {
        word.setTimeStart(starts[i]);
        word.setTimeEnd(ends[i]);
        repaired++;
      }
    }
    if (repaired > 0) {
      LOGGER.warn("Repaired {} non-monotonic word times", repaired);
    }
  }

  private static void repairOverlaps(List<TimedText> aligned) {
    for (int i = 0; i < aligned.size() - 2; i++) {
      TimedText current = aligned.get(i);
      TimedText next = aligned.get(i + 1);
      if (current.getTimeEnd() > next.getTimeStart()) {
        int end = current.getTimeEnd();
        current.setTimeEnd(next.getTimeStart());
        next.setTimeStart(end);
      }
    }
  }

  private static void repairIllegalEndTimes(List<TimedText> aligned, int durationMs) {
    int lastIndex = aligned.size() - 1;
    int lastGoodIndex = 0;
    for (int i = lastIndex; i >= 0; i--) {
      if (aligned.get(i).getTimeEnd() <= durationMs) {
        lastGoodIndex = i;
        break;
      }
    }

    if (lastGoodIndex != lastIndex) {
      LOGGER.warn(
          "{} aligned words end after the clip ({}ms), re-spreading them",
          lastIndex - lastGoodIndex,
          durationMs);
      int start = Math.min(aligned.get(lastGoodIndex).getTimeStart(), durationMs);
      interpolate(
          aligned.subList(lastGoodIndex, lastIndex + 1), start, durationMs, TextCase.ALIGNED);
    }
  }

  /** Spread {@code run} evenly over [startMs, endMs). */
  private static void interpolate(List<TimedText> run, int startMs, int endMs, TextCase textCase) {
    int wordDuration = Math.max(0, (endMs - startMs) / run.size());
    int time = startMs;
    for (TimedText word : run) {
      word.setTimeStart(time);
      time += wordDuration;
      word.setTimeEnd(time);
      word.setTextCase(textCase);
    }
  }

  /**
   * Interpolate every run of unaligned words. Removes an over-long trailing run from {@code words}.
   *
   * @return the transcript, cut at the start of a dropped trailing run
   */
  String interpolateUnaligned(List<TimedText> words, String transcript, int durationMs) {
    int previousEnd = 0;
    int i = 0;
    while (i < words.size()) {
      TimedText word = words.get(i);
      if (word.getTextCase() != TextCase.UNALIGNED) {
        previousEnd = word.getTimeEnd();
        i++;
        continue;
      }

      int runStart = i;
      while (i < words.size() && words.get(i).getTextCase() == TextCase.UNALIGNED) {
        i++;
      }
      List<TimedText> run = words.subList(runStart, i);

      if (i < words.size()) {
        interpolate(run, previousEnd, words.get(i).getTimeStart(), TextCase.INTERPOLATED);
      } else if (run.size() > maxUnalignedTrailingWords) {
        int cut = Math.min(run.get(0).getOriginalStartOffset(), transcript.length());
        STRUCTURED_LOGGER.logTrailingWordsDropped(run.size(), cut);
        transcript = transcript.substring(0, cut);
        run.clear();
      } else {
        interpolate(run, previousEnd, durationMs, TextCase.INTERPOLATED);
      }
    }
    return transcript;
  }

  /** Split on blank lines, handing out words with a single forward pass. */
  static List<AlignedParagraph> splitParagraphs(String transcript, List<TimedText> words) {
    List<AlignedParagraph> paragraphs = new ArrayList<>();
    int start = 0;
    int cursor = 0;

    for (String text : transcript.split(PARAGRAPH_BREAK, -1)) {
      int end = start + text.length();
      AlignedParagraph paragraph = new AlignedParagraph(start, end, text);

      while (cursor < words.size()) {
        TimedText word = words.get(cursor);
        if (word.getOffsetStart() < start) {
          LOGGER.warn("Word '{}' spans a paragraph break, skipped", word.getText());
          cursor++;
          continue;
        }
        if (word.getOffsetEnd() > end) {
          break;
        }
        paragraph.getWords().add(word);
        cursor++;
      }

      paragraphs.add(paragraph);
      start = end + PARAGRAPH_BREAK.length();
    }

    if (cursor < words.size()) {
      LOGGER.warn("{} words lie beyond the end of the transcript", words.size() - cursor);
    }
    return paragraphs;
  }

  static String cleanText(String text) {
    String cleaned = removeBrackets(text);
    cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");
    cleaned = SPACE_BEFORE_PUNCTUATION.matcher(cleaned).replaceAll("");
    return cleaned.trim();
  }

  // Not nesting-aware: skipping ends at the first closer of the opening bracket's kind.
  private static String removeBrackets(String text) {
    StringBuilder result = new StringBuilder(text.length());
    char closer = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (closer != 0) {
        if (c == closer) {
          closer = 0;
        }
      } else if (c == '[') {
        closer = ']';
      } else if (c == '(') {
        closer = ')';
      } else {
        result.append(c);
      }
    }
    return result.toString();
  }

  /**
   * Find each word again in the cleaned text, searching forward from the previous word's end.
   *
   * @return the first word that could not be found
   */
  static Optional<TimedText> relocateWordOffsets(AlignedParagraph paragraph) {
    String text = paragraph.getText();
    int searchFrom = 0;
    for (TimedText word : paragraph.getWords()) {
      int found = text.indexOf(word.getText(), searchFrom);
      if (found < 0) {
        return Optional.of(word);
      }
      word.setOffsetStart(found);
      word.setOffsetEnd(found + word.getText().length());
      searchFrom = word.getOffsetEnd();
    }
    return Optional.empty();
  }

  static void expandWordBoundaries(AlignedParagraph paragraph) {
    String text = paragraph.getText();
    List<TimedText> words = paragraph.getWords();
    if (words.isEmpty()) {
      return;
    }

    for (TimedText word : words) {
      int start = word.getOffsetStart();
      if (start > 0 && text.charAt(start - 1) == '"') {
        word.setOffsetStart(start - 1);
      }
    }

    int i = 0;
    while (i < words.size() - 1) {
      TimedText current = words.get(i);
      TimedText next = words.get(i + 1);
      if (next.getOffsetStart() - current.getOffsetEnd() == 1
          && text.charAt(current.getOffsetEnd()) == '-') {
        current.setOffsetEnd(next.getOffsetEnd());
        current.setTimeEnd(Math.max(current.getTimeEnd(), next.getTimeEnd()));
        words.remove(i + 1);
      } else {
        i++;
      }
    }

    words.get(0).setOffsetStart(0);
    for (int w = 0; w < words.size(); w++) {
      TimedText word = words.get(w);
      int end = w + 1 < words.size() ? words.get(w + 1).getOffsetStart() : text.length();
      word.setOffsetEnd(end);
      word.setText(text.substring(word.getOffsetStart(), end));
    }
  }
}
