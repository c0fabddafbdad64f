package com.scholary.oralhistory.captions;

import com.scholary.oralhistory.alignment.AlignedParagraph;
import com.scholary.oralhistory.alignment.AlignmentFormatter;
import com.scholary.oralhistory.alignment.AlignmentResult;
import com.scholary.oralhistory.alignment.FormattedAlignment;
import com.scholary.oralhistory.alignment.TimedText;
import com.scholary.oralhistory.common.ProcessingResult;
import com.scholary.oralhistory.config.CaptioningProperties;
import com.scholary.oralhistory.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds speaker-attributed caption cues from formatted alignment paragraphs.
 *
 * <p>Three passes:
 *
 * <ol>
 *   <li>Generate: every paragraph becomes one line, or several when it is too long or too slow to
 *       show at once. Each line starts as its own cue.
 *   <li>Coalesce: a cue shorter than the minimum duration is merged into a neighbour when the
 *       result still fits. With two candidates the shorter neighbour wins.
 *   <li>Validate: count what is still out of bounds. Nothing is changed or dropped.
 * </ol>
 *
 * <p>Paragraphs are assumed to alternate between interviewer and subject. Which one leads is
 * guessed from how much text falls on even versus odd paragraphs.
 */
@Component
public class TextCaptioner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TextCaptioner.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  public static final String INTERVIEWER = "S1";
  public static final String SUBJECT = "S2";
  public static final String NO_SPEAKER = "";

  private final AlignmentFormatter formatter;
  private final CaptioningProperties properties;

  public TextCaptioner(AlignmentFormatter formatter, CaptioningProperties properties) {
    this.formatter = formatter;
    this.properties = properties;
  }

  /**
   * Format an alignment and caption it.
   *
   * @return the captions, or the formatter's failure
   */
  public ProcessingResult<TextCaptions> caption(AlignmentResult alignment, int durationMs) {
    return formatter
        .format(alignment, durationMs)
        .map(formatted -> captionFormatted(formatted, durationMs));
  }

  public TextCaptions captionFormatted(FormattedAlignment formatted, int durationMs) {
    List<AlignedParagraph> paragraphs = formatted.paragraphs();
    List<String> speakers = speakerOrder(paragraphs);

    List<CaptionCue> cues = generateCues(paragraphs, speakers);
    STRUCTURED_LOGGER.logCueGenerationSummary(paragraphs.size(), cues.size(), speakers.get(0));

    coalesceShortCues(cues);
    CaptionValidationReport report = validate(cues);
    return new TextCaptions(cues, report, formatted.transcript().length(), durationMs);
  }

  /** Speakers for even and odd paragraphs, in that order. */
  List<String> speakerOrder(List<AlignedParagraph> paragraphs) {
    long evenChars = 0;
    long oddChars = 0;
    for (int i = 0; i < paragraphs.size(); i++) {
      if (i % 2 == 0) {
        evenChars += paragraphs.get(i).length();
      } else {
        oddChars += paragraphs.get(i).length();
      }
    }

    // Whole-number ratio: the interviewer leads whenever the even paragraphs hold less text. A
    // segment with no odd paragraphs gets the default order.
    double ratio = oddChars == 0 ? 0.0 : (double) (evenChars / oddChars);
    LOGGER.debug("Speaker char ratio even/odd = {} ({}/{})", ratio, evenChars, oddChars);
    return ratio < properties.speaker1ToSpeaker2CharRatio()
        ? List.of(INTERVIEWER, SUBJECT)
        : List.of(SUBJECT, INTERVIEWER);
  }

  List<CaptionCue> generateCues(List<AlignedParagraph> paragraphs, List<String> speakers) {
    List<CaptionCue> cues = new ArrayList<>();
    for (int i = 0; i < paragraphs.size(); i++) {
      AlignedParagraph paragraph = paragraphs.get(i);
      if (paragraph.isNoNarration()) {
        cues.add(new CaptionCue(new CueText(NO_SPEAKER, paragraph.getWords())));
        continue;
      }

      String speaker = speakers.get(i % 2);
      if (paragraph.getWords().isEmpty()) {
        // Kept as an empty line so validation reports it.
        LOGGER.warn("Paragraph {} has no words: '{}'", i, paragraph.getText());
        cues.add(new CaptionCue(new CueText(speaker, List.of())));
      } else if (paragraph.duration() > properties.maxCueDuration()
          || paragraph.length() > properties.maxCueLength()) {
        splitParagraph(paragraph.getWords(), speaker, cues);
      } else {
        cues.add(new CaptionCue(new CueText(speaker, paragraph.getWords())));
      }
    }
    return cues;
  }

  /**
   * Fill lines word by word. A line closes at the target length, else at the target duration,
   * else when the words run out. A short tail is folded into the line that would precede it.
   */
  private void splitParagraph(List<TimedText> words, String speaker, List<CaptionCue> cues) {
    List<TimedText> current = new ArrayList<>();
    int index = 0;
    while (index < words.size()) {
      current.add(words.get(index++));
      CueText line = new CueText(speaker, current);
      boolean exhausted = index >= words.size();

      if (line.length() >= properties.targetLength()
          || line.duration() >= properties.targetDuration()
          || exhausted) {
        if (!exhausted) {
          CueText tail = new CueText(speaker, words.subList(index, words.size()));
          if (tail.duration() < properties.minCueDuration()
              && tail.duration() + line.duration() < properties.maxCueDuration()) {
            current.addAll(tail.getWords());
            index = words.size();
            line = new CueText(speaker, current);
          }
        }
        cues.add(new CaptionCue(line));
        current = new ArrayList<>();
      }
    }
  }

  void coalesceShortCues(List<CaptionCue> cues) {
    for (int i = 0; i < cues.size(); i++) {
      CaptionCue cue = cues.get(i);
      if (cue.duration() >= properties.minCueDuration()) {
        continue;
      }

      CaptionCue previous = i > 0 ? cues.get(i - 1) : null;
      CaptionCue next = i < cues.size() - 1 ? cues.get(i + 1) : null;
      boolean previousEligible = previous != null && canAbsorb(previous, cue);
      boolean nextEligible = next != null && canAbsorb(next, cue);

      if (previousEligible && (!nextEligible || previous.duration() <= next.duration())) {
        previous.absorb(cue);
        cues.remove(i);
        i--;
      } else if (nextEligible) {
        cue.absorb(next);
        cues.remove(i + 1);
      } else {
        STRUCTURED_LOGGER.logCoalesceFailed(i, cue.duration());
      }
    }
  }

  private boolean canAbsorb(CaptionCue neighbour, CaptionCue cue) {
    return neighbour.duration() + cue.duration() < properties.maxCueDuration()
        && neighbour.getLines().size() < properties.maxCueLineCount();
  }

  CaptionValidationReport validate(List<CaptionCue> cues) {
    int tooShort = 0;
    int tooLong = 0;
    int tooFewLines = 0;
    int tooManyLines = 0;
    int emptyLines = 0;
    int overlongLines = 0;

    for (int i = 0; i < cues.size(); i++) {
      CaptionCue cue = cues.get(i);
      int duration = cue.duration();
      int lineCount = cue.getLines().size();

      if (duration < properties.minCueDuration()) {
        tooShort++;
        LOGGER.debug("Cue {} too short: {}ms", i, duration);
      }
      if (duration > properties.maxCueDuration()) {
        tooLong++;
        LOGGER.debug("Cue {} too long: {}ms", i, duration);
      }
      if (lineCount < 1) {
        tooFewLines++;
      }
      if (lineCount > properties.maxCueLineCount()) {
        tooManyLines++;
        LOGGER.debug("Cue {} has {} lines", i, lineCount);
      }
      for (CueText line : cue.getLines()) {
        if (line.length() == 0) {
          emptyLines++;
        } else if (line.length() > properties.maxCueLength()) {
          overlongLines++;
          LOGGER.debug("Cue {} has a {}-char line", i, line.length());
        }
      }
    }

    STRUCTURED_LOGGER.logCaptionValidation(
        cues.size(), tooShort, tooLong, tooFewLines, tooManyLines, emptyLines, overlongLines);
    return new CaptionValidationReport(
        cues.size(), tooShort, tooLong, tooFewLines, tooManyLines, emptyLines, overlongLines);
  }
}
