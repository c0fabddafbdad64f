package com.scholary.oralhistory.ner;

import com.scholary.oralhistory.common.ProcessingResult;
import com.scholary.oralhistory.entity.EntityConfidence;
import com.scholary.oralhistory.entity.EntityType;
import com.scholary.oralhistory.entity.NamedEntity;
import com.scholary.oralhistory.logging.StructuredLogger;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges spaCy's entity spans into the candidates rebuilt by {@link StanfordNerPolisher}.
 *
 * <p>spaCy output is CSV with a header row, one entity per line: {@code text,start,end,LABEL},
 * with offsets into the same transcript. Both lists are walked in transcript order:
 *
 * <ul>
 *   <li>a spaCy span overlapping a Stanford candidate of the same type confirms it, so the merged
 *       entity carries duel coverage, keeps Stanford's bracketed context and usually takes the
 *       tighter of the two names. Several spans inside one long candidate split it;
 *   <li>a span overlapping a candidate of another type is kept at {@link EntityConfidence#GOOD}
 *       under spaCy's type;
 *   <li>anything only one tool found is kept at {@link EntityConfidence#SOME}.
 * </ul>
 *
 * <p>Dates, events and cardinals survive only when they hold a year. Works of art, products and
 * the like are never kept, and they never confirm a Stanford candidate either.
 */
@Component
public class SpacyNerPolisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpacyNerPolisher.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final Pattern YEAR = Pattern.compile("1[5-9]\\d\\d|2[01]\\d\\d");

  public ProcessingResult<List<NamedEntity>> polish(
      Path spacyFile, String transcript, List<NamedEntity> stanfordEntities) throws IOException {
    return polish(
        Files.readAllLines(spacyFile, StandardCharsets.UTF_8), transcript, stanfordEntities);
  }

  /**
   * Merge spaCy output with Stanford candidates.
   *
   * @param spacyLines spaCy CSV output, header row first
   * @param transcript the text both tools ran on
   * @param stanfordEntities candidates from {@link StanfordNerPolisher}, in transcript order
   * @return the merged candidates, or a failure when a person, place or organization span does
   *     not match the transcript or a line carries unusable offsets
   */
  public ProcessingResult<List<NamedEntity>> polish(
      List<String> spacyLines, String transcript, List<NamedEntity> stanfordEntities) {
    List<NamedEntity> merged = new ArrayList<>();
    boolean[] covered = new boolean[stanfordEntities.size()];
    int active = 0;

    // first line is the header
    for (int lineNumber = 1; lineNumber < spacyLines.size(); lineNumber++) {
      String line = spacyLines.get(lineNumber);
      String[] pieces = line.split(",", -1);
      if (pieces.length != 4 || pieces[0].isEmpty()) {
        continue;
      }
      String text = pieces[0];
      String label = pieces[3].trim();
      EntityType type = typeFor(label);
      if (type == EntityType.UNSET || type == EntityType.SOMETHING_TO_IGNORE) {
        continue;
      }

      int start;
      int end;
      try {
        start = Integer.parseInt(pieces[1].trim());
        end = Integer.parseInt(pieces[2].trim());
      } catch (NumberFormatException e) {
        LOGGER.error("Unreadable spaCy offsets on line {}: '{}'", lineNumber + 1, line);
        return ProcessingResult.failure("Unreadable spaCy offsets: " + line);
      }
      if (end <= start) {
        LOGGER.error("Empty spaCy span on line {}: '{}'", lineNumber + 1, line);
        return ProcessingResult.failure("Empty spaCy span: " + line);
      }

      if (isNamed(type) && transcript.indexOf(text, start) != start) {
        if (text.contains("\"")) {
          // spaCy reports quoted spans with shifted offsets
          continue;
        }
        STRUCTURED_LOGGER.logNerDesync(text, start);
        return ProcessingResult.failure(
            String.format("Transcript has no spaCy entity '%s' at offset %d", text, start));
      }
      if (text.contains("\t")) {
        LOGGER.warn("Skipping spaCy entity with embedded tab on line {}", lineNumber + 1);
        continue;
      }

      NamedEntity candidate = null;
      while (active < stanfordEntities.size()) {
        NamedEntity stanford = stanfordEntities.get(active);
        if (end(stanford) <= start) {
          if (!covered[active]) {
            merged.add(stanfordOnly(stanford));
          }
          active++;
        } else if (stanford.startOffset() < end) {
          if (stanford.type() == type) {
            covered[active] = true;
            merged.add(confirm(stanford, text, start, end, label));
          } else {
            candidate =
                new NamedEntity(
                    text,
                    stanford.contextualizedText(),
                    start,
                    end - start,
                    type,
                    label,
                    false,
                    EntityConfidence.GOOD);
          }
          break;
        } else {
          candidate = spacyOnly(text, start, end, type, label);
          break;
        }
      }
      if (active >= stanfordEntities.size()) {
        candidate = spacyOnly(text, start, end, type, label);
      }

      NamedEntity kept = keepable(candidate);
      if (kept != null) {
        merged.add(kept);
      }
    }

    for (int i = active; i < stanfordEntities.size(); i++) {
      if (!covered[i]) {
        merged.add(stanfordOnly(stanfordEntities.get(i)));
      }
    }

    LOGGER.debug(
        "Merged {} spaCy lines with {} Stanford candidates into {}",
        Math.max(0, spacyLines.size() - 1),
        stanfordEntities.size(),
        merged.size());
    return ProcessingResult.success(merged);
  }

  /** Both tools agree on the type; the result takes the tighter or cleaner of the two names. */
  private static NamedEntity confirm(
      NamedEntity stanford, String text, int start, int end, String label) {
    int confidence = EntityConfidence.BETTER;
    boolean useSpacyName;
    if (start >= stanford.startOffset() && end <= end(stanford)) {
      useSpacyName = true;
    } else if (stanford.startOffset() >= start && end(stanford) <= end) {
      useSpacyName = false;
    } else {
      confidence = EntityConfidence.GOOD;
      boolean stanfordBracketed = stanford.text().contains("[");
      if (stanfordBracketed != text.contains("[")) {
        useSpacyName = stanfordBracketed;
      } else {
        useSpacyName = end - start >= stanford.length();
      }
    }

    if (useSpacyName) {
      return new NamedEntity(
          text,
          stanford.contextualizedText(),
          start,
          end - start,
          stanford.type(),
          label,
          true,
          confidence);
    }
    return new NamedEntity(
        stanford.text(),
        stanford.contextualizedText(),
        stanford.startOffset(),
        stanford.length(),
        stanford.type(),
        label,
        true,
        confidence);
  }

  private static NamedEntity stanfordOnly(NamedEntity stanford) {
    return new NamedEntity(
        stanford.text(),
        stanford.contextualizedText(),
        stanford.startOffset(),
        stanford.length(),
        stanford.type(),
        stanford.sourceHint(),
        false,
        EntityConfidence.SOME);
  }

  private static NamedEntity spacyOnly(
      String text, int start, int end, EntityType type, String label) {
    return new NamedEntity(
        text, text, start, end - start, type, label, false, EntityConfidence.SOME);
  }

  /** Years replace their date text; kinds never resolved are dropped. */
  private static NamedEntity keepable(NamedEntity candidate) {
    if (candidate == null) {
      return null;
    }
    NamedEntity entity = candidate;
    if (entity.type() == EntityType.YEAR || entity.type() == EntityType.YEAR_PERHAPS) {
      String year = yearIn(entity.text());
      if (year == null) {
        return null;
      }
      entity =
          new NamedEntity(
              year,
              entity.contextualizedText(),
              entity.startOffset(),
              entity.length(),
              EntityType.YEAR,
              entity.sourceHint(),
              entity.duelCoverage(),
              entity.confidence());
    }
    switch (entity.type()) {
      case UNSET:
      case SOMETHING_ELSE:
      case SOMETHING_TO_IGNORE:
        return null;
      default:
        return entity;
    }
  }

  /** The first year between 1500 and 2199 written in the text, or null. */
  static String yearIn(String text) {
    Matcher matcher = YEAR.matcher(text);
    return matcher.find() ? matcher.group() : null;
  }

  private static boolean isNamed(EntityType type) {
    return type == EntityType.PERSON || type == EntityType.ORG || type == EntityType.LOC;
  }

  private static int end(NamedEntity entity) {
    return entity.startOffset() + entity.length();
  }

  static EntityType typeFor(String label) {
    switch (label) {
      case "PERSON":
        return EntityType.PERSON;
      case "LOC":
      case "GPE":
      case "FAC":
        return EntityType.LOC;
      case "ORG":
      case "NORP":
        return EntityType.ORG;
      case "EVENT":
      case "DATE":
      case "CARDINAL":
        return EntityType.YEAR_PERHAPS;
      case "PRODUCT":
      case "WORK_OF_ART":
      case "LAW":
      case "LANGUAGE":
      case "TIME":
        return EntityType.SOMETHING_ELSE;
      case "PERCENT":
      case "MONEY":
      case "QUANTITY":
      case "ORDINAL":
        return EntityType.SOMETHING_TO_IGNORE;
      default:
        return EntityType.UNSET;
    }
  }
}
