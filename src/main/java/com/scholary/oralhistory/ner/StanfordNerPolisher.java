package com.scholary.oralhistory.ner;

import com.scholary.oralhistory.common.ProcessingResult;
import com.scholary.oralhistory.config.NerProperties;
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
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rebuilds entity candidates, with transcript offsets, from Stanford NER's one-token-per-line
 * output ({@code token<TAB>PERSON|LOCATION|ORGANIZATION|O}).
 *
 * <p>The tagger's tokens do not always match the transcript: it may repeat punctuation or escape
 * brackets. Punctuation-only tokens are therefore skipped, except commas, which separate listed
 * places and are never duplicated. Every other token must be found in the transcript at or after
 * the end of the previous one.
 *
 * <p>With square-bracket hinting, a bracketed annotation such as "Buffalo [New York]" is folded
 * into the candidate it follows. A candidate may also start with an annotation, in which case its
 * type is taken from the first typed token inside or right after it.
 */
@Component
public class StanfordNerPolisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(StanfordNerPolisher.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private static final String OPEN_BRACKET = "[";
  private static final String CLOSE_BRACKET = "]";
  private static final String PARAGRAPH_BREAK = "\n\n";

  private static final Map<String, String> ESCAPES =
      Map.of(
          "-LSB-", "[",
          "-RSB-", "]",
          "-LRB-", "(",
          "-RRB-", ")",
          "-LCB-", "{",
          "-RCB-", "}");

  private final NerProperties properties;

  public StanfordNerPolisher(NerProperties properties) {
    this.properties = properties;
  }

  public ProcessingResult<List<NamedEntity>> polish(Path taggedFile, String transcript)
      throws IOException {
    return polish(Files.readAllLines(taggedFile, StandardCharsets.UTF_8), transcript);
  }

  /**
   * Rebuild candidates from tagged token lines.
   *
   * @param tokenLines the tagger output, one token per line
   * @param transcript the text that was tagged
   * @return the candidates in transcript order, or a failure when a token cannot be found in the
   *     transcript or an opening bracket is never closed
   */
  public ProcessingResult<List<NamedEntity>> polish(List<String> tokenLines, String transcript) {
    List<Token> tokens = new ArrayList<>();
    for (String line : tokenLines) {
      Token token = parseLine(line);
      if (token != null) {
        tokens.add(token);
      }
    }

    List<NamedEntity> entities = new ArrayList<>();
    int offset = 0;
    int index = 0;
    while (index < tokens.size()) {
      Token token = tokens.get(index++);
      int found = transcript.indexOf(token.text(), offset);
      if (found < 0) {
        return desync(token, offset);
      }
      offset = found + token.text().length();

      boolean opensBracket = properties.squareBracketHinting() && token.isOpenBracket();
      if (token.type() == EntityType.UNSET && !opensBracket) {
        continue;
      }

      PendingEntity entity = new PendingEntity(token.text(), found, token.type());
      boolean bracketPrefix = opensBracket;
      int depth = opensBracket ? 1 : 0;

      // Tokens that end the candidate are left for the outer loop.
      while (index < tokens.size()) {
        Token next = tokens.get(index);
        int nextFound = transcript.indexOf(next.text(), offset);
        if (nextFound < 0) {
          return desync(next, offset);
        }

        if (depth > 0) {
          if (next.isOpenBracket()) {
            depth++;
          } else if (next.isCloseBracket()) {
            depth--;
          } else if (bracketPrefix
              && entity.type == EntityType.UNSET
              && next.type() != EntityType.UNSET) {
            entity.type = next.type();
          }
        } else if (properties.paragraphBreaks()
            && transcript
                .substring(entity.start, nextFound + next.text().length())
                .contains(PARAGRAPH_BREAK)) {
          break;
        } else if (properties.squareBracketHinting() && next.isOpenBracket()) {
          depth = 1;
        } else {
          if (bracketPrefix) {
            bracketPrefix = false;
            if (next.type() == EntityType.UNSET) {
              break;
            }
            entity.type = next.type();
          }
          if (next.type() != entity.type) {
            break;
          }
        }

        index++;
        entity.append(next.text());
        offset = nextFound + next.text().length();
      }

      if (depth > 0) {
        LOGGER.error(
            "Square brackets mismatched: candidate starting at {} never closed", entity.start);
        return ProcessingResult.failure("Square brackets mismatched");
      }
      if (entity.type != EntityType.UNSET) {
        entities.add(entity.toNamedEntity(transcript, offset));
      }
    }

    LOGGER.debug("Rebuilt {} entity candidates from {} tokens", entities.size(), tokens.size());
    return ProcessingResult.success(entities);
  }

  private static ProcessingResult<List<NamedEntity>> desync(Token token, int offset) {
    STRUCTURED_LOGGER.logNerDesync(token.text(), offset);
    return ProcessingResult.failure(
        String.format("Transcript has no '%s' at or after offset %d", token.text(), offset));
  }

  /** The token as it appears in the transcript, or null for lines to skip. */
  static Token parseLine(String line) {
    String[] pieces = line.split("\t", -1);
    if (pieces.length != 2 || pieces[0].isEmpty()) {
      return null;
    }
    String text = sourceForm(pieces[0]);
    return text.isEmpty() ? null : new Token(text, typeFor(pieces[1]));
  }

  static String sourceForm(String tagged) {
    String exact = ESCAPES.get(tagged);
    if (exact != null) {
      return exact;
    }
    if (tagged.equals(",")) {
      return tagged;
    }

    String text = tagged;
    for (Map.Entry<String, String> escape : ESCAPES.entrySet()) {
      text = text.replace(escape.getKey(), escape.getValue());
    }
    if (text.chars().anyMatch(Character::isLetterOrDigit)) {
      return toLatin1(text);
    }
    // the tagger folds brackets into runs of punctuation, e.g. ":]"
    if (text.contains(OPEN_BRACKET)) {
      return OPEN_BRACKET;
    }
    if (text.contains(CLOSE_BRACKET)) {
      return CLOSE_BRACKET;
    }
    return "";
  }

  private static String toLatin1(String text) {
    StringBuilder mapped = null;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) > 255) {
        if (mapped == null) {
          LOGGER.warn("Non-Latin-1 character at offset {} within '{}'", i, text);
          mapped = new StringBuilder(text);
        }
        mapped.setCharAt(i, ' ');
      }
    }
    return mapped == null ? text : mapped.toString();
  }

  static EntityType typeFor(String tag) {
    switch (tag.trim()) {
      case "PERSON":
        return EntityType.PERSON;
      case "LOCATION":
        return EntityType.LOC;
      case "ORGANIZATION":
        return EntityType.ORG;
      default:
        return EntityType.UNSET;
    }
  }

  record Token(String text, EntityType type) {

    boolean isOpenBracket() {
      return OPEN_BRACKET.equals(text);
    }

    boolean isCloseBracket() {
      return CLOSE_BRACKET.equals(text);
    }
  }

  private static final class PendingEntity {
    private final StringBuilder text;
    private final int start;
    private EntityType type;

    private PendingEntity(String text, int start, EntityType type) {
      this.text = new StringBuilder(text);
      this.start = start;
      this.type = type;
    }

    private void append(String token) {
      text.append(' ').append(token);
    }

    private NamedEntity toNamedEntity(String transcript, int end) {
      return new NamedEntity(
          text.toString(),
          transcript.substring(start, end),
          start,
          end - start,
          type,
          "stanford",
          false,
          EntityConfidence.NONE);
    }
  }
}
