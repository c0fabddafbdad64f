package com.scholary.oralhistory.ner;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.oralhistory.common.ProcessingResult;
import com.scholary.oralhistory.config.NerProperties;
import com.scholary.oralhistory.entity.EntityConfidence;
import com.scholary.oralhistory.entity.EntityType;
import com.scholary.oralhistory.entity.NamedEntity;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StanfordNerPolisherTest {

  @TempDir Path tempDir;

  private StanfordNerPolisher polisher;

  @BeforeEach
  void setUp() {
    polisher = new StanfordNerPolisher(new NerProperties(true, true));
  }

  @Test
  void polish_shouldJoinAdjacentTokensOfSameType() {
    List<NamedEntity> entities =
        polish(
            "I met Rosa Parks in Montgomery.",
            "I\tO",
            "met\tO",
            "Rosa\tPERSON",
            "Parks\tPERSON",
            "in\tO",
            "Montgomery\tLOCATION",
            ".\tO");

    assertThat(entities).hasSize(2);
    NamedEntity person = entities.get(0);
    assertThat(person.text()).isEqualTo("Rosa Parks");
    assertThat(person.contextualizedText()).isEqualTo("Rosa Parks");
    assertThat(person.startOffset()).isEqualTo(6);
    assertThat(person.length()).isEqualTo(10);
    assertThat(person.type()).isEqualTo(EntityType.PERSON);
    assertThat(person.sourceHint()).isEqualTo("stanford");
    assertThat(person.confidence()).isEqualTo(EntityConfidence.NONE);
    assertThat(entities.get(1).text()).isEqualTo("Montgomery");
    assertThat(entities.get(1).type()).isEqualTo(EntityType.LOC);
    assertThat(entities.get(1).startOffset()).isEqualTo(20);
  }

  @Test
  void polish_shouldFoldBracketedAnnotationIntoCandidate() {
    List<NamedEntity> entities =
        polish(
            "We moved to Buffalo [New York] in 1950.",
            "We\tO",
            "moved\tO",
            "to\tO",
            "Buffalo\tLOCATION",
            "-LSB-\tO",
            "New\tLOCATION",
            "York\tLOCATION",
            "-RSB-\tO",
            "in\tO",
            "1950\tO",
            ".\tO");

    assertThat(entities).hasSize(1);
    NamedEntity location = entities.get(0);
    assertThat(location.text()).isEqualTo("Buffalo [ New York ]");
    assertThat(location.contextualizedText()).isEqualTo("Buffalo [New York]");
    assertThat(location.startOffset()).isEqualTo(12);
    assertThat(location.length()).isEqualTo(18);
  }

  @Test
  void polish_shouldTypeLeadingAnnotationFromTokensInside() {
    List<NamedEntity> entities =
        polish(
            "She taught at [Spelman] College.",
            "She\tO",
            "taught\tO",
            "at\tO",
            "-LSB-\tO",
            "Spelman\tORGANIZATION",
            "-RSB-\tO",
            "College\tORGANIZATION",
            ".\tO");

    assertThat(entities).hasSize(1);
    assertThat(entities.get(0).type()).isEqualTo(EntityType.ORG);
    assertThat(entities.get(0).text()).isEqualTo("[ Spelman ] College");
    assertThat(entities.get(0).contextualizedText()).isEqualTo("[Spelman] College");
  }

  @Test
  void polish_shouldSplitListedPlacesAtComma() {
    List<NamedEntity> entities =
        polish(
            "From Chicago, Illinois.",
            "From\tO",
            "Chicago\tLOCATION",
            ",\tO",
            "Illinois\tLOCATION",
            ".\tO");

    assertThat(entities).extracting(NamedEntity::text).containsExactly("Chicago", "Illinois");
    assertThat(entities).extracting(NamedEntity::startOffset).containsExactly(5, 14);
  }

  @Test
  void polish_shouldStartNewCandidateAtTypeChange() {
    List<NamedEntity> entities =
        polish(
            "Rosa Parks Montgomery", "Rosa\tPERSON", "Parks\tPERSON", "Montgomery\tLOCATION");

    assertThat(entities).extracting(NamedEntity::text).containsExactly("Rosa Parks", "Montgomery");
    assertThat(entities)
        .extracting(NamedEntity::type)
        .containsExactly(EntityType.PERSON, EntityType.LOC);
  }

  @Test
  void polish_shouldEndCandidateAtParagraphBreak() {
    String transcript = "I asked Rosa\n\nParks said no.";
    String[] lines = {"I\tO", "asked\tO", "Rosa\tPERSON", "Parks\tPERSON", "said\tO", "no\tO"};

    assertThat(polish(transcript, lines))
        .extracting(NamedEntity::text)
        .containsExactly("Rosa", "Parks");

    StanfordNerPolisher ignoringBreaks = new StanfordNerPolisher(new NerProperties(true, false));
    List<NamedEntity> joined = ignoringBreaks.polish(List.of(lines), transcript).value();
    assertThat(joined).extracting(NamedEntity::text).containsExactly("Rosa Parks");
    assertThat(joined.get(0).contextualizedText()).isEqualTo("Rosa\n\nParks");
  }

  @Test
  void polish_shouldTreatBracketsAsPlainTokensWithoutHinting() {
    StanfordNerPolisher plain = new StanfordNerPolisher(new NerProperties(false, true));

    ProcessingResult<List<NamedEntity>> result =
        plain.polish(
            List.of(
                "Buffalo\tLOCATION", "-LSB-\tO", "New\tLOCATION", "York\tLOCATION", "-RSB-\tO"),
            "Buffalo [New York]");

    assertThat(result.value()).extracting(NamedEntity::text).containsExactly("Buffalo", "New York");
  }

  @Test
  void polish_shouldFailWhenTokenIsMissingFromTranscript() {
    ProcessingResult<List<NamedEntity>> result =
        polisher.polish(List.of("Hello\tO", "world\tO"), "Hello there");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.error()).isEqualTo("Transcript has no 'world' at or after offset 5");
  }

  @Test
  void polish_shouldFailOnUnclosedBracket() {
    ProcessingResult<List<NamedEntity>> result =
        polisher.polish(
            List.of("Buffalo\tLOCATION", "-LSB-\tO", "New\tLOCATION", "York\tLOCATION"),
            "Buffalo [New York");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.error()).isEqualTo("Square brackets mismatched");
  }

  @Test
  void polish_shouldReadTaggedFile() throws Exception {
    Path tagged = tempDir.resolve("story.ner");
    List<String> lines = List.of("Howard\tORGANIZATION", "University\tORGANIZATION");
    Files.write(tagged, lines, StandardCharsets.UTF_8);

    ProcessingResult<List<NamedEntity>> result = polisher.polish(tagged, "Howard University");

    assertThat(result.value()).extracting(NamedEntity::text).containsExactly("Howard University");
  }

  @Test
  void parseLine_shouldSkipMalformedLines() {
    assertThat(StanfordNerPolisher.parseLine("Rosa\tPERSON"))
        .isEqualTo(new StanfordNerPolisher.Token("Rosa", EntityType.PERSON));
    assertThat(StanfordNerPolisher.parseLine("no tab here")).isNull();
    assertThat(StanfordNerPolisher.parseLine("\tO")).isNull();
    assertThat(StanfordNerPolisher.parseLine("a\tO\textra")).isNull();
    assertThat(StanfordNerPolisher.parseLine("...\tO")).isNull();
  }

  @Test
  void sourceForm_shouldUndoTaggerEscapes() {
    assertThat(StanfordNerPolisher.sourceForm("-LSB-")).isEqualTo("[");
    assertThat(StanfordNerPolisher.sourceForm("-RRB-")).isEqualTo(")");
    assertThat(StanfordNerPolisher.sourceForm(",")).isEqualTo(",");
    assertThat(StanfordNerPolisher.sourceForm(":]")).isEqualTo("]");
    assertThat(StanfordNerPolisher.sourceForm("?")).isEmpty();
    assertThat(StanfordNerPolisher.sourceForm("O'Neil")).isEqualTo("O'Neil");
    assertThat(StanfordNerPolisher.sourceForm("caf\u00e9")).isEqualTo("caf\u00e9");
    assertThat(StanfordNerPolisher.sourceForm("\u201cSmith\u201d")).isEqualTo(" Smith ");
  }

  @Test
  void typeFor_shouldMapTaggerLabels() {
    assertThat(StanfordNerPolisher.typeFor("PERSON")).isEqualTo(EntityType.PERSON);
    assertThat(StanfordNerPolisher.typeFor("LOCATION ")).isEqualTo(EntityType.LOC);
    assertThat(StanfordNerPolisher.typeFor("ORGANIZATION")).isEqualTo(EntityType.ORG);
    assertThat(StanfordNerPolisher.typeFor("MISC")).isEqualTo(EntityType.UNSET);
  }

  private List<NamedEntity> polish(String transcript, String... lines) {
    ProcessingResult<List<NamedEntity>> result = polisher.polish(List.of(lines), transcript);
    assertThat(result.isSuccess()).as(result.error() == null ? "" : result.error()).isTrue();
    return result.value();
  }
}
