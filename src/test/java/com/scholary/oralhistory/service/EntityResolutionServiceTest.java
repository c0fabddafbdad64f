package com.scholary.oralhistory.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.oralhistory.api.StoryResolutionResponse;
import com.scholary.oralhistory.common.ProcessingResult;
import com.scholary.oralhistory.config.NerProperties;
import com.scholary.oralhistory.entity.EntityConfidence;
import com.scholary.oralhistory.entity.EntityType;
import com.scholary.oralhistory.entity.NamedEntity;
import com.scholary.oralhistory.entity.location.DomesticLocationResolver;
import com.scholary.oralhistory.entity.organization.OrganizationResolver;
import com.scholary.oralhistory.ner.SpacyNerPolisher;
import com.scholary.oralhistory.ner.StanfordNerPolisher;
import com.scholary.oralhistory.reference.ReferenceFixtures;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class EntityResolutionServiceTest {

  private EntityResolutionService service;

  @BeforeEach
  void setUp() {
    service =
        new EntityResolutionService(
            new StanfordNerPolisher(new NerProperties(true, true)),
            new SpacyNerPolisher(),
            new DomesticLocationResolver(ReferenceFixtures.locationData()),
            new OrganizationResolver(ReferenceFixtures.corporateNames()));
  }

  @Test
  void resolveStory_shouldResolveLocationsAndOrganizations() {
    List<NamedEntity> candidates =
        List.of(
            new NamedEntity("Pittsburgh", "Pittsburgh", 10, 10, EntityType.LOC),
            new NamedEntity("Carnegie Mellon", "Carnegie Mellon", 40, 15, EntityType.ORG),
            new NamedEntity("Teenie Harris", "Teenie Harris", 70, 13, EntityType.PERSON));

    StoryResolutionResponse response = service.resolveStory("story-7", candidates);

    assertThat(response.storyId()).isEqualTo("story-7");
    assertThat(response.candidateCount()).isEqualTo(3);
    assertThat(response.locations().resolved()).hasSize(1);
    assertThat(response.locations().resolved().get(0).placeId()).isEqualTo(1214818);
    assertThat(response.organizations().resolved()).hasSize(1);
    assertThat(response.organizations().resolved().get(0).authorityId()).isEqualTo("n79054102");
    assertThat(MDC.get("storyId")).isNull();
  }

  private static final List<String> TOKEN_LINES =
      List.of(
          "She\tO",
          "studied\tO",
          "at\tO",
          "Spelman\tORGANIZATION",
          "College\tORGANIZATION",
          "in\tO",
          "Chicago\tLOCATION",
          ".\tO");

  private static final String TRANSCRIPT = "She studied at Spelman College in Chicago.";

  @Test
  void polishAndResolve_shouldResolveRebuiltCandidates() {
    ProcessingResult<StoryResolutionResponse> result =
        service.polishAndResolve("story-8", TOKEN_LINES, null, TRANSCRIPT);

    assertThat(result.isSuccess()).isTrue();
    StoryResolutionResponse response = result.value();
    assertThat(response.candidateCount()).isEqualTo(2);
    assertThat(response.locations().resolved().get(0).stateCode()).isEqualTo(17);
    assertThat(response.organizations().resolved().get(0).authorityId()).isEqualTo("n80015642");
    assertThat(response.organizations().resolved().get(0).confidence())
        .isEqualTo(EntityConfidence.GOOD);
    assertThat(MDC.get("storyId")).isNull();
  }

  @Test
  void polishAndResolve_shouldCarrySpacyAgreementIntoResolutions() {
    ProcessingResult<StoryResolutionResponse> result =
        service.polishAndResolve(
            "story-8",
            TOKEN_LINES,
            List.of("text,start,end,label", "Spelman College,15,30,ORG", "Chicago,34,41,GPE"),
            TRANSCRIPT);

    assertThat(result.isSuccess()).isTrue();
    StoryResolutionResponse response = result.value();
    assertThat(response.candidateCount()).isEqualTo(2);
    assertThat(response.locations().resolved().get(0).stateCode()).isEqualTo(17);
    assertThat(response.organizations().resolved().get(0).authorityId()).isEqualTo("n80015642");
    assertThat(response.organizations().resolved().get(0).confidence())
        .isEqualTo(EntityConfidence.BETTER);
    assertThat(response.organizations().resolved().get(0).entity().duelCoverage()).isTrue();
  }

  @Test
  void polishAndResolve_shouldFailWhenTaggerOutputDoesNotMatch() {
    ProcessingResult<StoryResolutionResponse> result =
        service.polishAndResolve("story-9", List.of("Chicago\tLOCATION"), null, "Savannah");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.error()).contains("'Chicago'");
  }

  @Test
  void polishAndResolve_shouldFailWhenSpacyOutputDoesNotMatch() {
    ProcessingResult<StoryResolutionResponse> result =
        service.polishAndResolve(
            "story-9",
            TOKEN_LINES,
            List.of("text,start,end,label", "Chicago,30,37,GPE"),
            TRANSCRIPT);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.error()).contains("spaCy entity 'Chicago'");
    assertThat(MDC.get("storyId")).isNull();
  }
}
