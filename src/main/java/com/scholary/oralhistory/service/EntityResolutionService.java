package com.scholary.oralhistory.service;

import com.scholary.oralhistory.api.StoryResolutionResponse;
import com.scholary.oralhistory.common.ProcessingResult;
import com.scholary.oralhistory.entity.LocationEntity;
import com.scholary.oralhistory.entity.NamedEntity;
import com.scholary.oralhistory.entity.OrganizationalEntity;
import com.scholary.oralhistory.entity.ResolutionResult;
import com.scholary.oralhistory.entity.location.DomesticLocationResolver;
import com.scholary.oralhistory.entity.organization.OrganizationResolver;
import com.scholary.oralhistory.logging.StructuredLogger;
import com.scholary.oralhistory.ner.SpacyNerPolisher;
import com.scholary.oralhistory.ner.StanfordNerPolisher;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Runs the location and organization resolvers over one story's candidates. */
@Service
public class EntityResolutionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(EntityResolutionService.class);

  private final StanfordNerPolisher polisher;
  private final SpacyNerPolisher spacyPolisher;
  private final DomesticLocationResolver locationResolver;
  private final OrganizationResolver organizationResolver;

  public EntityResolutionService(
      StanfordNerPolisher polisher,
      SpacyNerPolisher spacyPolisher,
      DomesticLocationResolver locationResolver,
      OrganizationResolver organizationResolver) {
    this.polisher = polisher;
    this.spacyPolisher = spacyPolisher;
    this.locationResolver = locationResolver;
    this.organizationResolver = organizationResolver;
  }

  public StoryResolutionResponse resolveStory(String storyId, List<NamedEntity> candidates) {
    StructuredLogger.setStoryContext(storyId);
    try {
      return resolve(storyId, candidates);
    } finally {
      StructuredLogger.clearStoryContext();
    }
  }

  /**
   * Rebuild candidates from Stanford NER output, merge in spaCy's spans, then resolve them.
   *
   * @param spacyLines spaCy CSV output with its header row; null or empty leaves every Stanford
   *     candidate at single-tool confidence
   * @return the resolutions, or a failure when either tool's output does not match the transcript
   */
  public ProcessingResult<StoryResolutionResponse> polishAndResolve(
      String storyId, List<String> tokenLines, List<String> spacyLines, String transcript) {
    StructuredLogger.setStoryContext(storyId);
    try {
      ProcessingResult<List<NamedEntity>> stanford = polisher.polish(tokenLines, transcript);
      if (!stanford.isSuccess()) {
        LOGGER.warn("Story {} skipped: {}", storyId, stanford.error());
        return ProcessingResult.failure(stanford.error());
      }
      ProcessingResult<List<NamedEntity>> candidates =
          spacyPolisher.polish(
              spacyLines == null ? List.of() : spacyLines, transcript, stanford.value());
      if (!candidates.isSuccess()) {
        LOGGER.warn("Story {} skipped: {}", storyId, candidates.error());
      }
      return candidates.map(merged -> resolve(storyId, merged));
    } finally {
      StructuredLogger.clearStoryContext();
    }
  }

  private StoryResolutionResponse resolve(String storyId, List<NamedEntity> candidates) {
    LOGGER.info("Resolving {} candidates for story {}", candidates.size(), storyId);
    ResolutionResult<LocationEntity> locations = locationResolver.resolve(candidates);
    ResolutionResult<OrganizationalEntity> organizations = organizationResolver.resolve(candidates);
    return new StoryResolutionResponse(storyId, candidates.size(), locations, organizations);
  }
}
