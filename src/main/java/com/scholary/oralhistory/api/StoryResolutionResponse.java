package com.scholary.oralhistory.api;

import com.scholary.oralhistory.entity.LocationEntity;
import com.scholary.oralhistory.entity.OrganizationalEntity;
import com.scholary.oralhistory.entity.ResolutionResult;

/** Location and organization resolutions for one story. */
public record StoryResolutionResponse(
    String storyId,
    int candidateCount,
    ResolutionResult<LocationEntity> locations,
    ResolutionResult<OrganizationalEntity> organizations) {}
