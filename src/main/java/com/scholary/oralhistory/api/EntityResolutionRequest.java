package com.scholary.oralhistory.api;

import com.scholary.oralhistory.entity.NamedEntity;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/** Entity candidates already extracted from one story's transcript. */
public record EntityResolutionRequest(@NotNull List<NamedEntity> candidates) {}
