package com.scholary.oralhistory.entity;

import java.util.List;

/**
 * Resolved and unresolved entities for one story.
 *
 * @param aborted true when the story was found internally inconsistent and nothing was resolved
 */
public record ResolutionResult<T>(List<T> resolved, List<T> unresolved, boolean aborted) {

  public ResolutionResult {
    resolved = List.copyOf(resolved);
    unresolved = List.copyOf(unresolved);
  }

  public static <T> ResolutionResult<T> of(List<T> resolved, List<T> unresolved) {
    return new ResolutionResult<>(resolved, unresolved, false);
  }

  public static <T> ResolutionResult<T> abandoned() {
    return new ResolutionResult<>(List.of(), List.of(), true);
  }
}
