package com.scholary.oralhistory.entity.organization;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only corporate-name tables: authorized names and known synonyms, both mapping to Library of
 * Congress name authority ids.
 */
public final class CorporateNameAuthority {

  private final Map<String, String> authorityIds;
  private final Map<String, String> synonymIds;

  public CorporateNameAuthority(Map<String, String> authorityIds, Map<String, String> synonymIds) {
    this.authorityIds = Map.copyOf(authorityIds);
    this.synonymIds = Map.copyOf(synonymIds);
  }

  public Optional<String> authorityId(String name) {
    return Optional.ofNullable(authorityIds.get(name));
  }

  public Optional<String> synonymId(String name) {
    return Optional.ofNullable(synonymIds.get(name));
  }
}
