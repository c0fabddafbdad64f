package com.scholary.oralhistory.entity;

/**
 * A location candidate after resolution. Zero codes mean unresolved.
 *
 * @param countryCode ISO numeric country code, {@link #US} for every resolved entry
 * @param stateCode USGS numeric state code
 * @param placeId USGS place id; a state-level match uses the state's own USGS id
 * @param count mentions of this place in the story
 */
public record LocationEntity(
    NamedEntity entity, int countryCode, int stateCode, int placeId, int confidence, int count) {

  public static final int US = 840;

  public static LocationEntity unresolved(NamedEntity entity) {
    return new LocationEntity(entity, 0, 0, 0, entity.confidence(), 1);
  }

  public boolean isResolved() {
    return stateCode != 0;
  }
}
