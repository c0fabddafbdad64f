package com.scholary.oralhistory.entity.location;

import java.util.List;

/**
 * A US state (or DC) as keyed in the USGS gazetteer.
 *
 * @param stateId USGS numeric state code, e.g. 42 for Pennsylvania
 * @param usgsId USGS feature id of the state itself
 * @param alpha two-letter postal code
 * @param names spellings that name the state, full name first
 */
public record UsState(int stateId, int usgsId, String alpha, List<String> names) {

  public UsState {
    names = List.copyOf(names);
  }
}
