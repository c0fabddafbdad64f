package com.scholary.oralhistory.entity.location;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/** Read-only state table, gazetteer and city hints used by the location resolver. */
public final class LocationReferenceData {

  private final List<UsState> states;
  private final Map<Integer, UsState> statesById;
  private final Map<Integer, Map<String, Integer>> placesByState;
  private final Map<String, CityHint> cityHints;

  public LocationReferenceData(
      List<UsState> states,
      Map<Integer, Map<String, Integer>> placesByState,
      Map<String, CityHint> cityHints) {
    this.states = List.copyOf(states);

    Map<Integer, UsState> byId = new LinkedHashMap<>();
    for (UsState state : this.states) {
      byId.put(state.stateId(), state);
    }
    this.statesById = Collections.unmodifiableMap(byId);

    Map<Integer, Map<String, Integer>> places = new LinkedHashMap<>();
    placesByState.forEach((stateId, names) -> places.put(stateId, Map.copyOf(names)));
    this.placesByState = Collections.unmodifiableMap(places);
    this.cityHints = Map.copyOf(cityHints);
  }

  /** States in ascending state-code order. */
  public List<UsState> states() {
    return states;
  }

  public Optional<UsState> state(int stateId) {
    return Optional.ofNullable(statesById.get(stateId));
  }

  /** USGS place id for {@code name} within the state, if the gazetteer has it. */
  public OptionalInt placeId(int stateId, String name) {
    Integer placeId = placesByState.getOrDefault(stateId, Map.of()).get(name);
    return placeId == null ? OptionalInt.empty() : OptionalInt.of(placeId);
  }

  public Optional<CityHint> cityHint(String name) {
    return Optional.ofNullable(cityHints.get(name));
  }

  /** Two-letter code for the state, or "unknown". */
  public String codeToAlpha(int stateId) {
    UsState state = statesById.get(stateId);
    return state == null ? "unknown" : state.alpha();
  }
}
