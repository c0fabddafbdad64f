package com.scholary.oralhistory.entity.location;

/** A place name that is unambiguous enough to resolve without a state qualifier. */
public record CityHint(String name, String stateAlpha, int stateId, int placeId) {}
