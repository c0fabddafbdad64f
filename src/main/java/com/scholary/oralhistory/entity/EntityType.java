package com.scholary.oralhistory.entity;

/** Coarse type of a named-entity candidate. */
public enum EntityType {
  UNSET,
  PERSON,
  LOC,
  ORG,
  YEAR,
  YEAR_PERHAPS,
  SOMETHING_ELSE,
  SOMETHING_TO_IGNORE
}
