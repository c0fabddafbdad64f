package com.scholary.oralhistory.entity;

/**
 * An organization candidate after resolution.
 *
 * @param authorityId Library of Congress name authority id, empty when unresolved
 * @param count mentions of this organization in the story
 */
public record OrganizationalEntity(
    NamedEntity entity, String authorityId, int confidence, int count) {

  public static OrganizationalEntity unresolved(NamedEntity entity) {
    return new OrganizationalEntity(entity, "", entity.confidence(), 1);
  }

  public boolean isResolved() {
    return !authorityId.isEmpty();
  }
}
