package com.scholary.oralhistory.entity;

/**
 * Confidence levels for entity resolution. Bumps are cumulative evidence, capped at {@link
 * #BETTER}.
 */
public final class EntityConfidence {

  public static final int NONE = 0;
  public static final int SOME = 1;
  public static final int GOOD = 2;
  public static final int BETTER = 3;

  private EntityConfidence() {}

  public static int boost(int confidence, int amount) {
    return Math.min(BETTER, confidence + amount);
  }
}
