package dev.schedin.schedule;

/** Recurrence class of a scheduling expression, named by its leading {@code @} keyword. */
public enum Routine {
  ONCE("@once"),
  EVERY("@every"),
  DAILY("@daily"),
  /** An {@code @} keyword that is not part of the grammar */
  INVALID(null);

  private final String keyword;

  Routine(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }

  /** Classifies a routine token. Keywords are case-sensitive. */
  public static Routine fromKeyword(String token) {
    for (var routine : values()) {
      if (routine.keyword != null && routine.keyword.equals(token)) {
        return routine;
      }
    }
    return INVALID;
  }
}
