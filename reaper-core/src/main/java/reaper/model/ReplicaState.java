package reaper.model;

/**
 * Replica states as stored in the catalog. Only {@link #AVAILABLE} and
 * {@link #BEING_DELETED} take part in lease coordination.
 */
public enum ReplicaState {
  AVAILABLE("A"),
  UNAVAILABLE("U"),
  COPYING("C"),
  BEING_DELETED("B"),
  BAD("D"),
  TEMPORARY_UNAVAILABLE("T");

  private final String code;

  ReplicaState(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static ReplicaState fromCode(String code) {
    if (code != null) {
      String trimmed = code.trim();
      for (ReplicaState state : values()) {
        if (state.code.equals(trimmed)) {
          return state;
        }
      }
    }
    throw new IllegalArgumentException("Unknown replica state code: " + code);
  }
}
