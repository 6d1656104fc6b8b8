package reaper.model;

import java.util.Objects;

/**
 * Result of one physical deletion attempt. Only succeeded outcomes are ever
 * removed from the catalog.
 *
 * @param replica   the replica the attempt was made for
 * @param succeeded whether the storage endpoint confirmed the deletion
 * @param error     failure description, {@code null} on success
 */
public record DeletionOutcome(Replica replica, boolean succeeded, String error) {

  public DeletionOutcome {
    Objects.requireNonNull(replica, "replica");
  }

  public static DeletionOutcome succeeded(Replica replica) {
    return new DeletionOutcome(replica, true, null);
  }

  public static DeletionOutcome failed(Replica replica, String error) {
    return new DeletionOutcome(replica, false, error);
  }
}
