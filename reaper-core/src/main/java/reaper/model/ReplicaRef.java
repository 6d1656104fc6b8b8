package reaper.model;

import java.util.Objects;

/**
 * Identity of one physical copy: {@code scope} and {@code name} identify the data
 * object, {@code rseId} the storage location holding it.
 */
public record ReplicaRef(String scope, String name, String rseId) {

  public ReplicaRef {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(rseId, "rseId");
  }

  @Override
  public String toString() {
    return scope + ":" + name + "@" + rseId;
  }
}
