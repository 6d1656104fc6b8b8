package reaper.jdbc;

import reaper.ReaperException;

/**
 * Unchecked exception wrapping JDBC errors thrown by
 * {@link reaper.jdbc.store.AbstractJdbcReplicaStore} and its subclasses.
 */
public final class ReplicaStoreException extends ReaperException {
  public ReplicaStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
