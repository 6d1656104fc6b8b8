package reaper.spi;

import reaper.model.Replica;

/**
 * Removes the physical copy of a replica from its storage endpoint.
 *
 * <p>Implementations may block on I/O. A {@code false} return or a thrown
 * {@link RuntimeException} both count as a failed deletion: the replica keeps its
 * lease and becomes claimable again once the lease expires.
 */
@FunctionalInterface
public interface PhysicalDeleter {

    /**
     * Deletes the physical data behind {@code replica}.
     *
     * @param replica the claimed replica, including its opaque {@code path} and {@code bytes}
     * @return {@code true} if the storage endpoint confirmed the deletion
     */
    boolean delete(Replica replica);
}
