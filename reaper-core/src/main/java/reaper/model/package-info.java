/**
 * Value types shared by the selector, worker, refresher and committers.
 *
 * <p>A {@link reaper.model.Replica} enters the reaper's responsibility when it is
 * claimed ({@link reaper.model.ReplicaState#BEING_DELETED}) and leaves it either by
 * catalog removal or by lease expiry.
 */
package reaper.model;
