/**
 * Catalog cleanup of successfully deleted replicas.
 *
 * <p>{@link reaper.cleanup.DeferredCleanupCommitter} hands all successes back at the end of
 * a batch; {@link reaper.cleanup.IncrementalCleanupCommitter} removes them in fixed-size
 * slices while the batch runs, spreading database load over the batch's duration.
 *
 * @see reaper.cleanup.CleanupCommitters
 */
package reaper.cleanup;
