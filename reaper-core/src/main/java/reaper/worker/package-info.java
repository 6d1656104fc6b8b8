/**
 * Chunked physical deletion of claimed batches.
 *
 * @see reaper.worker.DeletionWorker
 */
package reaper.worker;
