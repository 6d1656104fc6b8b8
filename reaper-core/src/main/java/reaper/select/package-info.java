/**
 * Lease-based claiming of replica batches.
 *
 * @see reaper.select.ReplicaSelector
 */
package reaper.select;
