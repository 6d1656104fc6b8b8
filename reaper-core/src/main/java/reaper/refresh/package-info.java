/**
 * Lease extension for replicas a worker has claimed but not yet processed.
 *
 * @see reaper.refresh.LeaseRefresher
 */
package reaper.refresh;
