package reaper.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import reaper.ReaperConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the replica reaper.
 *
 * @see ReaperAutoConfiguration
 */
@ConfigurationProperties(prefix = "reaper")
public class ReaperProperties {

    /**
     * Remove deleted replicas from the catalog while a batch runs instead of after it.
     */
    private boolean enableImmediateCleanup = ReaperConfig.DEFAULT_IMMEDIATE_CLEANUP;

    /**
     * Rows removed from the catalog per delete.
     */
    private int dbBatchSize = ReaperConfig.DEFAULT_DB_BATCH_SIZE;

    /**
     * Percentage of the lease duration after which outstanding leases are refreshed.
     */
    private int refreshTriggerRatio = ReaperConfig.DEFAULT_REFRESH_TRIGGER_RATIO;

    /**
     * Lease duration in seconds; also the age after which a leased replica may be re-claimed.
     */
    private long delaySeconds = ReaperConfig.DEFAULT_DELAY_SECONDS;

    /**
     * Maximum number of replicas claimed per batch.
     */
    private int chunkSize = ReaperConfig.DEFAULT_CHUNK_SIZE;

    /**
     * Replicas deleted between two refresh checks; 0 uses the chunk size.
     */
    private int deletionChunkSize = 0;

    /**
     * Storage locations reaped on every cycle.
     */
    private List<String> rseIds = new ArrayList<>();

    /**
     * Lease owner recorded on claimed rows; generated when empty.
     */
    private String workerId = "";

    /**
     * Delay between two reaping cycles in milliseconds.
     */
    private long intervalMs = 60000;

    /**
     * Catalog table name.
     */
    private String tableName = "replicas";

    /**
     * Start the reaping schedule when the context starts.
     */
    private boolean autoStart = true;

    private final Metrics metrics = new Metrics();

    public boolean isEnableImmediateCleanup() {
        return enableImmediateCleanup;
    }

    public void setEnableImmediateCleanup(boolean enableImmediateCleanup) {
        this.enableImmediateCleanup = enableImmediateCleanup;
    }

    public int getDbBatchSize() {
        return dbBatchSize;
    }

    public void setDbBatchSize(int dbBatchSize) {
        this.dbBatchSize = dbBatchSize;
    }

    public int getRefreshTriggerRatio() {
        return refreshTriggerRatio;
    }

    public void setRefreshTriggerRatio(int refreshTriggerRatio) {
        this.refreshTriggerRatio = refreshTriggerRatio;
    }

    public long getDelaySeconds() {
        return delaySeconds;
    }

    public void setDelaySeconds(long delaySeconds) {
        this.delaySeconds = delaySeconds;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getDeletionChunkSize() {
        return deletionChunkSize;
    }

    public void setDeletionChunkSize(int deletionChunkSize) {
        this.deletionChunkSize = deletionChunkSize;
    }

    public List<String> getRseIds() {
        return rseIds;
    }

    public void setRseIds(List<String> rseIds) {
        this.rseIds = rseIds;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
        this.intervalMs = intervalMs;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "reaper";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
