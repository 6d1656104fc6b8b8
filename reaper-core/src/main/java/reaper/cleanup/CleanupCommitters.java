package reaper.cleanup;

import reaper.ReaperConfig;

import java.util.Objects;

/**
 * Creates the committer selected by {@link ReaperConfig#immediateCleanup()}.
 */
public final class CleanupCommitters {

    private CleanupCommitters() {
    }

    public static CleanupCommitter forConfig(ReaperConfig config, CatalogCleaner catalogCleaner) {
        Objects.requireNonNull(config, "config");
        if (config.immediateCleanup()) {
            return new IncrementalCleanupCommitter(catalogCleaner, config.dbBatchSize());
        }
        return new DeferredCleanupCommitter();
    }
}
