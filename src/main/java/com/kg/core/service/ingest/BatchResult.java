package com.kg.core.service.ingest;

/**
 * Outcome of committing one batch.
 *
 * @param received   records in the batch
 * @param applied    records written to the cache
 * @param rejected   records skipped by validation or deduplication
 * @param rolledBack whether the pipeline failed and the cache was restored
 * @param backupKey  cache key of the pre-batch backup, null if none was taken
 */
public record BatchResult(int received, int applied, int rejected, boolean rolledBack, String backupKey) {

    static BatchResult empty() {
        return new BatchResult(0, 0, 0, false, null);
    }

    static BatchResult dropped(int received) {
        return new BatchResult(received, 0, 0, false, null);
    }
}
