package com.kg.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the graph document and the service lifecycle.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "kg")
public class KnowledgeGraphConfig {

    private StoreConfig store = new StoreConfig();

    private LifecycleConfig lifecycle = new LifecycleConfig();

    @Getter
    @Setter
    public static class StoreConfig {

        /**
         * Location of the persisted graph document.
         */
        private String path = "amadeus/knowledge_graph.json";

        /**
         * Directory holding timestamped graph backups.
         */
        private String backupDirectory = "amadeus/backups";

        /**
         * Load the document from disk at startup when it exists.
         */
        private boolean loadOnStartup = true;
    }

    @Getter
    @Setter
    public static class LifecycleConfig {

        /**
         * Start the ingestion pipeline once the application is ready.
         */
        private boolean autoStart = true;

        /**
         * Time allowed for the subscriber and committer to stop, in seconds.
         */
        private long shutdownTimeoutSeconds = 30;

        /**
         * Default timeout for publishing an update, in milliseconds.
         */
        private long publishTimeoutMs = 5000;
    }
}
