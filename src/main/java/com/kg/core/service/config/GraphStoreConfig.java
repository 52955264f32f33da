package com.kg.core.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kg.core.service.graph.FileBackedGraphStore;
import com.kg.core.service.graph.GraphDocumentCodec;
import com.kg.core.service.graph.GraphStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the graph store and the clock shared by every timestamping component.
 */
@Slf4j
@Configuration
public class GraphStoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GraphStore graphStore(ObjectMapper objectMapper, Clock clock, KnowledgeGraphConfig config) {
        KnowledgeGraphConfig.StoreConfig storeConfig = config.getStore();
        FileBackedGraphStore store = new FileBackedGraphStore(
                new GraphDocumentCodec(objectMapper), clock, Path.of(storeConfig.getBackupDirectory()));
        if (storeConfig.isLoadOnStartup()) {
            store.openOrInitialize(Path.of(storeConfig.getPath()));
        } else {
            log.info("Graph loading disabled, starting from an empty document");
            store.initializeEmpty();
        }
        return store;
    }
}
