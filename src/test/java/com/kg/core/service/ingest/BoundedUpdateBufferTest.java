package com.kg.core.service.ingest;

import com.kg.core.service.bus.CancellationSignal;
import com.kg.core.service.config.IngestionConfig;
import com.kg.core.service.support.TestObjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class BoundedUpdateBufferTest {

    private BoundedUpdateBuffer buffer;

    @BeforeEach
    void setUp() {
        IngestionConfig config = TestObjects.fastIngestionConfig();
        config.getBuffer().setCapacity(2);
        buffer = new BoundedUpdateBuffer(config, TestObjects.metrics());
        buffer.init();
    }

    private static UpdateRecord record(String id) {
        return new UpdateRecord(id, UpdateType.SCHEMA_UPDATE, "svc", null, null, "1.0");
    }

    @Test
    @DisplayName("Records come out in insertion order")
    void fifo() {
        CancellationSignal signal = new CancellationSignal();
        buffer.put(record("a"), signal);
        buffer.put(record("b"), signal);

        assertThat(buffer.isFull()).isTrue();
        assertThat(buffer.getUtilizationPercent()).isEqualTo(100);
        assertThat(buffer.poll(10).orElseThrow().id()).isEqualTo("a");
        assertThat(buffer.poll(10).orElseThrow().id()).isEqualTo("b");
        assertThat(buffer.poll(10)).isEmpty();
    }

    @Test
    @DisplayName("Put blocks while full and resumes when space frees up")
    void backpressure() {
        CancellationSignal signal = new CancellationSignal();
        buffer.put(record("a"), signal);
        buffer.put(record("b"), signal);

        CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> buffer.put(record("c"), signal));

        await().during(100, TimeUnit.MILLISECONDS).atMost(1, TimeUnit.SECONDS)
                .until(() -> !blocked.isDone());
        buffer.poll(10);
        await().atMost(2, TimeUnit.SECONDS).until(blocked::isDone);
        assertThat(blocked.join()).isTrue();
        assertThat(buffer.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Cancellation releases a blocked put without adding the record")
    void cancellationReleasesPut() {
        CancellationSignal signal = new CancellationSignal();
        buffer.put(record("a"), signal);
        buffer.put(record("b"), signal);

        CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> buffer.put(record("c"), signal));
        signal.cancel();

        await().atMost(2, TimeUnit.SECONDS).until(blocked::isDone);
        assertThat(blocked.join()).isFalse();
        assertThat(buffer.size()).isEqualTo(2);
    }
}
