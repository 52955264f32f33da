package com.kg.core.service.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kg.core.service.config.IngestionConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka implementation of the event bus.
 *
 * Envelopes travel as JSON strings keyed by their id. Offsets are committed after
 * each poll, once every record of the poll has been handed to the handler.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaEventBus implements EventBus {

    private static final String CLIENT_ID_SUFFIX = "-subscriber";

    private final ConsumerFactory<String, String> consumerFactory;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final IngestionConfig ingestionConfig;

    @Override
    public void subscribe(List<String> topics, String consumerGroup, SubscriptionHandler handler,
                          CancellationSignal cancellation) {
        var pollTimeout = Duration.ofMillis(ingestionConfig.getSubscriber().getPollTimeoutMs());
        try (Consumer<String, String> consumer = consumerFactory.createConsumer(consumerGroup, CLIENT_ID_SUFFIX)) {
            consumer.subscribe(topics);
            boolean announced = false;
            while (!cancellation.isCancelled()) {
                ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
                if (!announced) {
                    handler.onSubscribed();
                    announced = true;
                }
                for (ConsumerRecord<String, String> record : records) {
                    decode(record).ifPresent(handler::onEnvelope);
                }
                // a cancelled poll may hold unbuffered records; leave them for redelivery
                if (!records.isEmpty() && !cancellation.isCancelled()) {
                    consumer.commitSync();
                }
            }
        } catch (KafkaException e) {
            throw new BusException("Subscription to " + topics + " failed: " + e.getMessage(), e);
        }
    }

    private Optional<EventEnvelope> decode(ConsumerRecord<String, String> record) {
        try {
            return Optional.of(objectMapper.readValue(record.value(), EventEnvelope.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to decode event at {}-{}@{}: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String emit(EventEnvelope envelope, Duration timeout) {
        String json;
        try {
            json = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new BusException("Failed to encode event " + envelope.id(), e);
        }

        try {
            SendResult<String, String> result = kafkaTemplate.send(envelope.type(), envelope.id(), json)
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            RecordMetadata metadata = result.getRecordMetadata();
            return metadata.topic() + "-" + metadata.partition() + "@" + metadata.offset();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusException("Interrupted while publishing event " + envelope.id(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new BusException("Failed to publish event " + envelope.id() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new BusException("Event bus refused event " + envelope.id() + ": " + e.getMessage(), e);
        }
    }
}
