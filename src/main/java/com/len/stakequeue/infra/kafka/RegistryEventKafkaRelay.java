package com.len.stakequeue.infra.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.stakequeue.domain.event.RegistryEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 알림을 JSON 으로 Kafka 에 중계한다.
 *
 * <p>리스너는 전역 락 안에서 불리므로 직렬화 후 메모리 pending 큐에 넣기만 한다.
 * 실제 발행은 스케줄러 스레드의 {@link #publishPending()} 가 timeout 을 걸고 한다.
 * 실패한 메시지는 큐 head 에 남겨 두고 다음 tick 에 재시도한다 (발행 순서 유지).
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "registry.kafka.enabled", havingValue = "true")
public class RegistryEventKafkaRelay {

    private static final String METRIC_RELAY = "registry.relay.events";
    private static final String METRIC_LOOP = "registry.relay.publish.loop";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final String topic;
    private final int batchSize;
    private final long publishTimeoutMs;
    private final int maxAttempts;

    private final BlockingQueue<PendingMessage> pending;

    // head 메시지 발행 시도 횟수. publishPending 스레드만 건드린다.
    private int headAttempts;

    public RegistryEventKafkaRelay(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            @Value("${registry.kafka.topic:stake-registry.events.v1}") String topic,
            @Value("${registry.kafka.max-pending:10000}") int maxPending,
            @Value("${registry.kafka.batch-size:100}") int batchSize,
            @Value("${registry.kafka.publish-timeout-ms:3000}") long publishTimeoutMs,
            @Value("${registry.kafka.max-attempts:5}") int maxAttempts
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.topic = topic;
        this.batchSize = batchSize;
        this.publishTimeoutMs = publishTimeoutMs;
        this.maxAttempts = maxAttempts;
        this.pending = new LinkedBlockingQueue<>(maxPending);
    }

    @EventListener
    public void relay(RegistryEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(RegistryEventMessage.of(event));
        } catch (JsonProcessingException e) {
            count("serialize_failed");
            log.error("[KafkaRelay] serialize failed. type={}, key={}", event.type(), event.key(), e);
            return;
        }

        if (!pending.offer(new PendingMessage(event.type(), event.key(), json))) {
            count("dropped");
            log.warn("[KafkaRelay] pending queue full, dropped. type={}, key={}", event.type(), event.key());
        }
    }

    @Scheduled(fixedDelayString = "${registry.kafka.publish-interval-ms:300}")
    public void publishPending() {
        final long startNs = System.nanoTime();
        int published = 0;

        try {
            while (published < batchSize) {
                PendingMessage message = pending.peek();
                if (message == null) {
                    return;
                }
                try {
                    kafkaTemplate
                            .send(topic, message.key(), message.payload())
                            .get(publishTimeoutMs, TimeUnit.MILLISECONDS);

                    pending.poll();
                    headAttempts = 0;
                    published++;

                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (ExecutionException | TimeoutException | KafkaException e) {
                    onPublishFailure(message, e);
                    return;
                }
            }
        } finally {
            if (published > 0) {
                meterRegistry.counter(METRIC_RELAY, "result", "published").increment(published);
            }
            meterRegistry.timer(METRIC_LOOP).record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    private void onPublishFailure(PendingMessage message, Exception e) {
        headAttempts++;
        if (headAttempts >= maxAttempts) {
            pending.poll();
            headAttempts = 0;
            count("failed");
            log.error("[KafkaRelay] publish failed permanently. type={}, key={}, attempts={}",
                    message.type(), message.key(), maxAttempts, e);
        } else {
            count("retry");
            log.warn("[KafkaRelay] publish retry scheduled. type={}, key={}, attempt={}, err={}",
                    message.type(), message.key(), headAttempts, e.getMessage());
        }
    }

    private void count(String result) {
        meterRegistry.counter(METRIC_RELAY, "result", result).increment();
    }

    private record PendingMessage(String type, String key, String payload) {}
}
