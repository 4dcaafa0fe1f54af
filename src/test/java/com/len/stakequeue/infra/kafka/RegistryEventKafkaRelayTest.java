package com.len.stakequeue.infra.kafka;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.stakequeue.domain.event.EnteredQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class RegistryEventKafkaRelayTest {

    private static final String TOPIC = "stake-registry.events.test";
    private static final int MAX_ATTEMPTS = 3;

    @SuppressWarnings("unchecked")
    private final KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private RegistryEventKafkaRelay relay;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        relay = newRelay(100);
    }

    private RegistryEventKafkaRelay newRelay(int maxPending) {
        return new RegistryEventKafkaRelay(
                kafkaTemplate, objectMapper, meterRegistry, TOPIC,
                maxPending, 100, 1_000L, MAX_ATTEMPTS);
    }

    private double relayed(String result) {
        var counter = meterRegistry.find("registry.relay.events").tag("result", result).counter();
        return counter == null ? 0.0 : counter.count();
    }

    private static EnteredQueue entered(long externalId) {
        return new EnteredQueue(externalId, "alice", 38L, 0, 1_000L);
    }

    private static CompletableFuture<SendResult<String, String>> ok() {
        return CompletableFuture.completedFuture(null);
    }

    private static CompletableFuture<SendResult<String, String>> brokerDown() {
        return CompletableFuture.failedFuture(new IllegalStateException("broker down"));
    }

    @Test
    @DisplayName("리스너는 큐에 쌓기만 하고 Kafka 는 건드리지 않는다")
    void relay_onlyEnqueues() {
        relay.relay(entered(7L));

        assertThat(relay.pendingCount()).isEqualTo(1);
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    @DisplayName("publishPending: externalId 를 키로 envelope JSON 을 발행한다")
    void publishPending_sendsEnvelope() throws Exception {
        given(kafkaTemplate.send(anyString(), anyString(), anyString())).willReturn(ok());

        relay.relay(entered(7L));
        relay.publishPending();

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("7"), json.capture());

        JsonNode node = objectMapper.readTree(json.getValue());
        assertThat(node.get("type").asText()).isEqualTo("EnteredQueue");
        assertThat(node.get("occurredAtMs").asLong()).isEqualTo(1_000L);
        assertThat(node.get("payload").get("stakedCoins").asLong()).isEqualTo(38L);
        assertThat(relayed("published")).isEqualTo(1.0);
        assertThat(relay.pendingCount()).isZero();
    }

    @Test
    @DisplayName("브로커 실패는 head 에 남겨 재시도하고, 순서는 유지된다")
    void publishPending_retryKeepsOrder() {
        given(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .willReturn(brokerDown(), ok(), ok());

        relay.relay(entered(7L));
        relay.relay(entered(8L));

        assertThatCode(relay::publishPending).doesNotThrowAnyException();
        assertThat(relay.pendingCount()).isEqualTo(2);
        assertThat(relayed("retry")).isEqualTo(1.0);

        relay.publishPending();

        InOrder order = inOrder(kafkaTemplate);
        order.verify(kafkaTemplate, times(2)).send(eq(TOPIC), eq("7"), anyString());
        order.verify(kafkaTemplate).send(eq(TOPIC), eq("8"), anyString());
        assertThat(relayed("published")).isEqualTo(2.0);
        assertThat(relay.pendingCount()).isZero();
    }

    @Test
    @DisplayName("최대 시도 횟수를 넘기면 버리고 failed 로 남긴다")
    void publishPending_givesUpAfterMaxAttempts() {
        given(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .willThrow(new KafkaException("producer closed"));

        relay.relay(entered(7L));
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            relay.publishPending();
        }

        assertThat(relayed("retry")).isEqualTo(MAX_ATTEMPTS - 1);
        assertThat(relayed("failed")).isEqualTo(1.0);
        assertThat(relay.pendingCount()).isZero();
    }

    @Test
    @DisplayName("pending 큐가 가득 차면 dropped 로 남기고 예외는 없다")
    void relay_queueFull_dropsAndCounts() {
        relay = newRelay(1);

        relay.relay(entered(7L));
        assertThatCode(() -> relay.relay(entered(8L))).doesNotThrowAnyException();

        assertThat(relay.pendingCount()).isEqualTo(1);
        assertThat(relayed("dropped")).isEqualTo(1.0);
    }
}
