package com.len.stakequeue.infra.kafka;

import com.len.stakequeue.domain.event.RegistryEvent;

/**
 * Kafka 로 나가는 알림 envelope.
 */
public record RegistryEventMessage(
        String type,
        long occurredAtMs,
        RegistryEvent payload
) {
    public static RegistryEventMessage of(RegistryEvent event) {
        return new RegistryEventMessage(event.type(), event.occurredAtMs(), event);
    }
}
