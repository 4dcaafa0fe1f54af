package com.len.stakequeue.domain.event;

/**
 * externalId 항목의 위치가 바뀌었음 (queueSize 는 변경 후 크기).
 */
public record QueueUpdated(
        long externalId,
        int position,
        int queueSize,
        long occurredAtMs
) implements RegistryEvent {

    @Override
    public String type() {
        return "QueueUpdated";
    }

    @Override
    public String key() {
        return String.valueOf(externalId);
    }
}
