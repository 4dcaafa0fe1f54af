package com.len.stakequeue.domain.event;

/**
 * head 소비. destroyedCoins 는 환불 없이 소멸된다.
 */
public record ItemDequeued(
        long externalId,
        String walletId,
        long destroyedCoins,
        String controller,
        long occurredAtMs
) implements RegistryEvent {

    @Override
    public String type() {
        return "ItemDequeued";
    }

    @Override
    public String key() {
        return String.valueOf(externalId);
    }
}
