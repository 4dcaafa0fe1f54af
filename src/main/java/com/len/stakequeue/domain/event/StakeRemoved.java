package com.len.stakequeue.domain.event;

public record StakeRemoved(
        long externalId,
        String walletId,
        long refundedCoins,
        long occurredAtMs
) implements RegistryEvent {

    @Override
    public String type() {
        return "StakeRemoved";
    }

    @Override
    public String key() {
        return String.valueOf(externalId);
    }
}
