package com.len.stakequeue.domain.event;

public record EnteredQueue(
        long externalId,
        String walletId,
        long stakedCoins,
        int position,
        long occurredAtMs
) implements RegistryEvent {

    @Override
    public String type() {
        return "EnteredQueue";
    }

    @Override
    public String key() {
        return String.valueOf(externalId);
    }
}
