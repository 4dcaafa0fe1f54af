package com.len.stakequeue.domain.event;

public record StakeChanged(
        long externalId,
        String walletId,
        long previousStake,
        long stakedCoins,
        int position,
        long occurredAtMs
) implements RegistryEvent {

    @Override
    public String type() {
        return "StakeChanged";
    }

    @Override
    public String key() {
        return String.valueOf(externalId);
    }
}
