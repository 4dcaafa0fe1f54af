package com.len.stakequeue.domain.event;

public record WalletRegistered(String walletId, long occurredAtMs) implements RegistryEvent {

    @Override
    public String type() {
        return "WalletRegistered";
    }

    @Override
    public String key() {
        return walletId;
    }
}
