package com.len.stakequeue.domain.event;

public record TokensTransferred(
        String from,
        String to,
        long regularAmount,
        long restrictedAmount,
        long occurredAtMs
) implements RegistryEvent {

    @Override
    public String type() {
        return "TokensTransferred";
    }

    @Override
    public String key() {
        return from;
    }
}
