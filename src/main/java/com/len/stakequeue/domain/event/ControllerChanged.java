package com.len.stakequeue.domain.event;

public record ControllerChanged(
        String previousController,
        String newController,
        long occurredAtMs
) implements RegistryEvent {

    @Override
    public String type() {
        return "ControllerChanged";
    }

    @Override
    public String key() {
        return newController;
    }
}
