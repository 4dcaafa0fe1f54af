package com.len.stakequeue.domain.event;

import java.util.List;

public interface EventNotifier {

    void publish(RegistryEvent event);

    default void publishAll(List<? extends RegistryEvent> events) {
        for (RegistryEvent event : events) {
            publish(event);
        }
    }
}
