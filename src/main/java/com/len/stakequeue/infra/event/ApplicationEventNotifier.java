package com.len.stakequeue.infra.event;

import com.len.stakequeue.domain.event.EventNotifier;
import com.len.stakequeue.domain.event.RegistryEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * 동기 in-process 발행. 리스너(SSE, Kafka relay)는 호출 스레드에서 순서대로 실행된다.
 */
@Component
@RequiredArgsConstructor
public class ApplicationEventNotifier implements EventNotifier {

    private final ApplicationEventPublisher publisher;

    @Override
    public void publish(RegistryEvent event) {
        publisher.publishEvent(event);
    }
}
