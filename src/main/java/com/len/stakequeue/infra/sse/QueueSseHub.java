package com.len.stakequeue.infra.sse;

import com.len.stakequeue.domain.event.RegistryEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 대기열/원장 알림을 SSE 구독자 전체에 브로드캐스트하는 허브.
 *
 * ✅ 중요
 * - onRegistryEvent 는 전역 락 안에서 불린다 -> 전송은 단일 스레드 dispatcher 에 넘기고 바로 반환
 * - dispatcher 가 스레드 하나라 제출 순서 = 전송 순서
 * - 클라이언트가 끊기는 건 정상 상황 -> IOException 발생, 해당 emitter 는 바로 제거
 */
@Slf4j
@Component
public class QueueSseHub {

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
    private final Executor dispatcher;

    public QueueSseHub(@Qualifier("sseDispatchExecutor") Executor dispatcher) {
        this.dispatcher = dispatcher;
    }

    public SseEmitter subscribe() {
        // timeout 0 = 무제한
        return register(new SseEmitter(0L));
    }

    SseEmitter register(SseEmitter emitter) {
        emitters.add(emitter);

        Runnable cleanup = () -> remove(emitter);
        emitter.onCompletion(cleanup);
        emitter.onTimeout(cleanup);
        emitter.onError(ex -> cleanup.run());

        // 연결 확인용 hello
        dispatch("hello", () -> send(emitter, "hello", Map.of("ok", true)));
        return emitter;
    }

    @EventListener
    public void onRegistryEvent(RegistryEvent event) {
        dispatch(event.type(), () -> broadcast(event.type(), event));
    }

    @Scheduled(fixedRateString = "${registry.sse.ping-interval-ms:15000}")
    public void pingAll() {
        if (emitters.isEmpty()) return;
        Map<String, String> payload = Map.of("at", Instant.now().toString());
        dispatch("ping", () -> broadcast("ping", payload));
    }

    public int subscriberCount() {
        return emitters.size();
    }

    private void dispatch(String name, Runnable delivery) {
        try {
            dispatcher.execute(delivery);
        } catch (RejectedExecutionException e) {
            log.warn("[SSE] dispatch queue full, dropped. event={}", name);
        }
    }

    private void broadcast(String name, Object payload) {
        for (SseEmitter emitter : emitters) {
            send(emitter, name, payload);
        }
    }

    private void send(SseEmitter emitter, String name, Object payload) {
        try {
            emitter.send(SseEmitter.event().name(name).data(payload));
        } catch (IOException | IllegalStateException e) {
            remove(emitter);
        }
    }

    private void remove(SseEmitter emitter) {
        if (emitters.remove(emitter)) {
            emitter.complete();
        }
    }
}
