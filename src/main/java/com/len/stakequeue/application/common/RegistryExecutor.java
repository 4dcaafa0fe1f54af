package com.len.stakequeue.application.common;

import com.len.stakequeue.common.exception.BusinessException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongConsumer;
import java.util.function.LongFunction;
import java.util.function.Supplier;

/**
 * 원장 + 대기열은 하나의 공유 자원이다.
 * 모든 연산(조회 포함)을 전역 락 하나로 직렬화하고, now 는 연산당 한 번만 샘플링한다.
 */
@Slf4j
@Component
public class RegistryExecutor {

    private static final String METRIC_OPERATION = "registry.operation";
    private static final String METRIC_LATENCY = "registry.operation.latency";

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public RegistryExecutor(Clock clock, MeterRegistry meterRegistry) {
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public <T> T execute(String operation, LongFunction<T> work) {
        final long startNs = System.nanoTime();
        lock.lock();
        try {
            return record(operation, () -> work.apply(clock.millis()));
        } finally {
            lock.unlock();
            meterRegistry.timer(METRIC_LATENCY, "op", operation)
                    .record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
        }
    }

    /**
     * 공유 상태를 건드리지 않는 순수 계산용. 락 없이 같은 메트릭만 남긴다.
     */
    public <T> T measure(String operation, Supplier<T> work) {
        final long startNs = System.nanoTime();
        try {
            return record(operation, work);
        } finally {
            meterRegistry.timer(METRIC_LATENCY, "op", operation)
                    .record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS);
        }
    }

    public void run(String operation, LongConsumer work) {
        execute(operation, nowMs -> {
            work.accept(nowMs);
            return null;
        });
    }

    private <T> T record(String operation, Supplier<T> work) {
        try {
            T result = work.get();
            meterRegistry.counter(METRIC_OPERATION, "op", operation, "result", "ok").increment();
            return result;
        } catch (BusinessException e) {
            meterRegistry.counter(METRIC_OPERATION, "op", operation, "result", e.getErrorCode().getCode()).increment();
            log.debug("[RegistryExecutor] op={} rejected code={}", operation, e.getErrorCode());
            throw e;
        }
    }
}
