package com.len.stakequeue.domain.event;

/**
 * 상태 변경 알림. 한 연산 안에서 발생 순서대로 전달된다.
 */
public interface RegistryEvent {

    /** SSE event name / Kafka 헤더용 */
    String type();

    /** Kafka 파티션 키 */
    String key();

    long occurredAtMs();
}
