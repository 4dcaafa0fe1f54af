package com.len.stakequeue.domain.access;

/**
 * 등록/권한 판단. 상태를 바꾸지 않는 조회만 제공한다.
 */
public interface AccessGate {

    boolean isRegistered(String walletId);

    /**
     * 대기열 head 를 소비(dequeue)할 수 있는 유일한 지갑인지
     */
    boolean isController(String walletId);

    boolean isOwner(String walletId);
}
