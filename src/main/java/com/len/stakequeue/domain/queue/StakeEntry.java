package com.len.stakequeue.domain.queue;

/**
 * 대기열 슬롯 하나. stakedCoins 는 진입/재가격 시점에 소각되어 예치된 금액.
 */
public record StakeEntry(
        long externalId,
        String owner,
        long weight,
        long priorityValue,
        long stakedCoins,
        long timestampMs
) {

    public StakeEntry reprice(long newWeight, long newPriorityValue, long newStakedCoins, long nowMs) {
        return new StakeEntry(externalId, owner, newWeight, newPriorityValue, newStakedCoins, nowMs);
    }
}
