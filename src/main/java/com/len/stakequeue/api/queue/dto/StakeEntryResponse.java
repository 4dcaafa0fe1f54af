package com.len.stakequeue.api.queue.dto;

import com.len.stakequeue.domain.queue.StakeEntry;

public record StakeEntryResponse(
        long externalId,
        String owner,
        long weight,
        long priorityValue,
        long stakedCoins,
        long timestampMs
) {
    public static StakeEntryResponse from(StakeEntry entry) {
        return new StakeEntryResponse(
                entry.externalId(),
                entry.owner(),
                entry.weight(),
                entry.priorityValue(),
                entry.stakedCoins(),
                entry.timestampMs()
        );
    }
}
