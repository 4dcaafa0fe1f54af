package com.len.stakequeue.api.queue.dto;

public record QueuePositionResponse(
        long externalId,
        int position,        // 0 = 다음 처리 대상
        StakeEntryResponse entry
) {}
