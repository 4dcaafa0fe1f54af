package com.len.stakequeue.api.queue.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record EnterQueueRequest(
        @NotBlank String walletId,
        @NotNull Long weight,
        @NotNull Long priorityValue,
        @NotNull Long externalId
) {}
