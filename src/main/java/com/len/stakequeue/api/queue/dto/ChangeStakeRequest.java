package com.len.stakequeue.api.queue.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ChangeStakeRequest(
        @NotBlank String walletId,
        @NotNull Long weight,
        @NotNull Long priorityValue
) {}
