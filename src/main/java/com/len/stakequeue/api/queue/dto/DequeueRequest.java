package com.len.stakequeue.api.queue.dto;

import jakarta.validation.constraints.NotBlank;

public record DequeueRequest(@NotBlank String walletId) {}
