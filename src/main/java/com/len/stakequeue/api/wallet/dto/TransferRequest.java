package com.len.stakequeue.api.wallet.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record TransferRequest(
        @NotBlank String from,
        @NotBlank String to,
        @NotNull Long amount
) {}
