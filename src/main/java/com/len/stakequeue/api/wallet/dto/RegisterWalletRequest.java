package com.len.stakequeue.api.wallet.dto;

import jakarta.validation.constraints.NotBlank;

public record RegisterWalletRequest(@NotBlank String walletId) {}
