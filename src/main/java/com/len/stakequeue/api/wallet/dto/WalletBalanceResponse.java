package com.len.stakequeue.api.wallet.dto;

import com.len.stakequeue.application.wallet.WalletService;

public record WalletBalanceResponse(
        String walletId,
        boolean registered,
        long regularBalance,
        long restrictedBalance,
        long asOfMs
) {
    public static WalletBalanceResponse from(WalletService.WalletBalance balance) {
        return new WalletBalanceResponse(
                balance.walletId(),
                balance.registered(),
                balance.regularBalance(),
                balance.restrictedBalance(),
                balance.asOfMs()
        );
    }
}
