package com.len.stakequeue.api.wallet;

import com.len.stakequeue.api.wallet.dto.RegisterWalletRequest;
import com.len.stakequeue.api.wallet.dto.TransferRequest;
import com.len.stakequeue.api.wallet.dto.WalletBalanceResponse;
import com.len.stakequeue.application.wallet.WalletService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/wallets")
public class WalletController {

    private final WalletService walletService;

    // 지갑 등록
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public WalletBalanceResponse register(@Valid @RequestBody RegisterWalletRequest request) {
        return WalletBalanceResponse.from(walletService.register(request.walletId()));
    }

    @GetMapping
    public List<String> list() {
        return walletService.listRegistered();
    }

    // 실시간 잔액 (등록 여부 포함)
    @GetMapping("/{walletId}")
    public WalletBalanceResponse balance(@PathVariable String walletId) {
        return WalletBalanceResponse.from(walletService.getBalance(walletId));
    }

    @PostMapping("/transfer")
    public WalletService.TransferResult transfer(@Valid @RequestBody TransferRequest request) {
        return walletService.transfer(request.from(), request.to(), request.amount());
    }
}
