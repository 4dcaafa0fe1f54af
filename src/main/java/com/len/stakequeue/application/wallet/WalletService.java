package com.len.stakequeue.application.wallet;

import com.len.stakequeue.application.common.RegistryExecutor;
import com.len.stakequeue.domain.event.EventNotifier;
import com.len.stakequeue.domain.event.TokensTransferred;
import com.len.stakequeue.domain.event.WalletRegistered;
import com.len.stakequeue.domain.ledger.Account;
import com.len.stakequeue.domain.ledger.AccountLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class WalletService {

    private final RegistryExecutor executor;
    private final AccountLedger ledger;
    private final EventNotifier notifier;

    public WalletBalance register(String walletId) {
        return executor.execute("register", nowMs -> {
            Account account = ledger.register(walletId, nowMs);
            notifier.publish(new WalletRegistered(walletId, nowMs));
            log.info("[Wallet] registered walletId={}", walletId);
            return WalletBalance.of(account, nowMs);
        });
    }

    public boolean isRegistered(String walletId) {
        return executor.execute("isRegistered", nowMs -> ledger.isRegistered(walletId));
    }

    /**
     * 조회 시점(now) 기준 실시간 잔액. 상태는 바꾸지 않는다.
     */
    public WalletBalance getBalance(String walletId) {
        return executor.execute("balance", nowMs -> ledger.find(walletId)
                .map(account -> WalletBalance.of(account, nowMs, ledger))
                .orElseGet(() -> WalletBalance.unregistered(walletId, nowMs)));
    }

    public List<String> listRegistered() {
        return executor.execute("listRegistered", nowMs -> ledger.registeredWallets());
    }

    public TransferResult transfer(String from, String to, long amount) {
        return executor.execute("transfer", nowMs -> {
            AccountLedger.TransferResult moved = ledger.transfer(from, to, amount, nowMs);
            notifier.publish(new TokensTransferred(from, to, moved.regularPortion(), moved.restrictedPortion(), nowMs));
            log.info("[Wallet] transfer from={}, to={}, regular={}, restricted={}",
                    from, to, moved.regularPortion(), moved.restrictedPortion());
            return new TransferResult(
                    from,
                    to,
                    moved.regularPortion(),
                    moved.restrictedPortion(),
                    ledger.liveRegularBalance(from, nowMs),
                    ledger.liveRestrictedBalance(from, nowMs)
            );
        });
    }

    public record WalletBalance(
            String walletId,
            boolean registered,
            long regularBalance,
            long restrictedBalance,
            long lastCheckpointMs,
            long asOfMs
    ) {
        static WalletBalance of(Account account, long nowMs) {
            return new WalletBalance(account.walletId(), true,
                    account.regularBalance(), account.restrictedBalance(), account.lastCheckpointMs(), nowMs);
        }

        static WalletBalance of(Account account, long nowMs, AccountLedger ledger) {
            return new WalletBalance(account.walletId(), true,
                    account.liveRegular(nowMs, ledger.rates()),
                    account.liveRestricted(nowMs, ledger.rates()),
                    account.lastCheckpointMs(),
                    nowMs);
        }

        static WalletBalance unregistered(String walletId, long nowMs) {
            return new WalletBalance(walletId, false, 0L, 0L, 0L, nowMs);
        }
    }

    public record TransferResult(
            String from,
            String to,
            long regularMoved,
            long restrictedMoved,
            long senderRegularBalance,
            long senderRestrictedBalance
    ) {}
}
