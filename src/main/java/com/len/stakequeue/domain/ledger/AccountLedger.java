package com.len.stakequeue.domain.ledger;

import com.len.stakequeue.common.exception.BusinessException;
import com.len.stakequeue.common.exception.CheckedMath;
import com.len.stakequeue.common.exception.ErrorCode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 지갑별 정산 잔액과 시간 기반 적립을 관리하는 원장.
 *
 * <p>모든 변경 연산은 새 {@link Account} 값을 먼저 계산하고 검증이 모두 끝난 뒤에만
 * 맵에 반영한다. 중간에 예외가 나면 원장은 호출 전 상태 그대로다.
 *
 * <p>thread-safe 하지 않다. 직렬화는 호출하는 쪽(RegistryExecutor) 책임.
 */
public class AccountLedger {

    private final AccrualRates rates;
    private final Map<String, Account> accounts = new LinkedHashMap<>();

    private long totalAccrued;
    private long totalBurned;
    private long totalMinted;

    public AccountLedger(AccrualRates rates) {
        this.rates = rates;
    }

    public AccrualRates rates() {
        return rates;
    }

    public Account register(String walletId, long nowMs) {
        if (accounts.containsKey(walletId)) {
            throw new BusinessException(ErrorCode.ALREADY_REGISTERED);
        }
        Account account = Account.register(walletId, nowMs);
        accounts.put(walletId, account);
        return account;
    }

    public boolean isRegistered(String walletId) {
        return accounts.containsKey(walletId);
    }

    public Optional<Account> find(String walletId) {
        return Optional.ofNullable(accounts.get(walletId));
    }

    public List<String> registeredWallets() {
        return List.copyOf(accounts.keySet());
    }

    /**
     * 적립분을 정산 잔액으로 옮긴다. 미등록이면 아무것도 하지 않는다.
     */
    public void checkpoint(String walletId, long nowMs) {
        Account current = accounts.get(walletId);
        if (current == null) return;
        Account settled = current.checkpoint(nowMs, rates);
        long total = CheckedMath.add(totalAccrued, accruedBetween(current, settled));
        commit(settled);
        totalAccrued = total;
    }

    public long liveRegularBalance(String walletId, long nowMs) {
        Account account = accounts.get(walletId);
        return account == null ? 0L : account.liveRegular(nowMs, rates);
    }

    public long liveRestrictedBalance(String walletId, long nowMs) {
        Account account = accounts.get(walletId);
        return account == null ? 0L : account.liveRestricted(nowMs, rates);
    }

    /**
     * 제한 잔액부터 먼저 소진하고, 제한분은 받는 쪽에서도 제한 잔액으로 들어간다.
     */
    public TransferResult transfer(String from, String to, long amount, long nowMs) {
        Account sender = accounts.get(from);
        if (sender == null) throw new BusinessException(ErrorCode.UNREGISTERED_SENDER);
        Account recipient = accounts.get(to);
        if (recipient == null) throw new BusinessException(ErrorCode.UNREGISTERED_RECIPIENT);
        if (amount < 0) throw new BusinessException(ErrorCode.INVALID_AMOUNT);

        Account s = sender.checkpoint(nowMs, rates);
        if (amount > s.spendable()) {
            throw new BusinessException(ErrorCode.INSUFFICIENT_BALANCE);
        }

        long restrictedPortion = Math.min(amount, s.restrictedBalance());
        long regularPortion = amount - restrictedPortion;

        long accrued = accruedBetween(sender, s);

        if (from.equals(to)) {
            // 자기 자신에게 보내면 정산만 한다
            long total = CheckedMath.add(totalAccrued, accrued);
            commit(s);
            totalAccrued = total;
            return new TransferResult(regularPortion, restrictedPortion);
        }

        Account r = recipient.checkpoint(nowMs, rates);
        accrued = CheckedMath.add(accrued, accruedBetween(recipient, r));

        Account debited = s.withBalances(
                s.regularBalance() - regularPortion,
                s.restrictedBalance() - restrictedPortion
        );
        Account credited = r.withBalances(
                CheckedMath.add(r.regularBalance(), regularPortion),
                CheckedMath.add(r.restrictedBalance(), restrictedPortion)
        );
        long total = CheckedMath.add(totalAccrued, accrued);

        commit(debited);
        commit(credited);
        totalAccrued = total;
        return new TransferResult(regularPortion, restrictedPortion);
    }

    /**
     * 일반 잔액에서 amount 를 소각한다 (대기열 예치).
     */
    public void burn(String walletId, long amount, long nowMs) {
        Account current = require(walletId);
        if (amount < 0) throw new BusinessException(ErrorCode.INVALID_AMOUNT);

        Account settled = current.checkpoint(nowMs, rates);
        if (settled.regularBalance() < amount) {
            throw new BusinessException(ErrorCode.INSUFFICIENT_BALANCE);
        }
        long accrued = CheckedMath.add(totalAccrued, accruedBetween(current, settled));
        long burned = CheckedMath.add(totalBurned, amount);

        commit(settled.withBalances(settled.regularBalance() - amount, settled.restrictedBalance()));
        totalAccrued = accrued;
        totalBurned = burned;
    }

    /**
     * 일반 잔액으로 amount 를 발행한다 (환불, 재가격 차액).
     */
    public void mint(String walletId, long amount, long nowMs) {
        Account current = require(walletId);
        if (amount < 0) throw new BusinessException(ErrorCode.INVALID_AMOUNT);

        Account settled = current.checkpoint(nowMs, rates);
        long regular = CheckedMath.add(settled.regularBalance(), amount);
        long accrued = CheckedMath.add(totalAccrued, accruedBetween(current, settled));
        long minted = CheckedMath.add(totalMinted, amount);

        commit(settled.withBalances(regular, settled.restrictedBalance()));
        totalAccrued = accrued;
        totalMinted = minted;
    }

    public LedgerSupply supply() {
        long settled = 0L;
        for (Account account : accounts.values()) {
            settled = CheckedMath.add(settled, account.spendable());
        }
        return new LedgerSupply(totalAccrued, totalBurned, totalMinted, settled);
    }

    private Account require(String walletId) {
        Account account = accounts.get(walletId);
        if (account == null) throw new BusinessException(ErrorCode.UNREGISTERED);
        return account;
    }

    private long accruedBetween(Account before, Account after) {
        return CheckedMath.add(
                after.regularBalance() - before.regularBalance(),
                after.restrictedBalance() - before.restrictedBalance()
        );
    }

    private void commit(Account account) {
        accounts.put(account.walletId(), account);
    }

    public record TransferResult(long regularPortion, long restrictedPortion) {}
}
