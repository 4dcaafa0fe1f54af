package com.len.stakequeue.domain.ledger;

import com.len.stakequeue.common.exception.CheckedMath;

/**
 * 등록된 지갑의 정산 상태. 불변 값이며 원장은 변경 결과를 한 번에 교체(commit)한다.
 *
 * <p>regularCarry / restrictedCarry 는 아직 1 토큰이 되지 않은 적립 잔여분이다.
 */
public record Account(
        String walletId,
        long registeredAtMs,
        long lastCheckpointMs,
        long regularBalance,
        long restrictedBalance,
        long regularCarry,
        long restrictedCarry
) {

    public static Account register(String walletId, long nowMs) {
        return new Account(walletId, nowMs, nowMs, 0L, 0L, 0L, 0L);
    }

    /**
     * nowMs 까지 적립분을 정산한 사본. lastCheckpoint 는 뒤로 가지 않는다.
     */
    public Account checkpoint(long nowMs, AccrualRates rates) {
        if (nowMs <= lastCheckpointMs) {
            return this;
        }
        long elapsed = nowMs - lastCheckpointMs;
        AccrualRates.Accrual regular = rates.regular(elapsed, regularCarry);
        AccrualRates.Accrual restricted = rates.restricted(elapsed, restrictedCarry);
        return new Account(
                walletId,
                registeredAtMs,
                nowMs,
                CheckedMath.add(regularBalance, regular.tokens()),
                CheckedMath.add(restrictedBalance, restricted.tokens()),
                regular.carry(),
                restricted.carry()
        );
    }

    public long liveRegular(long nowMs, AccrualRates rates) {
        return CheckedMath.add(regularBalance, rates.regular(nowMs - lastCheckpointMs, regularCarry).tokens());
    }

    public long liveRestricted(long nowMs, AccrualRates rates) {
        return CheckedMath.add(restrictedBalance, rates.restricted(nowMs - lastCheckpointMs, restrictedCarry).tokens());
    }

    public long spendable() {
        return CheckedMath.add(regularBalance, restrictedBalance);
    }

    public Account withBalances(long regular, long restricted) {
        return new Account(walletId, registeredAtMs, lastCheckpointMs, regular, restricted, regularCarry, restrictedCarry);
    }
}
