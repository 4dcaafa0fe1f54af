package com.len.stakequeue.domain.ledger;

import com.len.stakequeue.common.exception.CheckedMath;

/**
 * 시간 경과에 따른 적립 비율. 두 잔액 모두 interval 당 고정 토큰 수로 적립된다.
 *
 * <p>1 토큰이 안 되는 잔여분은 carry(ms·token 단위, 항상 intervalMs 미만)로 넘겨서
 * checkpoint 를 아무리 자주 해도 누적 적립량은 한 번에 정산한 것과 같다.
 *
 * @param intervalMs      적립 단위 구간 (ms)
 * @param regularRate     interval 당 일반 잔액 적립량
 * @param restrictedRate  interval 당 제한 잔액 적립량
 */
public record AccrualRates(long intervalMs, long regularRate, long restrictedRate) {

    public AccrualRates {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive: " + intervalMs);
        }
        if (regularRate < 0 || restrictedRate < 0) {
            throw new IllegalArgumentException("rates must not be negative");
        }
    }

    public Accrual regular(long elapsedMs, long carry) {
        return accrue(elapsedMs, regularRate, carry);
    }

    public Accrual restricted(long elapsedMs, long carry) {
        return accrue(elapsedMs, restrictedRate, carry);
    }

    // 곱셈 먼저, 나머지는 버리지 않고 carry 로
    private Accrual accrue(long elapsedMs, long rate, long carry) {
        if (elapsedMs <= 0) return new Accrual(0L, carry);
        long scaled = CheckedMath.add(CheckedMath.multiply(elapsedMs, rate), carry);
        return new Accrual(scaled / intervalMs, scaled % intervalMs);
    }

    public record Accrual(long tokens, long carry) {}
}
