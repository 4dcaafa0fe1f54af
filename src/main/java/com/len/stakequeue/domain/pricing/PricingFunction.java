package com.len.stakequeue.domain.pricing;

import com.len.stakequeue.common.exception.BusinessException;
import com.len.stakequeue.common.exception.ErrorCode;

import java.math.BigInteger;

/**
 * 대기열 슬롯 가격 함수.
 *
 * <pre>
 *   cost(weight, priority)          = floor(log_1.2(weight) * priority)
 *   priorityFromStake(weight, coins) = floor(coins / log_1.2(weight))
 * </pre>
 *
 * <p>모든 계산은 {@link FixedPointMath} 18자리 고정소수점, 0 방향 절삭으로 고정되어 있다.
 * 환불은 재계산하지 않고 예치 당시 저장된 금액을 그대로 돌려준다.
 */
public class PricingFunction {

    /** 1.2 */
    public static final BigInteger BASE = new BigInteger("1200000000000000000");

    private static final BigInteger LOG2_BASE = FixedPointMath.log2(BASE);

    public long cost(long weight, long priorityValue) {
        if (priorityValue <= 0) {
            throw new BusinessException(ErrorCode.INVALID_PRIORITY);
        }
        BigInteger raw = logBase(weight)
                .multiply(BigInteger.valueOf(priorityValue))
                .divide(FixedPointMath.UNIT);
        return toLong(raw);
    }

    public long priorityFromStake(long weight, long stakedCoins) {
        if (stakedCoins < 0) {
            throw new BusinessException(ErrorCode.INVALID_AMOUNT);
        }
        BigInteger raw = BigInteger.valueOf(stakedCoins)
                .multiply(FixedPointMath.UNIT)
                .divide(logBase(weight));
        return toLong(raw);
    }

    /**
     * log_1.2(weight), 고정소수점. weight <= 1 이면 결과가 0 이하라 거절한다.
     */
    BigInteger logBase(long weight) {
        if (weight <= 1) {
            throw new BusinessException(ErrorCode.INVALID_WEIGHT);
        }
        BigInteger log2 = FixedPointMath.log2(FixedPointMath.fromWhole(weight));
        return log2.multiply(FixedPointMath.UNIT).divide(LOG2_BASE);
    }

    private static long toLong(BigInteger value) {
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new BusinessException(ErrorCode.ARITHMETIC_OVERFLOW, e);
        }
    }
}
