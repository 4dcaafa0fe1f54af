package com.len.stakequeue.domain.pricing;

import java.math.BigInteger;

/**
 * 18자리 고정소수점 연산. 모든 나눗셈은 0 방향 절삭.
 */
public final class FixedPointMath {

    public static final BigInteger UNIT = BigInteger.TEN.pow(18);
    private static final BigInteger HALF_UNIT = UNIT.shiftRight(1);
    private static final BigInteger DOUBLE_UNIT = UNIT.shiftLeft(1);

    private FixedPointMath() {}

    public static BigInteger fromWhole(long value) {
        return BigInteger.valueOf(value).multiply(UNIT);
    }

    /**
     * 이진 로그. x >= UNIT (1.0) 이어야 한다.
     * 정수부는 비트 길이로, 소수부는 제곱 반복으로 한 비트씩 구한다.
     */
    public static BigInteger log2(BigInteger x) {
        if (x.compareTo(UNIT) < 0) {
            throw new IllegalArgumentException("log2 domain is x >= 1.0, got raw " + x);
        }
        int n = x.divide(UNIT).bitLength() - 1;
        BigInteger result = UNIT.multiply(BigInteger.valueOf(n));
        BigInteger y = x.shiftRight(n);
        if (y.equals(UNIT)) {
            return result;
        }
        for (BigInteger delta = HALF_UNIT; delta.signum() > 0; delta = delta.shiftRight(1)) {
            y = y.multiply(y).divide(UNIT);
            if (y.compareTo(DOUBLE_UNIT) >= 0) {
                result = result.add(delta);
                y = y.shiftRight(1);
            }
        }
        return result;
    }
}
