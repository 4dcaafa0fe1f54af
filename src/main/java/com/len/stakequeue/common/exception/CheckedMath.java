package com.len.stakequeue.common.exception;

/**
 * 잔액/적립/가격 계산용 오버플로 검사 연산.
 * wrap 되거나 saturate 되는 값은 허용하지 않고 ARITHMETIC_OVERFLOW 로 거절한다.
 */
public final class CheckedMath {

    private CheckedMath() {}

    public static long add(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new BusinessException(ErrorCode.ARITHMETIC_OVERFLOW, e);
        }
    }

    public static long subtract(long a, long b) {
        try {
            return Math.subtractExact(a, b);
        } catch (ArithmeticException e) {
            throw new BusinessException(ErrorCode.ARITHMETIC_OVERFLOW, e);
        }
    }

    public static long multiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new BusinessException(ErrorCode.ARITHMETIC_OVERFLOW, e);
        }
    }
}
