package com.len.stakequeue.common.exception;

public enum ErrorCategory {
    VALIDATION,
    BALANCE,
    AUTHORIZATION,
    ARITHMETIC,
    INTERNAL
}
