package com.len.stakequeue.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // 공통
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "알 수 없는 오류가 발생했습니다.", ErrorCategory.INTERNAL),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "잘못된 요청입니다.", ErrorCategory.VALIDATION),

    // 지갑 / 원장
    ALREADY_REGISTERED(HttpStatus.CONFLICT, "ALREADY_REGISTERED", "이미 등록된 지갑입니다.", ErrorCategory.VALIDATION),
    UNREGISTERED(HttpStatus.BAD_REQUEST, "UNREGISTERED", "등록되지 않은 지갑입니다.", ErrorCategory.VALIDATION),
    UNREGISTERED_SENDER(HttpStatus.BAD_REQUEST, "UNREGISTERED_SENDER", "보내는 지갑이 등록되지 않았습니다.", ErrorCategory.VALIDATION),
    UNREGISTERED_RECIPIENT(HttpStatus.BAD_REQUEST, "UNREGISTERED_RECIPIENT", "받는 지갑이 등록되지 않았습니다.", ErrorCategory.VALIDATION),
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST, "INVALID_AMOUNT", "금액은 0 이상이어야 합니다.", ErrorCategory.VALIDATION),
    INSUFFICIENT_BALANCE(HttpStatus.CONFLICT, "INSUFFICIENT_BALANCE", "잔액이 부족합니다.", ErrorCategory.BALANCE),

    // 대기열
    ALREADY_QUEUED(HttpStatus.CONFLICT, "ALREADY_QUEUED", "이미 대기열에 있는 항목입니다.", ErrorCategory.VALIDATION),
    NOT_IN_QUEUE(HttpStatus.NOT_FOUND, "NOT_IN_QUEUE", "대기열에 없는 항목입니다.", ErrorCategory.VALIDATION),
    QUEUE_EMPTY(HttpStatus.CONFLICT, "QUEUE_EMPTY", "대기열이 비어 있습니다.", ErrorCategory.VALIDATION),
    INVALID_WEIGHT(HttpStatus.BAD_REQUEST, "INVALID_WEIGHT", "weight는 1보다 커야 합니다.", ErrorCategory.VALIDATION),
    INVALID_PRIORITY(HttpStatus.BAD_REQUEST, "INVALID_PRIORITY", "priorityValue는 0보다 커야 합니다.", ErrorCategory.VALIDATION),

    // 권한
    NOT_AUTHORIZED(HttpStatus.FORBIDDEN, "NOT_AUTHORIZED", "권한이 없습니다.", ErrorCategory.AUTHORIZATION),
    NOT_OWNER(HttpStatus.FORBIDDEN, "NOT_OWNER", "owner만 호출할 수 있습니다.", ErrorCategory.AUTHORIZATION),

    // 연산
    ARITHMETIC_OVERFLOW(HttpStatus.UNPROCESSABLE_ENTITY, "ARITHMETIC_OVERFLOW", "금액 계산 중 오버플로가 발생했습니다.", ErrorCategory.ARITHMETIC);

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;
    private final ErrorCategory category;
}
