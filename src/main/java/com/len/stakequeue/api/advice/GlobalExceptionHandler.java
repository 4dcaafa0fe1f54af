package com.len.stakequeue.api.advice;

import com.len.stakequeue.common.exception.BusinessException;
import com.len.stakequeue.common.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // ===== 비즈니스 예외 (검증/잔액/권한/연산) =====
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusiness(BusinessException e, HttpServletRequest req) {
        ErrorCode ec = e.getErrorCode();
        log.warn("[{}] {} {} - {}", ec.getCode(), req.getMethod(), req.getRequestURI(), e.getMessage());
        return ResponseEntity
                .status(ec.getHttpStatus())
                .body(ErrorResponse.of(ec, e.getMessage(), req.getRequestURI()));
    }

    // ===== 요청 형식 오류 =====
    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleInvalidRequest(Exception e, HttpServletRequest req) {
        ErrorCode ec = ErrorCode.INVALID_REQUEST;
        log.warn("[INVALID_REQUEST] {} {} - {}", req.getMethod(), req.getRequestURI(), e.getMessage());
        return ResponseEntity
                .status(ec.getHttpStatus())
                .body(ErrorResponse.of(ec, ec.getMessage(), req.getRequestURI()));
    }

    // ===== 그 외 모든 예외 =====
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAny(Exception e, HttpServletRequest req) {
        ErrorCode ec = ErrorCode.INTERNAL_ERROR;
        log.error("[INTERNAL_ERROR] {} {}", req.getMethod(), req.getRequestURI(), e);
        return ResponseEntity
                .status(ec.getHttpStatus())
                .body(ErrorResponse.of(ec, ec.getMessage(), req.getRequestURI()));
    }
}
