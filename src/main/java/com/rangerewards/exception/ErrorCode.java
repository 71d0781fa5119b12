package com.rangerewards.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    UNAUTHORIZED("UNAUTHORIZED", 401),
    NOT_FOUND("NOT_FOUND", 404),
    OPERATION_IN_PROGRESS("OPERATION_IN_PROGRESS", 409),
    LIQUIDITY_UNDERFLOW("LIQUIDITY_UNDERFLOW", 422),
    INSUFFICIENT_BALANCE("INSUFFICIENT_BALANCE", 422),
    ARITHMETIC_OVERFLOW("ARITHMETIC_OVERFLOW", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
