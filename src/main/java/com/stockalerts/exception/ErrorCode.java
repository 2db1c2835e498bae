package com.stockalerts.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    NO_WINDOW_DATA("NO_WINDOW_DATA", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    PRICE_UNAVAILABLE("PRICE_UNAVAILABLE", 502),
    DELIVERY_FAILURE("DELIVERY_FAILURE", 502),
    REPOSITORY_UNAVAILABLE("REPOSITORY_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
