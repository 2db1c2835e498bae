package com.stockalerts.exception;

public class RepositoryUnavailableException extends BaseException {

    public RepositoryUnavailableException(String message, Throwable cause) {
        super(ErrorCode.REPOSITORY_UNAVAILABLE, message, cause);
    }
}
