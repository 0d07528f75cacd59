package com.copytraderadar.copytrade;

import lombok.Getter;

@Getter
public class CopyTradeEventException extends RuntimeException {

    private final ErrorCode errorCode;

    public CopyTradeEventException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public enum ErrorCode {
        EVENT_NOT_FOUND,
        INVALID_TRANSITION
    }
}
