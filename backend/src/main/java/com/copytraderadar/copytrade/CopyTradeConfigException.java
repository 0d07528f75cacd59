package com.copytraderadar.copytrade;

import lombok.Getter;

/**
 * Registry operation rejected: duplicate (accountName, targetWalletAddress), unknown id, invalid input
 * or a spend update that kept losing to concurrent writers.
 */
@Getter
public class CopyTradeConfigException extends RuntimeException {

    private final ErrorCode errorCode;

    public CopyTradeConfigException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CopyTradeConfigException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public enum ErrorCode {
        DUPLICATE_CONFIG,
        CONFIG_NOT_FOUND,
        INVALID_CONFIG,
        CONCURRENT_UPDATE
    }
}
