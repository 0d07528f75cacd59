package com.copytraderadar.domain;

/**
 * Lifecycle of a copy-trade event. Rows are created PENDING; the execution side moves them to a terminal state.
 */
public enum CopyTradeEventStatus {
    PENDING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
