package com.copytraderadar.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Single-document atomic updates for copy_trade_configs. Each touches only the fields it owns,
 * so deactivation and execution bookkeeping never overwrite each other.
 */
public interface CopyTradeConfigRepositoryCustom {

    /** Sets active=false. Empty when no config has this id. */
    Optional<CopyTradeConfig> deactivate(String id);

    /**
     * Increments totalExecutedTrades and replaces totalSpent, but only while totalSpent still equals
     * expectedTotalSpent. Empty when the id is unknown or another execution got there first.
     */
    Optional<CopyTradeConfig> recordExecution(String id, String expectedTotalSpent, String newTotalSpent, Instant executedAt);
}
