package com.copytraderadar.domain;

import java.util.Optional;

/**
 * Conditional status transitions for copy_trade_events.
 */
public interface CopyTradeEventRepositoryCustom {

    /**
     * Moves a PENDING event to target in one atomic update. Null transactionHash, copiedAmount and
     * errorMessage leave the stored values alone. Empty when the id is unknown or the event is no longer PENDING.
     */
    Optional<CopyTradeEvent> transitionFromPending(String id, CopyTradeEventStatus target,
                                                   String transactionHash, String copiedAmount, String errorMessage);
}
