package com.copytraderadar.ingestion.store;

import com.copytraderadar.domain.CopyTradeEvent;

/**
 * @param inserted false when a row with the same (configId, originalTxHash) already existed
 * @param event    the newly stored row, or the existing one when not inserted
 */
public record UpsertResult(boolean inserted, CopyTradeEvent event) {
}
