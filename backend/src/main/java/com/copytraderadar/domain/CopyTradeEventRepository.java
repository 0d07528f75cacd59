package com.copytraderadar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for copy_trade_events. Used by CopyTradeEventStore (ingestion) and CopyTradeEventService (copytrade).
 */
public interface CopyTradeEventRepository extends MongoRepository<CopyTradeEvent, String>, CopyTradeEventRepositoryCustom {

    Optional<CopyTradeEvent> findByConfigIdAndOriginalTxHash(String configId, String originalTxHash);

    long countByConfigIdAndOriginalTxHash(String configId, String originalTxHash);

    List<CopyTradeEvent> findByAccountNameOrderByTimestampDesc(String accountName);

    List<CopyTradeEvent> findByConfigIdOrderByTimestampDesc(String configId);
}
