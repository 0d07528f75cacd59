package com.copytraderadar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

/**
 * Persistence for copy_trade_configs. Uniqueness: (accountName, targetWalletAddress).
 */
public interface CopyTradeConfigRepository extends MongoRepository<CopyTradeConfig, String>, CopyTradeConfigRepositoryCustom {

    /** Fan-out lookup for the webhook pipeline; addresses must already be lower-cased. */
    List<CopyTradeConfig> findByTargetWalletAddressInAndActiveTrue(Collection<String> targetWalletAddresses);

    List<CopyTradeConfig> findByAccountNameOrderByCreatedAtDesc(String accountName);

    List<CopyTradeConfig> findByAccountNameAndActiveTrue(String accountName);

    boolean existsByAccountNameAndTargetWalletAddress(String accountName, String targetWalletAddress);
}
