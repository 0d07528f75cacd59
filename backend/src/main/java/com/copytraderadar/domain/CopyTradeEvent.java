package com.copytraderadar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One detected, qualifying transfer on a tracked wallet, recorded per matching config.
 * Idempotency key: (configId, originalTxHash). Amounts are raw integer strings (pre decimal scaling).
 * Never deleted: this collection is the audit trail.
 */
@Document(collection = "copy_trade_events")
@CompoundIndexes({
    @CompoundIndex(name = "config_originalTx", def = "{'configId': 1, 'originalTxHash': 1}", unique = true),
    @CompoundIndex(name = "account_timestamp", def = "{'accountName': 1, 'timestamp': -1}"),
    @CompoundIndex(name = "target_timestamp", def = "{'targetWalletAddress': 1, 'timestamp': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CopyTradeEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String configId;
    private String accountName;
    private String targetWalletAddress;
    private String originalTxHash;
    private String network;
    private String tokenAddress;
    private String tokenSymbol;
    private String tokenName;
    private String originalAmount;
    private String copiedAmount;
    /** Hash of the resulting copy transaction; null until execution completes. */
    private String transactionHash;
    private Instant timestamp;
    private CopyTradeEventStatus status = CopyTradeEventStatus.PENDING;
    private String errorMessage;

    public void setTargetWalletAddress(String targetWalletAddress) {
        this.targetWalletAddress = targetWalletAddress == null ? null : targetWalletAddress.strip().toLowerCase();
    }
}
