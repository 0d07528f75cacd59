package com.copytraderadar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A tracked "follow" relationship: one account copying one target wallet.
 * Identity is (accountName, targetWalletAddress); targetWalletAddress is always stored lower-cased.
 * Configs are deactivated, never deleted, so historical events keep a valid reference.
 */
@Document(collection = "copy_trade_configs")
@CompoundIndexes({
    @CompoundIndex(name = "account_target", def = "{'accountName': 1, 'targetWalletAddress': 1}", unique = true),
    @CompoundIndex(name = "target_active", def = "{'targetWalletAddress': 1, 'active': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CopyTradeConfig {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String accountName;
    private String targetWalletAddress;
    private List<String> beneficiaryAddresses = new ArrayList<>();
    /** ETH-denominated decimal string. */
    private String delegationAmount;
    /** Fraction, 0.05 = 5%. Filled from copytrade.defaults when the request omits it. */
    private double maxSlippage;
    private boolean buyOnly = true;
    private Set<String> routerAllowlist = new LinkedHashSet<>();
    private boolean active = true;
    private Instant createdAt;
    private Instant lastExecutedAt;
    private long totalExecutedTrades;
    /** ETH-denominated decimal string. */
    private String totalSpent = "0";

    public void setTargetWalletAddress(String targetWalletAddress) {
        this.targetWalletAddress = targetWalletAddress == null ? null : targetWalletAddress.strip().toLowerCase();
    }
}
