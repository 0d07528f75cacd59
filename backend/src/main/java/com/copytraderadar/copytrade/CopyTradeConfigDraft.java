package com.copytraderadar.copytrade;

import java.util.List;
import java.util.Set;

/**
 * Operator input for a new config. Null maxSlippage, buyOnly and routerAllowlist take the configured defaults.
 */
public record CopyTradeConfigDraft(
        String accountName,
        String targetWalletAddress,
        List<String> beneficiaryAddresses,
        String delegationAmount,
        Double maxSlippage,
        Boolean buyOnly,
        Set<String> routerAllowlist
) {
}
