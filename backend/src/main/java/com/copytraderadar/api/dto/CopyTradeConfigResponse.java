package com.copytraderadar.api.dto;

import com.copytraderadar.domain.CopyTradeConfig;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public record CopyTradeConfigResponse(
        String id,
        String accountName,
        String targetWalletAddress,
        List<String> beneficiaryAddresses,
        String delegationAmount,
        double maxSlippage,
        boolean buyOnly,
        Set<String> routerAllowlist,
        boolean active,
        Instant createdAt,
        Instant lastExecutedAt,
        long totalExecutedTrades,
        String totalSpent
) {

    public static CopyTradeConfigResponse from(CopyTradeConfig c) {
        return new CopyTradeConfigResponse(
                c.getId(),
                c.getAccountName(),
                c.getTargetWalletAddress(),
                c.getBeneficiaryAddresses(),
                c.getDelegationAmount(),
                c.getMaxSlippage(),
                c.isBuyOnly(),
                c.getRouterAllowlist(),
                c.isActive(),
                c.getCreatedAt(),
                c.getLastExecutedAt(),
                c.getTotalExecutedTrades(),
                c.getTotalSpent());
    }
}
