package com.copytraderadar.api.dto;

import com.copytraderadar.domain.CopyTradeEvent;

import java.time.Instant;

public record CopyTradeEventResponse(
        String id,
        String configId,
        String accountName,
        String targetWalletAddress,
        String originalTxHash,
        String network,
        String tokenAddress,
        String tokenSymbol,
        String tokenName,
        String originalAmount,
        String copiedAmount,
        String transactionHash,
        Instant timestamp,
        String status,
        String errorMessage
) {

    public static CopyTradeEventResponse from(CopyTradeEvent e) {
        return new CopyTradeEventResponse(
                e.getId(),
                e.getConfigId(),
                e.getAccountName(),
                e.getTargetWalletAddress(),
                e.getOriginalTxHash(),
                e.getNetwork(),
                e.getTokenAddress(),
                e.getTokenSymbol(),
                e.getTokenName(),
                e.getOriginalAmount(),
                e.getCopiedAmount(),
                e.getTransactionHash(),
                e.getTimestamp(),
                e.getStatus() != null ? e.getStatus().name().toLowerCase() : null,
                e.getErrorMessage());
    }
}
