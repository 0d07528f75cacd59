package com.copytraderadar.notification;

/**
 * What a transfer alert says. Amount is already human-scaled.
 *
 * @param nativeAsset true for the chain's base currency, false for a token contract transfer
 */
public record TransferNotification(
        boolean nativeAsset,
        String accountName,
        String tokenSymbol,
        String from,
        String to,
        String amount,
        String transactionHash,
        String network
) {
}
