package com.copytraderadar.ingestion.classifier;

public enum TransferKind {
    /** Chain base currency ("transaction" webhook events). */
    NATIVE,
    /** Fungible token contract transfer ("erc20_transfer" webhook events). */
    ERC20
}
