package com.copytraderadar.ingestion.classifier;

/**
 * A token on the allow-list. Address is lower-cased; the zero address stands for the native asset.
 */
public record TrackedToken(String address, String symbol, String name, int decimals) {
}
