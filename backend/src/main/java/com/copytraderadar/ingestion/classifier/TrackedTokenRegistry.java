package com.copytraderadar.ingestion.classifier;

import com.copytraderadar.common.Addresses;
import com.copytraderadar.ingestion.config.TrackedTokenProperties;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup table of tracked tokens built from {@link TrackedTokenProperties}.
 * ERC-20 lookups are case-insensitive; the zero address is never a tracked ERC-20.
 */
@Component
public class TrackedTokenRegistry {

    private final TrackedToken nativeAsset;
    private final Map<String, TrackedToken> erc20ByAddress;

    public TrackedTokenRegistry(TrackedTokenProperties properties) {
        TrackedTokenProperties.Token n = properties.getNativeAsset();
        String nativeAddress = n.getAddress() != null && !n.getAddress().isBlank()
                ? Addresses.normalize(n.getAddress())
                : Addresses.ZERO_ADDRESS;
        this.nativeAsset = new TrackedToken(nativeAddress, n.getSymbol(), n.getName(), n.getDecimals());

        Map<String, TrackedToken> tokens = new LinkedHashMap<>();
        if (properties.getErc20() != null) {
            properties.getErc20().forEach((key, token) -> {
                String address = Addresses.normalize(key);
                if (address == null || address.isEmpty() || Addresses.isZero(address) || token == null) {
                    return;
                }
                tokens.put(address, new TrackedToken(address, token.getSymbol(),
                        token.getName() != null ? token.getName() : token.getSymbol(), token.getDecimals()));
            });
        }
        this.erc20ByAddress = Collections.unmodifiableMap(tokens);
    }

    public TrackedToken nativeAsset() {
        return nativeAsset;
    }

    public Optional<TrackedToken> findErc20(String contractAddress) {
        if (contractAddress == null || contractAddress.isBlank() || Addresses.isZero(contractAddress)) {
            return Optional.empty();
        }
        return Optional.ofNullable(erc20ByAddress.get(Addresses.normalize(contractAddress)));
    }

    public Map<String, TrackedToken> erc20Tokens() {
        return erc20ByAddress;
    }
}
