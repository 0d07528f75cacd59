package com.copytraderadar.ingestion.config;

import com.copytraderadar.common.Addresses;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Allow-list of tracked tokens. New ERC-20 tokens are added here, not in code.
 * Keys of {@link #erc20} are contract addresses in any case; lookups are case-insensitive.
 */
@ConfigurationProperties(prefix = "copytrade.tracked-tokens")
@Getter
@Setter
public class TrackedTokenProperties {

    /** Chain native asset, reported by "transaction" events. */
    private Token nativeAsset = new Token(Addresses.ZERO_ADDRESS, "ETH", "Ether", 18);

    /** contract address -> token metadata. Empty unless configured; application.yml ships Base USDC. */
    private Map<String, Token> erc20 = new LinkedHashMap<>();

    @NoArgsConstructor
    @AllArgsConstructor
    @Getter
    @Setter
    public static class Token {
        /** Optional for erc20 entries (the map key wins). */
        private String address;
        private String symbol;
        private String name;
        private int decimals;
    }
}
