package com.copytraderadar.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TokenInfo(
        String address,
        String symbol,
        String name,
        int decimals,
        @JsonProperty("raw_value") String rawValue,
        @JsonProperty("human_value") String humanValue
) {
}
