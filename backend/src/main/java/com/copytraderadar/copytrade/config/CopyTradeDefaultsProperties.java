package com.copytraderadar.copytrade.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Defaults applied to new copy-trade configs when the operator leaves a field unset.
 */
@ConfigurationProperties(prefix = "copytrade.defaults")
@NoArgsConstructor
@Getter
@Setter
public class CopyTradeDefaultsProperties {

    private double maxSlippage = 0.05;

    private boolean buyOnly = true;

    /** Router contracts allowed by default (lower-cased on use). */
    private List<String> routerAllowlist = new ArrayList<>();
}
