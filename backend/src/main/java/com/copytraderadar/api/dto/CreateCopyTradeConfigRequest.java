package com.copytraderadar.api.dto;

import com.copytraderadar.api.validation.EvmAddress;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Set;

/**
 * POST /api/v1/copy-trade/configs request body. Validated with Jakarta Bean Validation.
 * Null maxSlippage, buyOnly and routerAllowlist take the configured defaults.
 */
public record CreateCopyTradeConfigRequest(
        @NotBlank(message = "INVALID_ACCOUNT")
        String accountName,

        @NotBlank(message = "INVALID_ADDRESS")
        @EvmAddress
        String targetWalletAddress,

        @NotEmpty(message = "INVALID_BENEFICIARIES")
        List<@EvmAddress String> beneficiaryAddresses,

        @NotBlank(message = "INVALID_AMOUNT")
        String delegationAmount,

        @DecimalMin(value = "0", inclusive = false, message = "INVALID_SLIPPAGE")
        @DecimalMax(value = "1", message = "INVALID_SLIPPAGE")
        Double maxSlippage,

        Boolean buyOnly,

        Set<@EvmAddress String> routerAllowlist
) {
}
