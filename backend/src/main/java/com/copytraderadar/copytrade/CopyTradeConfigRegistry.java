package com.copytraderadar.copytrade;

import com.copytraderadar.common.Addresses;
import com.copytraderadar.common.TokenAmounts;
import com.copytraderadar.copytrade.config.CopyTradeDefaultsProperties;
import com.copytraderadar.domain.CopyTradeConfig;
import com.copytraderadar.domain.CopyTradeConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Durable set of copy-trade configs. The webhook pipeline only reads matching fields; the execution
 * side reports executed trades through {@link #recordExecution}. Configs are deactivated, never deleted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CopyTradeConfigRegistry {

    private static final int MAX_EXECUTION_ATTEMPTS = 5;

    private final CopyTradeConfigRepository repository;
    private final CopyTradeDefaultsProperties defaults;

    public CopyTradeConfig create(CopyTradeConfigDraft draft) {
        validate(draft);
        String account = draft.accountName().strip();
        String target = Addresses.normalize(draft.targetWalletAddress());
        if (repository.existsByAccountNameAndTargetWalletAddress(account, target)) {
            throw duplicate(account, target, null);
        }

        CopyTradeConfig config = new CopyTradeConfig();
        config.setAccountName(account);
        config.setTargetWalletAddress(target);
        config.setBeneficiaryAddresses(draft.beneficiaryAddresses().stream().map(Addresses::normalize).toList());
        config.setDelegationAmount(new BigDecimal(draft.delegationAmount().strip()).toPlainString());
        config.setMaxSlippage(draft.maxSlippage() != null ? draft.maxSlippage() : defaults.getMaxSlippage());
        config.setBuyOnly(draft.buyOnly() != null ? draft.buyOnly() : defaults.isBuyOnly());
        Collection<String> routers = draft.routerAllowlist() != null ? draft.routerAllowlist() : defaults.getRouterAllowlist();
        config.setRouterAllowlist(routers.stream()
                .map(Addresses::normalize)
                .collect(Collectors.toCollection(LinkedHashSet::new)));
        config.setActive(true);
        config.setCreatedAt(Instant.now());
        config.setTotalExecutedTrades(0);
        config.setTotalSpent("0");
        try {
            CopyTradeConfig saved = repository.insert(config);
            log.info("Copy-trade config {} created: {} follows {}", saved.getId(), account, target);
            return saved;
        } catch (DuplicateKeyException e) {
            throw duplicate(account, target, e);
        }
    }

    public CopyTradeConfig get(String configId) {
        return repository.findById(configId).orElseThrow(() -> notFound(configId));
    }

    public List<CopyTradeConfig> findByAccount(String accountName) {
        return repository.findByAccountNameOrderByCreatedAtDesc(accountName);
    }

    public List<CopyTradeConfig> findActiveByAccount(String accountName) {
        return repository.findByAccountNameAndActiveTrue(accountName);
    }

    /**
     * Active configs whose target wallet is any of the given addresses (any case). Unknown placeholders are skipped.
     */
    public List<CopyTradeConfig> findActiveByWallets(Collection<String> walletAddresses) {
        Set<String> normalized = walletAddresses.stream()
                .filter(Addresses::isKnown)
                .map(Addresses::normalize)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (normalized.isEmpty()) {
            return List.of();
        }
        return repository.findByTargetWalletAddressInAndActiveTrue(normalized);
    }

    /**
     * Soft delete. Deactivating an inactive config is a no-op. Only the active flag is written.
     */
    public CopyTradeConfig deactivate(String configId) {
        CopyTradeConfig config = repository.deactivate(configId).orElseThrow(() -> notFound(configId));
        log.info("Copy-trade config {} deactivated", configId);
        return config;
    }

    /**
     * Called by the execution side after a copy trade: bumps the trade count, adds amount (ETH decimal string)
     * to the cumulative spend and stamps lastExecutedAt. The write is conditional on the spend read,
     * so concurrent executions are retried instead of lost.
     */
    public CopyTradeConfig recordExecution(String configId, String amount) {
        BigDecimal spent = TokenAmounts.parseDecimal(amount)
                .filter(a -> a.signum() >= 0)
                .orElseThrow(() -> new CopyTradeConfigException(
                        CopyTradeConfigException.ErrorCode.INVALID_CONFIG, "Invalid execution amount: " + amount));
        for (int attempt = 1; attempt <= MAX_EXECUTION_ATTEMPTS; attempt++) {
            String previous = get(configId).getTotalSpent();
            BigDecimal total = TokenAmounts.parseDecimal(previous).orElse(BigDecimal.ZERO).add(spent);
            Optional<CopyTradeConfig> updated = repository.recordExecution(
                    configId, previous, total.stripTrailingZeros().toPlainString(), Instant.now());
            if (updated.isPresent()) {
                return updated.get();
            }
            log.debug("Spend of config {} changed concurrently, retrying ({}/{})", configId, attempt, MAX_EXECUTION_ATTEMPTS);
        }
        throw new CopyTradeConfigException(CopyTradeConfigException.ErrorCode.CONCURRENT_UPDATE,
                "Copy-trade config " + configId + " is being updated concurrently");
    }

    /**
     * Delegation not yet spent, never negative.
     */
    public static BigDecimal remainingDelegation(CopyTradeConfig config) {
        BigDecimal delegation = TokenAmounts.parseDecimal(config.getDelegationAmount()).orElse(BigDecimal.ZERO);
        BigDecimal spent = TokenAmounts.parseDecimal(config.getTotalSpent()).orElse(BigDecimal.ZERO);
        BigDecimal remaining = delegation.subtract(spent);
        return remaining.signum() > 0 ? remaining : BigDecimal.ZERO;
    }

    private static void validate(CopyTradeConfigDraft draft) {
        if (draft == null || draft.accountName() == null || draft.accountName().isBlank()) {
            throw invalid("accountName is required");
        }
        if (!Addresses.isEvmAddress(draft.targetWalletAddress())) {
            throw invalid("targetWalletAddress must be an EVM address");
        }
        if (draft.beneficiaryAddresses() == null || draft.beneficiaryAddresses().isEmpty()) {
            throw invalid("at least one beneficiary address is required");
        }
        if (!draft.beneficiaryAddresses().stream().allMatch(Addresses::isEvmAddress)) {
            throw invalid("beneficiary addresses must be EVM addresses");
        }
        BigDecimal delegation = TokenAmounts.parseDecimal(draft.delegationAmount()).orElse(null);
        if (delegation == null || delegation.signum() <= 0) {
            throw invalid("delegationAmount must be a positive decimal");
        }
        if (draft.maxSlippage() != null && (draft.maxSlippage() <= 0 || draft.maxSlippage() > 1)) {
            throw invalid("maxSlippage must be in (0, 1]");
        }
        if (draft.routerAllowlist() != null && !draft.routerAllowlist().stream().allMatch(Addresses::isEvmAddress)) {
            throw invalid("router addresses must be EVM addresses");
        }
    }

    private static CopyTradeConfigException notFound(String configId) {
        return new CopyTradeConfigException(
                CopyTradeConfigException.ErrorCode.CONFIG_NOT_FOUND, "Copy-trade config not found: " + configId);
    }

    private static CopyTradeConfigException invalid(String message) {
        return new CopyTradeConfigException(CopyTradeConfigException.ErrorCode.INVALID_CONFIG, message);
    }

    private static CopyTradeConfigException duplicate(String account, String target, Throwable cause) {
        return new CopyTradeConfigException(CopyTradeConfigException.ErrorCode.DUPLICATE_CONFIG,
                "Account " + account + " already tracks " + target, cause);
    }
}
