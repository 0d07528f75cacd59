package com.copytraderadar.ingestion.pipeline;

import com.copytraderadar.common.Addresses;
import com.copytraderadar.copytrade.CopyTradeConfigRegistry;
import com.copytraderadar.domain.CopyTradeConfig;
import com.copytraderadar.domain.CopyTradeEvent;
import com.copytraderadar.domain.CopyTradeEventStatus;
import com.copytraderadar.ingestion.classifier.ClassificationResult;
import com.copytraderadar.ingestion.classifier.ClassifiedTransfer;
import com.copytraderadar.ingestion.classifier.TransferKind;
import com.copytraderadar.ingestion.classifier.WebhookEventClassifier;
import com.copytraderadar.ingestion.config.WebhookProperties;
import com.copytraderadar.ingestion.payload.WebhookPayload;
import com.copytraderadar.ingestion.payload.WebhookPayloadParser;
import com.copytraderadar.ingestion.store.CopyTradeEventStore;
import com.copytraderadar.ingestion.store.UpsertResult;
import com.copytraderadar.ingestion.webhook.VerifiedWebhook;
import com.copytraderadar.ingestion.webhook.WebhookSignatureVerifier;
import com.copytraderadar.notification.NotificationDispatcher;
import com.copytraderadar.notification.TransferNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Webhook pipeline: verify, parse, classify, match active configs, persist one event per config, notify.
 * A tracked transfer without a transaction hash is acknowledged but never persisted, since the hash is the idempotency key.
 * Only authentication failures escape (as {@link com.copytraderadar.ingestion.webhook.WebhookAuthenticationException});
 * a failing config branch is recorded in the outcome and the remaining branches still run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookIngestionService {

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookProperties webhookProperties;
    private final WebhookPayloadParser payloadParser;
    private final WebhookEventClassifier classifier;
    private final CopyTradeConfigRegistry configRegistry;
    private final CopyTradeEventStore eventStore;
    private final NotificationDispatcher notificationDispatcher;

    public IngestionOutcome ingest(String rawBody, String signature) {
        VerifiedWebhook verified = signatureVerifier.process(
                rawBody, signature, webhookProperties.getSecret(), webhookProperties.isRequireSignature());
        WebhookPayload payload = payloadParser.parse(verified.data());
        ClassificationResult classification = classifier.classify(payload);
        if (classification.isIgnored()) {
            return new IngestionOutcome(payload, verified.verified(), classification, List.of(), null);
        }
        ClassifiedTransfer transfer = classification.transfer();
        if (WebhookPayload.NO_HASH.equals(transfer.transactionHash()) || transfer.transactionHash().isBlank()) {
            log.warn("Tracked {} transfer {} -> {} has no transaction hash; not persisted",
                    transfer.token().symbol(), transfer.from(), transfer.to());
            return new IngestionOutcome(payload, verified.verified(), classification, List.of(), "missing transaction hash");
        }

        List<CopyTradeConfig> configs;
        try {
            configs = configRegistry.findActiveByWallets(List.of(transfer.from(), transfer.to()));
        } catch (RuntimeException e) {
            log.error("Config lookup failed for tx {} on {}: {}", transfer.transactionHash(), transfer.network(), e.getMessage(), e);
            return new IngestionOutcome(payload, verified.verified(), classification, List.of(), "config lookup failed");
        }
        if (configs.isEmpty()) {
            log.info("No active copy-trade configs for {} / {} (tx {})", transfer.from(), transfer.to(), transfer.transactionHash());
        }

        List<BranchOutcome> branches = new ArrayList<>(configs.size());
        for (CopyTradeConfig config : configs) {
            branches.add(processBranch(config, transfer));
        }
        return new IngestionOutcome(payload, verified.verified(), classification, List.copyOf(branches), null);
    }

    private BranchOutcome processBranch(CopyTradeConfig config, ClassifiedTransfer transfer) {
        UpsertResult result;
        try {
            result = eventStore.upsert(toEvent(config, transfer));
        } catch (RuntimeException e) {
            log.warn("Persisting tx {} for config {} failed: {}", transfer.transactionHash(), config.getId(), e.getMessage(), e);
            return new BranchOutcome(config.getId(), config.getAccountName(), BranchOutcome.Status.FAILED, null, false, e.getMessage());
        }
        if (!result.inserted()) {
            return new BranchOutcome(config.getId(), config.getAccountName(), BranchOutcome.Status.DUPLICATE,
                    result.event().getId(), false, null);
        }
        boolean attempted = notificationDispatcher.dispatch(toNotification(config, transfer));
        return new BranchOutcome(config.getId(), config.getAccountName(), BranchOutcome.Status.PERSISTED,
                result.event().getId(), attempted, null);
    }

    private static CopyTradeEvent toEvent(CopyTradeConfig config, ClassifiedTransfer transfer) {
        CopyTradeEvent event = new CopyTradeEvent();
        event.setConfigId(config.getId());
        event.setAccountName(config.getAccountName());
        event.setTargetWalletAddress(config.getTargetWalletAddress());
        event.setOriginalTxHash(Addresses.normalize(transfer.transactionHash()));
        event.setNetwork(transfer.network());
        event.setTokenAddress(transfer.token().address());
        event.setTokenSymbol(transfer.token().symbol());
        event.setTokenName(transfer.token().name());
        event.setOriginalAmount(transfer.rawValue().toString());
        event.setCopiedAmount(transfer.rawValue().toString());
        event.setTimestamp(Instant.now());
        event.setStatus(CopyTradeEventStatus.PENDING);
        return event;
    }

    private static TransferNotification toNotification(CopyTradeConfig config, ClassifiedTransfer transfer) {
        return new TransferNotification(
                transfer.kind() == TransferKind.NATIVE,
                config.getAccountName(),
                transfer.token().symbol(),
                transfer.from(),
                transfer.to(),
                transfer.displayValue(),
                transfer.transactionHash(),
                transfer.network());
    }
}
