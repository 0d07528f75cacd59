package com.copytraderadar.ingestion.classifier;

import com.copytraderadar.common.TokenAmounts;
import com.copytraderadar.ingestion.payload.WebhookPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Maps a parsed webhook into a tracked transfer or an ignored result.
 * "erc20_transfer" is tracked only for allow-listed contracts; "transaction" is always a native transfer;
 * every other event type is ignored. The decision looks at the event type and contract only: a value that is
 * not a non-negative integer counts as 0, and a missing transaction hash is left for the pipeline to handle.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WebhookEventClassifier {

    private final TrackedTokenRegistry trackedTokenRegistry;

    public ClassificationResult classify(WebhookPayload payload) {
        String eventType = payload.eventType();
        String network = payload.network();
        TrackedToken token;
        TransferKind kind;
        if (WebhookPayload.EVENT_ERC20_TRANSFER.equals(eventType)) {
            Optional<TrackedToken> erc20 = trackedTokenRegistry.findErc20(payload.contractAddress());
            if (erc20.isEmpty()) {
                return ignored(payload, "token not tracked: " + payload.contractAddress());
            }
            token = erc20.get();
            kind = TransferKind.ERC20;
        } else if (WebhookPayload.EVENT_TRANSACTION.equals(eventType)) {
            token = trackedTokenRegistry.nativeAsset();
            kind = TransferKind.NATIVE;
        } else {
            return ignored(payload, "event type not tracked");
        }

        Optional<BigInteger> parsed = TokenAmounts.parseRaw(payload.value());
        if (parsed.isEmpty()) {
            log.warn("{} transfer tx {} has malformed value '{}'; treating as 0",
                    token.symbol(), payload.transactionHash(), payload.value());
        }
        BigInteger raw = parsed.orElse(BigInteger.ZERO);
        ClassifiedTransfer transfer = new ClassifiedTransfer(
                kind,
                token,
                payload.transactionHash(),
                network,
                payload.from(),
                payload.to(),
                raw,
                TokenAmounts.toDisplay(raw, token.decimals()));
        log.info("{} transfer: {} -> {} ({} {}) tx {} on {}",
                token.symbol(), transfer.from(), transfer.to(), transfer.displayValue(), token.symbol(),
                transfer.transactionHash(), network);
        return ClassificationResult.tracked(eventType, network, transfer);
    }

    private static ClassificationResult ignored(WebhookPayload payload, String reason) {
        log.debug("Ignoring webhook {} on {}: {}", payload.eventType(), payload.network(), reason);
        return ClassificationResult.ignored(payload.eventType(), payload.network(), reason);
    }
}
