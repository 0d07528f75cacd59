package com.copytraderadar.api.controller;

import com.copytraderadar.api.dto.TokenInfo;
import com.copytraderadar.api.dto.WebhookAckResponse;
import com.copytraderadar.ingestion.classifier.ClassifiedTransfer;
import com.copytraderadar.ingestion.pipeline.BranchOutcome;
import com.copytraderadar.ingestion.pipeline.IngestionOutcome;
import com.copytraderadar.ingestion.pipeline.WebhookIngestionService;
import com.copytraderadar.ingestion.webhook.WebhookSignatureVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;

/**
 * Inbound blockchain-activity webhook. The body is taken as the raw string the sender signed.
 * Responds 200 with an acknowledgement for every authenticated request; 401 on signature failure.
 */
@RestController
@RequiredArgsConstructor
public class WebhookCallbackController {

    static final String IGNORED_MESSAGE = "Data received (non-target token ignored)";
    static final String TRACKED_MESSAGE = "Target token event received";

    private final WebhookIngestionService ingestionService;

    @PostMapping({"/", "/api/v1/callback"})
    public Mono<ResponseEntity<WebhookAckResponse>> receive(
            @RequestBody(required = false) String body,
            @RequestHeader HttpHeaders headers) {
        String signature = WebhookSignatureVerifier.extractSignature(headers);
        String rawBody = body != null ? body : "";
        return Mono.fromCallable(() -> ingestionService.ingest(rawBody, signature))
                .subscribeOn(Schedulers.boundedElastic())
                .map(outcome -> ResponseEntity.ok(toResponse(outcome)));
    }

    static WebhookAckResponse toResponse(IngestionOutcome outcome) {
        var classification = outcome.classification();
        if (classification.isIgnored()) {
            return new WebhookAckResponse(IGNORED_MESSAGE, Instant.now(), classification.eventType(),
                    classification.network(), outcome.signatureVerified(), null, null, null, null);
        }
        ClassifiedTransfer transfer = classification.transfer();
        TokenInfo tokenInfo = new TokenInfo(
                transfer.token().address(),
                transfer.token().symbol(),
                transfer.token().name(),
                transfer.token().decimals(),
                transfer.rawValue().toString(),
                transfer.displayValue());
        WebhookAckResponse.Matches matches = new WebhookAckResponse.Matches(
                outcome.branches().size(),
                outcome.count(BranchOutcome.Status.PERSISTED),
                outcome.count(BranchOutcome.Status.DUPLICATE),
                outcome.count(BranchOutcome.Status.FAILED),
                outcome.notificationsAttempted(),
                outcome.matchError());
        return new WebhookAckResponse(TRACKED_MESSAGE, Instant.now(), classification.eventType(),
                classification.network(), outcome.signatureVerified(), outcome.payload().raw(), tokenInfo,
                transfer.token().symbol(), matches);
    }
}
