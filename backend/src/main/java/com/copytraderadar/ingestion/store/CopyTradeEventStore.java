package com.copytraderadar.ingestion.store;

import com.copytraderadar.domain.CopyTradeEvent;
import com.copytraderadar.domain.CopyTradeEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;

/**
 * Idempotent insert of copy-trade events keyed by (configId, originalTxHash).
 * An existing row is never overwritten: re-delivered webhooks report inserted=false.
 * Concurrent duplicates are settled by the unique index; the losing insert also reports inserted=false.
 * Other storage failures propagate to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CopyTradeEventStore {

    private final CopyTradeEventRepository repository;

    public UpsertResult upsert(CopyTradeEvent event) {
        Objects.requireNonNull(event.getConfigId(), "configId");
        Objects.requireNonNull(event.getOriginalTxHash(), "originalTxHash");
        var existing = repository.findByConfigIdAndOriginalTxHash(event.getConfigId(), event.getOriginalTxHash());
        if (existing.isPresent()) {
            log.info("Duplicate delivery for config {} tx {}; keeping existing event {}",
                    event.getConfigId(), event.getOriginalTxHash(), existing.get().getId());
            return new UpsertResult(false, existing.get());
        }
        if (event.getTimestamp() == null) {
            event.setTimestamp(Instant.now());
        }
        try {
            CopyTradeEvent saved = repository.insert(event);
            log.info("Recorded copy-trade event {} for config {} tx {}",
                    saved.getId(), saved.getConfigId(), saved.getOriginalTxHash());
            return new UpsertResult(true, saved);
        } catch (DuplicateKeyException e) {
            log.info("Concurrent duplicate for config {} tx {}; insert lost the race",
                    event.getConfigId(), event.getOriginalTxHash());
            CopyTradeEvent winner = repository
                    .findByConfigIdAndOriginalTxHash(event.getConfigId(), event.getOriginalTxHash())
                    .orElse(event);
            return new UpsertResult(false, winner);
        }
    }
}
