package com.copytraderadar.copytrade;

import com.copytraderadar.domain.CopyTradeEvent;
import com.copytraderadar.domain.CopyTradeEventRepository;
import com.copytraderadar.domain.CopyTradeEventStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read access and status transitions for recorded events. Only PENDING events move, and only once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CopyTradeEventService {

    private final CopyTradeEventRepository repository;

    public List<CopyTradeEvent> findByAccount(String accountName) {
        return repository.findByAccountNameOrderByTimestampDesc(accountName);
    }

    public List<CopyTradeEvent> findByConfig(String configId) {
        return repository.findByConfigIdOrderByTimestampDesc(configId);
    }

    public CopyTradeEvent markSuccess(String eventId, String transactionHash, String copiedAmount) {
        String amount = copiedAmount != null && !copiedAmount.isBlank() ? copiedAmount : null;
        CopyTradeEvent event = repository.transitionFromPending(
                        eventId, CopyTradeEventStatus.SUCCESS, transactionHash, amount, null)
                .orElseThrow(() -> rejected(eventId));
        log.info("Copy-trade event {} SUCCESS (tx {})", eventId, transactionHash);
        return event;
    }

    public CopyTradeEvent markFailed(String eventId, String errorMessage) {
        CopyTradeEvent event = repository.transitionFromPending(
                        eventId, CopyTradeEventStatus.FAILED, null, null, errorMessage)
                .orElseThrow(() -> rejected(eventId));
        log.warn("Copy-trade event {} FAILED: {}", eventId, errorMessage);
        return event;
    }

    /** Why a conditional transition matched nothing: unknown id, or the event already left PENDING. */
    private CopyTradeEventException rejected(String eventId) {
        return repository.findById(eventId)
                .map(event -> new CopyTradeEventException(CopyTradeEventException.ErrorCode.INVALID_TRANSITION,
                        "Event " + eventId + " is already " + event.getStatus()))
                .orElseGet(() -> new CopyTradeEventException(
                        CopyTradeEventException.ErrorCode.EVENT_NOT_FOUND, "Copy-trade event not found: " + eventId));
    }
}
