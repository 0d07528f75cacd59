package com.copytraderadar.api.controller;

import com.copytraderadar.api.dto.CopyTradeEventResponse;
import com.copytraderadar.copytrade.CopyTradeEventService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Audit trail of recorded copy-trade events, newest first.
 */
@RestController
@RequestMapping("/api/v1/copy-trade/events")
@RequiredArgsConstructor
public class CopyTradeEventController {

    private final CopyTradeEventService eventService;

    @GetMapping
    public Mono<List<CopyTradeEventResponse>> list(@RequestParam(required = false) String account,
                                                   @RequestParam(required = false) String configId) {
        return Mono.fromCallable(() -> (configId != null && !configId.isBlank()
                        ? eventService.findByConfig(configId)
                        : eventService.findByAccount(account == null ? "" : account))
                        .stream()
                        .map(CopyTradeEventResponse::from)
                        .toList())
                .subscribeOn(Schedulers.boundedElastic());
    }
}
