package com.copytraderadar.api.controller;

import com.copytraderadar.api.dto.CopyTradeConfigResponse;
import com.copytraderadar.api.dto.CreateCopyTradeConfigRequest;
import com.copytraderadar.copytrade.CopyTradeConfigDraft;
import com.copytraderadar.copytrade.CopyTradeConfigRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Operator surface for copy-trade configs: create, list by account, get, deactivate.
 */
@RestController
@RequestMapping("/api/v1/copy-trade/configs")
@RequiredArgsConstructor
public class CopyTradeConfigController {

    private final CopyTradeConfigRegistry registry;

    @PostMapping
    public Mono<ResponseEntity<CopyTradeConfigResponse>> create(@Valid @RequestBody CreateCopyTradeConfigRequest request) {
        CopyTradeConfigDraft draft = new CopyTradeConfigDraft(
                request.accountName(),
                request.targetWalletAddress(),
                request.beneficiaryAddresses(),
                request.delegationAmount(),
                request.maxSlippage(),
                request.buyOnly(),
                request.routerAllowlist());
        return Mono.fromCallable(() -> registry.create(draft))
                .subscribeOn(Schedulers.boundedElastic())
                .map(c -> ResponseEntity.status(HttpStatus.CREATED).body(CopyTradeConfigResponse.from(c)));
    }

    @GetMapping
    public Mono<List<CopyTradeConfigResponse>> list(@RequestParam String account,
                                                    @RequestParam(defaultValue = "false") boolean activeOnly) {
        return Mono.fromCallable(() -> (activeOnly ? registry.findActiveByAccount(account) : registry.findByAccount(account))
                        .stream()
                        .map(CopyTradeConfigResponse::from)
                        .toList())
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}")
    public Mono<CopyTradeConfigResponse> get(@PathVariable String id) {
        return Mono.fromCallable(() -> CopyTradeConfigResponse.from(registry.get(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/deactivate")
    public Mono<CopyTradeConfigResponse> deactivate(@PathVariable String id) {
        return Mono.fromCallable(() -> CopyTradeConfigResponse.from(registry.deactivate(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
