package com.copytraderadar.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed status transitions for copy_trade_events.
 */
@Repository
@RequiredArgsConstructor
public class CopyTradeEventRepositoryImpl implements CopyTradeEventRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<CopyTradeEvent> transitionFromPending(String id, CopyTradeEventStatus target,
                                                          String transactionHash, String copiedAmount, String errorMessage) {
        Query query = new Query(where("id").is(id).and("status").is(CopyTradeEventStatus.PENDING));
        Update update = new Update().set("status", target);
        if (transactionHash != null) {
            update.set("transactionHash", transactionHash);
        }
        if (copiedAmount != null) {
            update.set("copiedAmount", copiedAmount);
        }
        if (errorMessage != null) {
            update.set("errorMessage", errorMessage);
        }
        return Optional.ofNullable(mongoTemplate.findAndModify(
                query, update, FindAndModifyOptions.options().returnNew(true), CopyTradeEvent.class));
    }
}
