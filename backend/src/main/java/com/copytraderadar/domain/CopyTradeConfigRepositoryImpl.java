package com.copytraderadar.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed atomic updates for copy_trade_configs.
 */
@Repository
@RequiredArgsConstructor
public class CopyTradeConfigRepositoryImpl implements CopyTradeConfigRepositoryCustom {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<CopyTradeConfig> deactivate(String id) {
        Query query = new Query(where("id").is(id));
        Update update = new Update().set("active", false);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, CopyTradeConfig.class));
    }

    @Override
    public Optional<CopyTradeConfig> recordExecution(String id, String expectedTotalSpent, String newTotalSpent, Instant executedAt) {
        Query query = new Query(where("id").is(id).and("totalSpent").is(expectedTotalSpent));
        Update update = new Update()
                .inc("totalExecutedTrades", 1)
                .set("totalSpent", newTotalSpent)
                .set("lastExecutedAt", executedAt);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update, RETURN_NEW, CopyTradeConfig.class));
    }
}
