package com.fplrefresh.ingestion.store;

import com.fplrefresh.common.Batches;
import com.fplrefresh.domain.Gameweek;
import com.mongodb.bulk.BulkWriteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Upserts rows by natural id in fixed-size bulk batches. Replaying the same rows converges to the
 * same documents (set-by-id), so a retried or repeated write is harmless.
 * Fields named in {@code insertOnlyFields} are written only when the row is created.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IdempotentUpsertStore {

    private final MongoTemplate mongoTemplate;

    public <T> BatchWriteResult upsertAll(Class<T> type, List<T> rows, Function<T, Object> naturalId,
                                          Set<String> insertOnlyFields, int batchSize) {
        if (rows.isEmpty()) {
            return BatchWriteResult.EMPTY;
        }
        String collection = mongoTemplate.getCollectionName(type);
        int batches = 0;
        int failed = 0;
        long written = 0;
        for (List<T> batch : Batches.of(rows, batchSize)) {
            batches++;
            try {
                BulkOperations bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, type);
                for (T row : batch) {
                    bulk.upsert(Query.query(Criteria.where("_id").is(naturalId.apply(row))),
                            toUpdate(row, insertOnlyFields));
                }
                BulkWriteResult result = bulk.execute();
                written += result.getMatchedCount() + result.getUpserts().size();
            } catch (RuntimeException e) {
                failed++;
                log.error("Upsert batch {} into {} failed ({} rows): {}", batches, collection, batch.size(), e.getMessage());
            }
        }
        log.debug("Upserted {} row(s) into {} in {} batch(es), {} failed", written, collection, batches, failed);
        return new BatchWriteResult(batches, failed, written);
    }

    /** Sets the one-time stats flag; the only writer of {@link Gameweek#PLAYER_STATS_SYNCED} after insert. */
    public void markPlayerStatsSynced(int gameweekId) {
        mongoTemplate.updateFirst(Query.query(Criteria.where("_id").is(gameweekId)),
                Update.update(Gameweek.PLAYER_STATS_SYNCED, true), Gameweek.class);
    }

    private Update toUpdate(Object row, Set<String> insertOnlyFields) {
        Document doc = new Document();
        mongoTemplate.getConverter().write(row, doc);
        doc.remove("_id");
        doc.remove("_class");
        Update update = new Update();
        doc.forEach((field, value) -> {
            if (insertOnlyFields.contains(field)) {
                update.setOnInsert(field, value);
            } else {
                update.set(field, value);
            }
        });
        return update;
    }
}
