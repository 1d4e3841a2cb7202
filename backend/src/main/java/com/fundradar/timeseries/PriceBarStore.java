package com.fundradar.timeseries;

import com.fundradar.domain.PriceBar;
import com.mongodb.bulk.BulkWriteResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Idempotent bulk upsert of price bars keyed by {@code symbol|date}. Re-storing identical bars changes nothing.
 */
@Component
@RequiredArgsConstructor
public class PriceBarStore {

    private static final int UPSERT_FLUSH_SIZE = 500;

    private final MongoTemplate mongoTemplate;

    /**
     * @return number of rows inserted or changed
     */
    public int upsert(List<PriceBar> bars) {
        int changed = 0;
        for (int from = 0; from < bars.size(); from += UPSERT_FLUSH_SIZE) {
            changed += bulkUpsert(bars.subList(from, Math.min(bars.size(), from + UPSERT_FLUSH_SIZE)));
        }
        return changed;
    }

    private int bulkUpsert(List<PriceBar> bars) {
        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, PriceBar.class);
        for (PriceBar bar : bars) {
            bar.ensureId();
            Query query = Query.query(Criteria.where("_id").is(bar.getId()));
            Update update = new Update()
                    .set("symbol", bar.getSymbol())
                    .set("date", bar.getDate())
                    .set("open", bar.getOpen())
                    .set("high", bar.getHigh())
                    .set("low", bar.getLow())
                    .set("close", bar.getClose())
                    .set("adjClose", bar.getAdjClose())
                    .set("volume", bar.getVolume())
                    .set("dividend", bar.getDividend())
                    .set("split", bar.getSplit());
            ops.upsert(query, update);
        }
        BulkWriteResult result = ops.execute();
        return result.getUpserts().size() + result.getModifiedCount();
    }
}
