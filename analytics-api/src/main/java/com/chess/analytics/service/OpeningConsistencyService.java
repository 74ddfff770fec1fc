package com.chess.analytics.service;

import com.chess.analytics.dto.ConsistencyReport;
import com.chess.analytics.dto.OpeningMismatch;
import com.chess.analytics.model.readonly.OpeningDocument;
import com.chess.analytics.service.QueryBudget.Deadline;
import com.mongodb.ClientSessionOptions;
import com.mongodb.client.ClientSession;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Recomputes opening counters from the games and compares them with the
 * counters maintained during ingestion. Any difference is reported.
 * <p>
 * Both reads run in one snapshot session, so they see the same committed
 * state: an import commits its games and its counter increments in one
 * transaction and is either wholly visible or not at all. Snapshot reads need
 * a MongoDB 5.0 replica set, and the whole check must finish inside the
 * server's snapshot history window (five minutes by default).
 */
@Service
public class OpeningConsistencyService {

    private static final Logger log = LoggerFactory.getLogger(OpeningConsistencyService.class);

    private static final ClientSessionOptions SNAPSHOT = ClientSessionOptions.builder().snapshot(true).build();

    private final MongoTemplate mongoTemplate;
    private final QueryBudget queryBudget;

    public OpeningConsistencyService(
            MongoTemplate mongoTemplate,
            QueryBudget queryBudget
    ) {
        this.mongoTemplate = mongoTemplate;
        this.queryBudget = queryBudget;
    }

    public ConsistencyReport check(QueryFilters filters) {
        Deadline deadline = queryBudget.start(filters);
        return mongoTemplate.withSession(SNAPSHOT)
                .execute(operations -> check(operations, deadline), ClientSession::close);
    }

    private ConsistencyReport check(MongoOperations operations, Deadline deadline) {
        // Stored counters first, then the games they should agree with
        List<OpeningDocument> openings = queryBudget.run("Stored opening counters", deadline,
                remaining -> operations.find(new Query().maxTimeMsec(remaining.toMillis()), OpeningDocument.class));
        List<Document> recomputed = queryBudget.run("Opening consistency", deadline,
                remaining -> operations.aggregate(AnalyticsPipelines.openingCounters(QueryFilters.none(), null, remaining),
                        AnalyticsPipelines.GAMES, Document.class).getMappedResults());

        Map<String, OpeningDocument> stored = new HashMap<>();
        for (OpeningDocument opening : openings) {
            stored.put(opening.getId(), opening);
        }
        Map<String, Document> actual = new HashMap<>();
        for (Document counters : recomputed) {
            actual.put(counters.getString("_id"), counters);
        }

        TreeSet<String> codes = new TreeSet<>(actual.keySet());
        codes.addAll(stored.keySet());

        List<OpeningMismatch> mismatches = new ArrayList<>();
        for (String code : codes) {
            OpeningMismatch row = compare(code, stored.get(code), actual.get(code));
            if (row != null) {
                mismatches.add(row);
            }
        }
        if (mismatches.isEmpty()) {
            log.info("Opening counters consistent for {} openings", codes.size());
        } else {
            log.warn("Opening counters differ from games for {} of {} openings", mismatches.size(), codes.size());
        }
        return new ConsistencyReport(codes.size(), mismatches.isEmpty(), mismatches);
    }

    private static OpeningMismatch compare(String code, OpeningDocument stored, Document actual) {
        long storedGames = stored != null ? stored.getTotalGames() : 0;
        long storedWhite = stored != null ? stored.getWhiteWins() : 0;
        long storedBlack = stored != null ? stored.getBlackWins() : 0;
        long storedDraws = stored != null ? stored.getDraws() : 0;
        long actualGames = count(actual, "totalGames");
        long actualWhite = count(actual, "whiteWins");
        long actualBlack = count(actual, "blackWins");
        long actualDraws = count(actual, "draws");

        if (storedGames == actualGames && storedWhite == actualWhite
                && storedBlack == actualBlack && storedDraws == actualDraws) {
            return null;
        }
        return new OpeningMismatch(code, storedGames, storedWhite, storedBlack, storedDraws,
                actualGames, actualWhite, actualBlack, actualDraws);
    }

    private static long count(Document counters, String field) {
        if (counters == null) {
            return 0;
        }
        Object value = counters.get(field);
        return value instanceof Number ? ((Number) value).longValue() : 0;
    }
}
