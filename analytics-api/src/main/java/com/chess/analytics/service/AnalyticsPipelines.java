package com.chess.analytics.service;

import com.chess.analytics.model.Color;
import com.chess.analytics.model.TimeControlClass;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationExpression;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.aggregation.AggregationOptions;
import org.springframework.data.mongodb.core.aggregation.ArithmeticOperators;
import org.springframework.data.mongodb.core.aggregation.ComparisonOperators;
import org.springframework.data.mongodb.core.aggregation.ConditionalOperators;
import org.springframework.data.mongodb.core.aggregation.DocumentOperators;
import org.springframework.data.mongodb.core.aggregation.SetWindowFieldsOperation;
import org.springframework.data.mongodb.core.query.Criteria;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.aggregation.Aggregation.group;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.limit;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.lookup;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.match;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.newAggregation;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.project;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.sort;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.unwind;
import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Aggregation pipelines behind the analytics queries.
 * <p>
 * Filters on stored fields always come first so they can use the indexes;
 * sample-size filters follow the group stage they depend on.
 */
final class AnalyticsPipelines {

    static final String GAMES = "games";
    static final String RATING_HISTORY = "rating_history";
    static final String PLAYERS = "players";

    private AnalyticsPipelines() {
    }

    /**
     * Result counters per ECO code over games, the same shape as the openings collection.
     */
    static Aggregation openingCounters(QueryFilters filters, Integer maxResults, Duration budget) {
        List<AggregationOperation> stages = new ArrayList<>();
        timeControlMatch(filters.timeControl()).ifPresent(stages::add);
        stages.add(group("ecoCode")
                .first("openingName").as("openingName")
                .count().as("totalGames")
                .sum(resultIs("WHITE_WIN")).as("whiteWins")
                .sum(resultIs("BLACK_WIN")).as("blackWins")
                .sum(resultIs("DRAW")).as("draws")
                .sum("whiteRating").as("totalWhiteRating")
                .sum("blackRating").as("totalBlackRating"));
        if (filters.hasMinSample()) {
            stages.add(match(where("totalGames").gte(filters.minSampleSize())));
        }
        stages.add(sort(Sort.by(Sort.Direction.DESC, "totalGames").and(Sort.by(Sort.Direction.ASC, "_id"))));
        if (maxResults != null) {
            stages.add(limit(maxResults));
        }
        return newAggregation(stages).withOptions(options(budget));
    }

    static Aggregation ratingTrend(String playerId, TimeControlClass timeControl, Integer lastN, Duration budget) {
        Criteria criteria = where("playerId").is(playerId);
        if (timeControl != null) {
            criteria = criteria.and("timeControl").is(timeControl.name());
        }
        List<AggregationOperation> stages = new ArrayList<>();
        stages.add(match(criteria));
        if (lastN != null) {
            stages.add(sort(Sort.by(Sort.Direction.DESC, "timestamp", "_id")));
            stages.add(limit(lastN));
        }
        stages.add(sort(Sort.by(Sort.Direction.ASC, "timestamp", "_id")));
        return newAggregation(stages).withOptions(options(budget));
    }

    static Aggregation timeControlComparison(QueryFilters filters, Duration budget) {
        List<AggregationOperation> stages = new ArrayList<>();
        timeControlMatch(filters.timeControl()).ifPresent(stages::add);
        stages.add(group("timeControl")
                .count().as("games")
                .sum("whiteRating").as("totalWhiteRating")
                .sum("blackRating").as("totalBlackRating")
                .sum(resultIs("WHITE_WIN")).as("whiteWins")
                .sum(resultIs("BLACK_WIN")).as("blackWins")
                .sum(resultIs("DRAW")).as("draws"));
        if (filters.hasMinSample()) {
            stages.add(match(where("games").gte(filters.minSampleSize())));
        }
        stages.add(sort(Sort.by(Sort.Direction.DESC, "games").and(Sort.by(Sort.Direction.ASC, "_id"))));
        return newAggregation(stages).withOptions(options(budget));
    }

    static Aggregation repertoire(String playerId, Color color, QueryFilters filters, Integer maxResults, Duration budget) {
        Criteria criteria = where(color.getPlayerField()).is(playerId);
        if (filters.timeControl() != null) {
            criteria = criteria.and("timeControl").is(filters.timeControl().name());
        }
        List<AggregationOperation> stages = new ArrayList<>();
        stages.add(match(criteria));
        stages.add(group("ecoCode")
                .first("openingName").as("openingName")
                .count().as("games")
                .sum(resultIs(color.getWinResult())).as("wins")
                .sum(resultIs("DRAW")).as("draws")
                .sum(resultIs(color.getLossResult())).as("losses")
                .max("playedAt").as("lastPlayed"));
        if (filters.hasMinSample()) {
            stages.add(match(where("games").gte(filters.minSampleSize())));
        }
        stages.add(sort(Sort.by(Sort.Direction.DESC, "games").and(Sort.by(Sort.Direction.ASC, "_id"))));
        if (maxResults != null) {
            stages.add(limit(maxResults));
        }
        return newAggregation(stages).withOptions(options(budget));
    }

    /**
     * Per player: successive rating changes via a window over the player's points
     * in time order, then their population standard deviation.
     */
    static Aggregation volatility(QueryFilters filters, int minPoints, int maxResults, Duration budget) {
        List<AggregationOperation> stages = new ArrayList<>();
        timeControlMatch(filters.timeControl()).ifPresent(stages::add);
        stages.add(SetWindowFieldsOperation.builder()
                .partitionByField("playerId")
                .sortBy(Sort.by(Sort.Direction.ASC, "timestamp", "_id"))
                .output(DocumentOperators.valueOf("rating").shift(-1)).as("previousRating")
                .build());
        stages.add(project("playerId", "rating")
                .and(ArithmeticOperators.valueOf("rating").subtract("previousRating")).as("ratingChange"));
        stages.add(group("playerId")
                .stdDevPop("ratingChange").as("volatility")
                .avg("ratingChange").as("averageChange")
                .min("rating").as("minRating")
                .max("rating").as("maxRating")
                .count().as("points"));
        stages.add(match(where("points").gte(minPoints)));
        stages.add(sort(Sort.by(Sort.Direction.DESC, "volatility").and(Sort.by(Sort.Direction.ASC, "_id"))));
        stages.add(limit(maxResults));
        stages.add(lookup(PLAYERS, "_id", "_id", "player"));
        stages.add(unwind("player", true));
        return newAggregation(stages).withOptions(options(budget));
    }

    private static Optional<AggregationOperation> timeControlMatch(TimeControlClass timeControl) {
        if (timeControl == null) {
            return Optional.empty();
        }
        return Optional.of(match(where("timeControl").is(timeControl.name())));
    }

    private static AggregationExpression resultIs(String result) {
        return ConditionalOperators.when(ComparisonOperators.valueOf("result").equalToValue(result))
                .then(1)
                .otherwise(0);
    }

    /**
     * Grouping and sorting over the full games collection can exceed the 100 MB
     * in-memory stage limit, so stages may spill to disk.
     */
    private static AggregationOptions options(Duration budget) {
        return AggregationOptions.builder().allowDiskUse(true).maxTime(budget).build();
    }
}
