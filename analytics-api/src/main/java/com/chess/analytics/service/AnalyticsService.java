package com.chess.analytics.service;

import com.chess.analytics.config.AnalyticsProperties;
import com.chess.analytics.dto.DatabaseStatus;
import com.chess.analytics.dto.GameSummary;
import com.chess.analytics.dto.OpeningStats;
import com.chess.analytics.dto.PlayerProfile;
import com.chess.analytics.dto.PlayerReport;
import com.chess.analytics.dto.RatingPoint;
import com.chess.analytics.dto.RatingTrend;
import com.chess.analytics.dto.RepertoireEntry;
import com.chess.analytics.dto.TimeControlStats;
import com.chess.analytics.dto.VolatilityEntry;
import com.chess.analytics.exception.ResourceNotFoundException;
import com.chess.analytics.model.Color;
import com.chess.analytics.model.TimeControlClass;
import com.chess.analytics.model.readonly.GameDocument;
import com.chess.analytics.model.readonly.ImportRunDocument;
import com.chess.analytics.model.readonly.OpeningDocument;
import com.chess.analytics.model.readonly.PlayerDocument;
import com.chess.analytics.model.readonly.RatingHistoryDocument;
import com.chess.analytics.service.QueryBudget.Deadline;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * Read-only statistics over the imported games.
 * <p>
 * Everything is computed by MongoDB aggregation; this class builds the
 * pipelines, applies the time budget and maps the result documents.
 * Each public operation starts one {@link Deadline} and every query it runs,
 * the player lookup included, is sent with the time left on it.
 */
@Service
public class AnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

    /** Volatility needs at least two points to have one rating change */
    private static final int MIN_VOLATILITY_POINTS = 2;

    private static final int REPORT_RECENT_GAMES = 10;

    private static final int REPORT_REPERTOIRE = 10;

    private final MongoTemplate mongoTemplate;
    private final QueryBudget queryBudget;
    private final AnalyticsProperties properties;

    public AnalyticsService(
            MongoTemplate mongoTemplate,
            QueryBudget queryBudget,
            AnalyticsProperties properties
    ) {
        this.mongoTemplate = mongoTemplate;
        this.queryBudget = queryBudget;
        this.properties = properties;
    }

    // ============ OPENINGS ============

    /**
     * Win, loss and draw rates per opening, most played first.
     * Without a time-control filter the maintained opening counters are read
     * directly; with one, the games themselves are aggregated.
     */
    public List<OpeningStats> openingSuccessRates(QueryFilters filters, Integer limit) {
        int maxResults = positiveOr(limit, properties.getOpeningLimit());
        Deadline deadline = queryBudget.start(filters);

        if (filters.timeControl() == null) {
            Query query = new Query();
            if (filters.hasMinSample()) {
                query.addCriteria(where("totalGames").gte(filters.minSampleSize()));
            }
            query.with(Sort.by(Sort.Direction.DESC, "totalGames").and(Sort.by(Sort.Direction.ASC, "ecoCode")));
            query.limit(maxResults);
            List<OpeningDocument> openings = queryBudget.run("Opening success rates", deadline,
                    remaining -> mongoTemplate.find(query.maxTimeMsec(remaining.toMillis()), OpeningDocument.class));
            return openings.stream()
                    .map(o -> openingStats(o.getEcoCode(), o.getOpeningName(), o.getTotalGames(), o.getWhiteWins(),
                            o.getBlackWins(), o.getDraws(), o.getTotalWhiteRating(), o.getTotalBlackRating()))
                    .toList();
        }

        return aggregate("Opening success rates", deadline, AnalyticsPipelines.GAMES,
                remaining -> AnalyticsPipelines.openingCounters(filters, maxResults, remaining)).stream()
                .map(d -> openingStats(d.getString("_id"), d.getString("openingName"), longValue(d, "totalGames"),
                        longValue(d, "whiteWins"), longValue(d, "blackWins"), longValue(d, "draws"),
                        longValue(d, "totalWhiteRating"), longValue(d, "totalBlackRating")))
                .toList();
    }

    // ============ RATINGS ============

    /**
     * Rating points of a player in ascending time order.
     *
     * @param lastN only the most recent N points; null for all
     */
    public RatingTrend ratingTrend(String playerName, QueryFilters filters, Integer lastN) {
        if (lastN != null && lastN < 1) {
            throw new IllegalArgumentException("lastN must be positive: " + lastN);
        }
        Deadline deadline = queryBudget.start(filters);
        PlayerDocument player = findPlayer(playerName, deadline);
        return ratingTrend(player, filters.timeControl(), lastN, deadline);
    }

    /**
     * Population standard deviation of successive rating changes per player, most volatile first.
     * The minimum sample size counts rating points.
     */
    public List<VolatilityEntry> volatility(QueryFilters filters, Integer limit) {
        int maxResults = positiveOr(limit, properties.getVolatilityLimit());
        int minPoints = Math.max(MIN_VOLATILITY_POINTS, filters.minSampleOr(MIN_VOLATILITY_POINTS));
        Deadline deadline = queryBudget.start(filters);

        return aggregate("Rating volatility", deadline, AnalyticsPipelines.RATING_HISTORY,
                remaining -> AnalyticsPipelines.volatility(filters, minPoints, maxResults, remaining)).stream()
                .map(d -> {
                    Document player = d.get("player", Document.class);
                    int minRating = intValue(d, "minRating");
                    int maxRating = intValue(d, "maxRating");
                    return new VolatilityEntry(
                            d.getString("_id"),
                            player != null ? player.getString("displayName") : null,
                            longValue(d, "points"),
                            round(doubleValue(d, "volatility")),
                            round(doubleValue(d, "averageChange")),
                            minRating,
                            maxRating,
                            maxRating - minRating
                    );
                })
                .toList();
    }

    // ============ TIME CONTROLS ============

    public List<TimeControlStats> timeControlComparison(QueryFilters filters) {
        Deadline deadline = queryBudget.start(filters);
        return aggregate("Time-control comparison", deadline, AnalyticsPipelines.GAMES,
                remaining -> AnalyticsPipelines.timeControlComparison(filters, remaining)).stream()
                .map(d -> {
                    long games = longValue(d, "games");
                    String timeControl = d.getString("_id");
                    return new TimeControlStats(
                            timeControl != null ? TimeControlClass.valueOf(timeControl) : TimeControlClass.UNKNOWN,
                            games,
                            round(ratio(longValue(d, "totalWhiteRating") + longValue(d, "totalBlackRating"), 2 * games)),
                            round(ratio(longValue(d, "whiteWins"), games)),
                            round(ratio(longValue(d, "blackWins"), games)),
                            round(ratio(longValue(d, "draws"), games))
                    );
                })
                .toList();
    }

    // ============ PLAYERS ============

    /**
     * Openings a player has played with one color, most played first.
     */
    public List<RepertoireEntry> repertoire(String playerName, Color color, QueryFilters filters) {
        Deadline deadline = queryBudget.start(filters);
        PlayerDocument player = findPlayer(playerName, deadline);
        return repertoire(player, color, filters, null, deadline);
    }

    /**
     * Profile, recent trend, white repertoire and recent games of one player.
     * The sub-queries share the request's budget.
     */
    public PlayerReport playerReport(String playerName, QueryFilters filters) {
        Deadline deadline = queryBudget.start(filters);
        PlayerDocument player = findPlayer(playerName, deadline);
        long ratingPoints = queryBudget.run("Rating point count", deadline, remaining -> mongoTemplate.count(
                query(where("playerId").is(player.getId())).maxTimeMsec(remaining.toMillis()),
                RatingHistoryDocument.class));
        RatingTrend trend = ratingTrend(player, null, properties.getReportTrendPoints(), deadline);
        List<RepertoireEntry> repertoire = repertoire(player, Color.WHITE, QueryFilters.none(), REPORT_REPERTOIRE, deadline);
        List<GameDocument> games = queryBudget.run("Recent games", deadline, remaining -> {
            Query recent = query(new Criteria().orOperator(
                    where("whitePlayerId").is(player.getId()),
                    where("blackPlayerId").is(player.getId())))
                    .with(Sort.by(Sort.Direction.DESC, "playedAt"))
                    .limit(REPORT_RECENT_GAMES)
                    .maxTimeMsec(remaining.toMillis());
            recent.fields().exclude("moves");
            return mongoTemplate.find(recent, GameDocument.class);
        });
        List<GameSummary> recentGames = games.stream().map(GameSummary::from).toList();
        return new PlayerReport(PlayerProfile.from(player, ratingPoints), trend, repertoire, recentGames);
    }

    // ============ STATUS ============

    public DatabaseStatus databaseStatus(QueryFilters filters) {
        Deadline deadline = queryBudget.start(filters);
        List<ImportRunDocument> recentRuns = queryBudget.run("Recent import runs", deadline,
                remaining -> mongoTemplate.find(new Query()
                        .with(Sort.by(Sort.Direction.DESC, "startedAt"))
                        .limit(properties.getRecentRuns())
                        .maxTimeMsec(remaining.toMillis()), ImportRunDocument.class));
        return new DatabaseStatus(
                count(PlayerDocument.class, deadline),
                count(GameDocument.class, deadline),
                count(OpeningDocument.class, deadline),
                count(RatingHistoryDocument.class, deadline),
                recentRuns
        );
    }

    /**
     * Look a player up by name; case and surrounding whitespace do not matter.
     */
    private PlayerDocument findPlayer(String playerName, Deadline deadline) {
        if (playerName == null || playerName.isBlank()) {
            throw new IllegalArgumentException("Player name is required");
        }
        PlayerDocument player = queryBudget.run("Player lookup", deadline, remaining -> mongoTemplate.findOne(
                query(where("nameKey").is(nameKey(playerName))).maxTimeMsec(remaining.toMillis()),
                PlayerDocument.class));
        if (player == null) {
            throw new ResourceNotFoundException("Player", playerName);
        }
        return player;
    }

    static String nameKey(String name) {
        return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    // ============ HELPERS ============

    private RatingTrend ratingTrend(PlayerDocument player, TimeControlClass timeControl, Integer lastN, Deadline deadline) {
        List<RatingPoint> points = aggregate("Rating trend", deadline, AnalyticsPipelines.RATING_HISTORY,
                remaining -> AnalyticsPipelines.ratingTrend(player.getId(), timeControl, lastN, remaining)).stream()
                .map(d -> {
                    String timeControlName = d.getString("timeControl");
                    return new RatingPoint(
                            d.getDate("timestamp").toInstant(),
                            intValue(d, "rating"),
                            timeControlName != null ? TimeControlClass.valueOf(timeControlName) : TimeControlClass.UNKNOWN,
                            d.getString("gameKey")
                    );
                })
                .toList();
        int change = points.size() < 2 ? 0 : points.get(points.size() - 1).rating() - points.get(0).rating();
        return new RatingTrend(player.getId(), player.getDisplayName(), timeControl, points, change);
    }

    private List<RepertoireEntry> repertoire(PlayerDocument player, Color color, QueryFilters filters,
                                             Integer maxResults, Deadline deadline) {
        return aggregate("Repertoire", deadline, AnalyticsPipelines.GAMES,
                remaining -> AnalyticsPipelines.repertoire(player.getId(), color, filters, maxResults, remaining)).stream()
                .map(d -> {
                    long games = longValue(d, "games");
                    long wins = longValue(d, "wins");
                    long draws = longValue(d, "draws");
                    Date lastPlayed = d.getDate("lastPlayed");
                    return new RepertoireEntry(
                            d.getString("_id"),
                            d.getString("openingName"),
                            games,
                            wins,
                            draws,
                            longValue(d, "losses"),
                            round(ratio(wins, games)),
                            round(ratio(wins + 0.5 * draws, games)),
                            lastPlayed != null ? lastPlayed.toInstant() : null
                    );
                })
                .toList();
    }

    private List<Document> aggregate(String query, Deadline deadline, String collection,
                                     Function<Duration, Aggregation> pipeline) {
        return queryBudget.run(query, deadline, remaining -> {
            Aggregation aggregation = pipeline.apply(remaining);
            log.debug("{}: {}", query, aggregation);
            return mongoTemplate.aggregate(aggregation, collection, Document.class).getMappedResults();
        });
    }

    private long count(Class<?> type, Deadline deadline) {
        return queryBudget.run("Count of " + type.getSimpleName(), deadline,
                remaining -> mongoTemplate.count(new Query().maxTimeMsec(remaining.toMillis()), type));
    }

    static OpeningStats openingStats(String ecoCode, String openingName, long games, long whiteWins, long blackWins,
                                     long draws, long totalWhiteRating, long totalBlackRating) {
        double whiteWinRate = ratio(whiteWins, games);
        double blackWinRate = ratio(blackWins, games);
        return new OpeningStats(
                ecoCode,
                openingName,
                games,
                whiteWins,
                blackWins,
                draws,
                round(whiteWinRate),
                round(blackWinRate),
                round(ratio(draws, games)),
                round(ratio(totalWhiteRating + totalBlackRating, 2 * games)),
                round(whiteWinRate - blackWinRate)
        );
    }

    private static int positiveOr(Integer value, int fallback) {
        if (value == null) {
            return fallback;
        }
        if (value < 1) {
            throw new IllegalArgumentException("limit must be positive: " + value);
        }
        return value;
    }

    private static double ratio(double numerator, long denominator) {
        return denominator == 0 ? 0.0 : numerator / denominator;
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    private static long longValue(Document document, String field) {
        Object value = document.get(field);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    private static int intValue(Document document, String field) {
        Object value = document.get(field);
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }

    private static double doubleValue(Document document, String field) {
        Object value = document.get(field);
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }
}
