package com.chess.ingest.pipeline;

import com.chess.ingest.model.GameDocument;
import com.chess.ingest.model.OpeningDocument;
import com.chess.ingest.model.PlayerDocument;
import com.chess.ingest.model.RatingHistoryDocument;
import com.chess.ingest.pgn.GameRecord;
import com.chess.ingest.store.GameStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Maps a batch of records onto stored identities.
 * <p>
 * Players are matched by natural key and openings by ECO code. A name seen for
 * the first time gets one synthesized id that every later game in the batch
 * reuses. Games already stored, or repeated inside the batch, are dropped so a
 * re-import commits nothing twice.
 */
public class EntityResolver {

    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    private final GameStore store;
    private final Supplier<String> idGenerator;

    public EntityResolver(GameStore store) {
        this(store, () -> UUID.randomUUID().toString());
    }

    public EntityResolver(GameStore store, Supplier<String> idGenerator) {
        this.store = store;
        this.idGenerator = idGenerator;
    }

    public ResolvedBatch resolve(Batch batch) {
        Map<String, GameRecord> unique = new LinkedHashMap<>();
        int duplicates = 0;
        for (GameRecord record : batch.records()) {
            if (unique.putIfAbsent(record.gameKey(), record) != null) {
                duplicates++;
            }
        }
        Set<String> stored = store.findExistingGameKeys(unique.keySet());
        for (String key : stored) {
            if (unique.remove(key) != null) {
                duplicates++;
            }
        }
        if (unique.isEmpty()) {
            return new ResolvedBatch(batch.sequence(), List.of(), List.of(), List.of(), List.of(), duplicates, 0);
        }

        Map<String, PlayerState> players = resolvePlayers(unique.values());
        Map<String, OpeningState> openings = resolveOpenings(unique.values());

        List<GameDocument> games = new ArrayList<>(unique.size());
        List<PendingPoint> points = new ArrayList<>(unique.size() * 2);
        int order = 0;
        for (Map.Entry<String, GameRecord> entry : unique.entrySet()) {
            String gameKey = entry.getKey();
            GameRecord record = entry.getValue();
            PlayerState white = players.get(record.whiteKey());
            PlayerState black = players.get(record.blackKey());

            white.observe(record.whiteRating(), record.whiteTitle(), record.playedAt());
            black.observe(record.blackRating(), record.blackTitle(), record.playedAt());
            openings.get(record.ecoCode()).observe(record);

            games.add(toDocument(gameKey, record, white.playerId, black.playerId));
            points.add(new PendingPoint(white, gameKey, "w", record, record.whiteRating(), order++));
            points.add(new PendingPoint(black, gameKey, "b", record, record.blackRating(), order++));
        }

        points.sort(Comparator.comparing((PendingPoint p) -> p.record.playedAt()).thenComparingInt(p -> p.order));
        List<RatingHistoryDocument> ratingPoints = new ArrayList<>(points.size());
        int stale = 0;
        for (PendingPoint point : points) {
            Instant storedLast = point.player.storedLastRatingAt;
            if (storedLast != null && point.record.playedAt().isBefore(storedLast)) {
                stale++;
                continue;
            }
            ratingPoints.add(RatingHistoryDocument.builder()
                    .id(point.gameKey + ":" + point.side)
                    .playerId(point.player.playerId)
                    .timestamp(point.record.playedAt())
                    .rating(point.rating)
                    .timeControl(point.record.timeControl())
                    .gameKey(point.gameKey)
                    .build());
        }
        if (stale > 0) {
            log.debug("Batch {}: dropped {} rating points older than stored history", batch.sequence(), stale);
        }

        return new ResolvedBatch(
                batch.sequence(),
                games,
                players.values().stream().map(PlayerState::toUpsert).toList(),
                openings.values().stream().map(OpeningState::toUpsert).toList(),
                ratingPoints,
                duplicates,
                stale
        );
    }

    private Map<String, PlayerState> resolvePlayers(Iterable<GameRecord> records) {
        Map<String, String> displayNames = new LinkedHashMap<>();
        for (GameRecord record : records) {
            displayNames.putIfAbsent(record.whiteKey(), record.white());
            displayNames.putIfAbsent(record.blackKey(), record.black());
        }
        Map<String, PlayerDocument> existing = store.findPlayersByNameKeys(displayNames.keySet());

        Map<String, PlayerState> players = new LinkedHashMap<>();
        displayNames.forEach((nameKey, displayName) -> {
            PlayerDocument stored = existing.get(nameKey);
            players.put(nameKey, stored != null
                    ? new PlayerState(stored.getId(), nameKey, stored.getDisplayName(), false, stored.getLastRatingAt())
                    : new PlayerState(idGenerator.get(), nameKey, displayName, true, null));
        });
        return players;
    }

    private Map<String, OpeningState> resolveOpenings(Iterable<GameRecord> records) {
        Map<String, String> names = new LinkedHashMap<>();
        for (GameRecord record : records) {
            names.putIfAbsent(record.ecoCode(), record.openingName());
        }
        Map<String, OpeningDocument> existing = store.findOpeningsByCodes(names.keySet());

        Map<String, OpeningState> openings = new LinkedHashMap<>();
        names.forEach((code, name) -> {
            OpeningDocument stored = existing.get(code);
            openings.put(code, new OpeningState(code, stored != null ? stored.getOpeningName() : name, stored == null));
        });
        return openings;
    }

    private static GameDocument toDocument(String gameKey, GameRecord record, String whiteId, String blackId) {
        GameDocument game = new GameDocument();
        game.setId(gameKey);
        game.setWhitePlayerId(whiteId);
        game.setWhiteName(record.white());
        game.setWhiteRating(record.whiteRating());
        game.setBlackPlayerId(blackId);
        game.setBlackName(record.black());
        game.setBlackRating(record.blackRating());
        game.setResult(record.result());
        game.setDate(record.date());
        game.setPlayedAt(record.playedAt());
        game.setEcoCode(record.ecoCode());
        game.setOpeningName(record.openingName());
        game.setTimeControl(record.timeControl());
        game.setRawTimeControl(record.rawTimeControl());
        game.setEvent(record.event());
        game.setSite(record.site());
        game.setMoves(new ArrayList<>(record.moves()));
        return game;
    }

    private record PendingPoint(PlayerState player, String gameKey, String side, GameRecord record, int rating, int order) {
    }

    /**
     * Batch-local view of one player: stored identity plus this batch's contribution.
     */
    private static final class PlayerState {
        private final String playerId;
        private final String nameKey;
        private final String displayName;
        private final boolean created;
        private final Instant storedLastRatingAt;

        private String title;
        private int games;
        private int peakRating;
        private int latestRating;
        private Instant latestAt;
        private Instant firstSeenAt;

        PlayerState(String playerId, String nameKey, String displayName, boolean created, Instant storedLastRatingAt) {
            this.playerId = playerId;
            this.nameKey = nameKey;
            this.displayName = displayName;
            this.created = created;
            this.storedLastRatingAt = storedLastRatingAt;
        }

        void observe(int rating, String seenTitle, Instant playedAt) {
            games++;
            peakRating = Math.max(peakRating, rating);
            if (seenTitle != null) {
                title = seenTitle;
            }
            // later input wins a tie
            if (latestAt == null || !playedAt.isBefore(latestAt)) {
                latestAt = playedAt;
                latestRating = rating;
            }
            if (firstSeenAt == null || playedAt.isBefore(firstSeenAt)) {
                firstSeenAt = playedAt;
            }
        }

        PlayerUpsert toUpsert() {
            boolean current = storedLastRatingAt == null || !latestAt.isBefore(storedLastRatingAt);
            return new PlayerUpsert(
                    playerId,
                    nameKey,
                    displayName,
                    title,
                    created,
                    games,
                    peakRating,
                    current ? latestRating : null,
                    current ? latestAt : null,
                    firstSeenAt
            );
        }
    }

    private static final class OpeningState {
        private final String ecoCode;
        private final String openingName;
        private final boolean created;

        private long games;
        private long whiteWins;
        private long blackWins;
        private long draws;
        private long whiteRatingSum;
        private long blackRatingSum;

        OpeningState(String ecoCode, String openingName, boolean created) {
            this.ecoCode = ecoCode;
            this.openingName = openingName;
            this.created = created;
        }

        void observe(GameRecord record) {
            games++;
            switch (record.result()) {
                case WHITE_WIN -> whiteWins++;
                case BLACK_WIN -> blackWins++;
                case DRAW -> draws++;
            }
            whiteRatingSum += record.whiteRating();
            blackRatingSum += record.blackRating();
        }

        OpeningUpsert toUpsert() {
            return new OpeningUpsert(ecoCode, openingName, created, games, whiteWins, blackWins, draws,
                    whiteRatingSum, blackRatingSum);
        }
    }
}
