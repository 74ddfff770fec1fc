package com.chess.ingest.store;

import com.chess.ingest.model.GameDocument;
import com.chess.ingest.model.OpeningDocument;
import com.chess.ingest.model.PlayerDocument;
import com.chess.ingest.model.RatingHistoryDocument;
import com.chess.ingest.pipeline.OpeningUpsert;
import com.chess.ingest.pipeline.PlayerUpsert;
import com.chess.ingest.pipeline.ResolvedBatch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * GameStore test double with the same upsert semantics as the MongoDB store
 * and injectable commit failures. A failing commit changes nothing.
 */
public class InMemoryGameStore implements GameStore {

    private final Map<String, GameDocument> games = new LinkedHashMap<>();
    private final Map<String, PlayerDocument> players = new LinkedHashMap<>();
    private final Map<String, OpeningDocument> openings = new LinkedHashMap<>();
    private final List<RatingHistoryDocument> ratingHistory = new ArrayList<>();

    private final Deque<RuntimeException> scheduledFailures = new ArrayDeque<>();
    private RuntimeException permanentFailure;
    private Consumer<ResolvedBatch> beforeCommit = batch -> { };
    private int commitAttempts;
    private int schemaCalls;

    public synchronized void failNextCommits(int times, RuntimeException failure) {
        for (int i = 0; i < times; i++) {
            scheduledFailures.add(failure);
        }
    }

    public synchronized void failAllCommits(RuntimeException failure) {
        this.permanentFailure = failure;
    }

    public synchronized void clearFailures() {
        scheduledFailures.clear();
        permanentFailure = null;
    }

    public synchronized void beforeCommit(Consumer<ResolvedBatch> hook) {
        this.beforeCommit = hook;
    }

    @Override
    public synchronized Set<String> findExistingGameKeys(Collection<String> gameKeys) {
        return gameKeys.stream().filter(games::containsKey).collect(Collectors.toSet());
    }

    @Override
    public synchronized Map<String, PlayerDocument> findPlayersByNameKeys(Collection<String> nameKeys) {
        Map<String, PlayerDocument> found = new HashMap<>();
        for (String key : nameKeys) {
            if (players.containsKey(key)) {
                found.put(key, players.get(key));
            }
        }
        return found;
    }

    @Override
    public synchronized Map<String, OpeningDocument> findOpeningsByCodes(Collection<String> ecoCodes) {
        Map<String, OpeningDocument> found = new HashMap<>();
        for (String code : ecoCodes) {
            if (openings.containsKey(code)) {
                found.put(code, openings.get(code));
            }
        }
        return found;
    }

    @Override
    public synchronized ResolvedBatch commit(ResolvedBatch planned) {
        commitAttempts++;
        beforeCommit.accept(planned);
        if (permanentFailure != null) {
            throw permanentFailure;
        }
        if (!scheduledFailures.isEmpty()) {
            throw scheduledFailures.poll();
        }
        Map<String, PlayerDocument> claimed = new HashMap<>();
        for (PlayerUpsert upsert : planned.players()) {
            PlayerDocument stored = players.get(upsert.nameKey());
            if (upsert.created() && stored != null) {
                claimed.put(upsert.nameKey(), stored);
            }
        }
        ResolvedBatch batch = planned.rebindPlayers(claimed);
        for (GameDocument game : batch.games()) {
            if (games.containsKey(game.getId())) {
                throw new CommitFailedException("E11000 duplicate key: " + game.getId(), null);
            }
        }

        batch.games().forEach(game -> games.put(game.getId(), game));
        batch.players().forEach(this::applyPlayer);
        batch.openings().forEach(this::applyOpening);
        ratingHistory.addAll(batch.ratingPoints());
        return batch;
    }

    @Override
    public synchronized void ensureSchema() {
        schemaCalls++;
    }

    @Override
    public synchronized StoreStatus status() {
        return new StoreStatus(players.size(), games.size(), openings.size(), ratingHistory.size());
    }

    private void applyPlayer(PlayerUpsert upsert) {
        PlayerDocument player = players.get(upsert.nameKey());
        if (player == null) {
            player = new PlayerDocument();
            player.setId(upsert.playerId());
            player.setNameKey(upsert.nameKey());
            player.setDisplayName(upsert.displayName());
            player.setFirstSeenAt(upsert.firstSeenAt());
            players.put(upsert.nameKey(), player);
        }
        player.setGamesPlayed(player.getGamesPlayed() + upsert.gamesPlayedDelta());
        if (player.getPeakRating() == null || upsert.peakRating() > player.getPeakRating()) {
            player.setPeakRating(upsert.peakRating());
        }
        if (upsert.title() != null) {
            player.setTitle(upsert.title());
        }
        if (upsert.currentRating() != null
                && (player.getLastRatingAt() == null || !upsert.lastRatingAt().isBefore(player.getLastRatingAt()))) {
            player.setCurrentRating(upsert.currentRating());
            player.setLastRatingAt(upsert.lastRatingAt());
        }
    }

    private void applyOpening(OpeningUpsert upsert) {
        OpeningDocument opening = openings.computeIfAbsent(upsert.ecoCode(), code -> {
            OpeningDocument created = new OpeningDocument();
            created.setId(code);
            created.setEcoCode(code);
            created.setOpeningName(upsert.openingName());
            return created;
        });
        opening.setTotalGames(opening.getTotalGames() + upsert.games());
        opening.setWhiteWins(opening.getWhiteWins() + upsert.whiteWins());
        opening.setBlackWins(opening.getBlackWins() + upsert.blackWins());
        opening.setDraws(opening.getDraws() + upsert.draws());
        opening.setTotalWhiteRating(opening.getTotalWhiteRating() + upsert.whiteRatingSum());
        opening.setTotalBlackRating(opening.getTotalBlackRating() + upsert.blackRatingSum());
    }

    public synchronized List<GameDocument> games() {
        return new ArrayList<>(games.values());
    }

    public synchronized PlayerDocument player(String nameKey) {
        return players.get(nameKey);
    }

    public synchronized List<PlayerDocument> players() {
        return new ArrayList<>(players.values());
    }

    public synchronized OpeningDocument opening(String ecoCode) {
        return openings.get(ecoCode);
    }

    public synchronized List<OpeningDocument> openings() {
        return new ArrayList<>(openings.values());
    }

    public synchronized List<RatingHistoryDocument> ratingHistory() {
        return new ArrayList<>(ratingHistory);
    }

    public synchronized int getCommitAttempts() {
        return commitAttempts;
    }

    public synchronized int getSchemaCalls() {
        return schemaCalls;
    }
}
