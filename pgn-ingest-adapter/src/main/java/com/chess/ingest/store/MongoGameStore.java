package com.chess.ingest.store;

import com.chess.ingest.model.GameDocument;
import com.chess.ingest.model.ImportRunDocument;
import com.chess.ingest.model.OpeningDocument;
import com.chess.ingest.model.PlayerDocument;
import com.chess.ingest.model.RatingHistoryDocument;
import com.chess.ingest.pipeline.OpeningUpsert;
import com.chess.ingest.pipeline.PlayerUpsert;
import com.chess.ingest.pipeline.ResolvedBatch;
import com.chess.ingest.repository.GameRepository;
import com.chess.ingest.repository.OpeningRepository;
import com.chess.ingest.repository.PlayerRepository;
import com.chess.ingest.repository.RatingHistoryRepository;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.IndexResolver;
import org.springframework.data.mongodb.core.index.MongoPersistentEntityIndexResolver;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * MongoDB-backed {@link GameStore}. Batch commits run in one multi-document
 * transaction, which needs a replica set or sharded cluster.
 */
@Repository
public class MongoGameStore implements GameStore {

    private static final Logger log = LoggerFactory.getLogger(MongoGameStore.class);

    private static final List<Class<?>> COLLECTIONS = List.of(
            PlayerDocument.class,
            OpeningDocument.class,
            GameDocument.class,
            RatingHistoryDocument.class,
            ImportRunDocument.class
    );

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;
    private final GameRepository gameRepository;
    private final PlayerRepository playerRepository;
    private final OpeningRepository openingRepository;
    private final RatingHistoryRepository ratingHistoryRepository;

    public MongoGameStore(
            MongoTemplate mongoTemplate,
            TransactionTemplate transactionTemplate,
            GameRepository gameRepository,
            PlayerRepository playerRepository,
            OpeningRepository openingRepository,
            RatingHistoryRepository ratingHistoryRepository
    ) {
        this.mongoTemplate = mongoTemplate;
        this.transactionTemplate = transactionTemplate;
        this.gameRepository = gameRepository;
        this.playerRepository = playerRepository;
        this.openingRepository = openingRepository;
        this.ratingHistoryRepository = ratingHistoryRepository;
    }

    @Override
    public Set<String> findExistingGameKeys(Collection<String> gameKeys) {
        if (gameKeys.isEmpty()) {
            return Set.of();
        }
        return read("game key lookup", () -> gameRepository.findIdsByIdIn(gameKeys).stream()
                .map(GameDocument::getId)
                .collect(Collectors.toSet()));
    }

    @Override
    public Map<String, PlayerDocument> findPlayersByNameKeys(Collection<String> nameKeys) {
        if (nameKeys.isEmpty()) {
            return Map.of();
        }
        return read("player lookup", () -> playerRepository.findByNameKeyIn(nameKeys).stream()
                .collect(Collectors.toMap(PlayerDocument::getNameKey, Function.identity())));
    }

    @Override
    public Map<String, OpeningDocument> findOpeningsByCodes(Collection<String> ecoCodes) {
        if (ecoCodes.isEmpty()) {
            return Map.of();
        }
        return read("opening lookup", () -> openingRepository.findByEcoCodeIn(ecoCodes).stream()
                .collect(Collectors.toMap(OpeningDocument::getEcoCode, Function.identity())));
    }

    @Override
    public ResolvedBatch commit(ResolvedBatch batch) {
        if (batch.isEmpty()) {
            return batch;
        }
        try {
            ResolvedBatch written = transactionTemplate.execute(status -> {
                // players first: game documents need the ids actually stored
                Map<String, PlayerDocument> claimed = upsertPlayers(batch.players());
                ResolvedBatch bound = batch.rebindPlayers(claimed);
                mongoTemplate.insert(bound.games(), GameDocument.class);
                upsertOpenings(bound.openings());
                if (!bound.ratingPoints().isEmpty()) {
                    mongoTemplate.insert(bound.ratingPoints(), RatingHistoryDocument.class);
                }
                if (!claimed.isEmpty()) {
                    log.info("Batch {}: {} new players were already stored by another import, rebound",
                            batch.sequence(), claimed.size());
                }
                return bound;
            });
            log.debug("Committed batch {}: {} games, {} players, {} openings, {} rating points",
                    batch.sequence(), batch.games().size(), batch.players().size(),
                    batch.openings().size(), batch.ratingPoints().size());
            return written;
        } catch (DataAccessException | TransactionException e) {
            if (isConnectivityFailure(e)) {
                throw new StoreUnavailableException("Store unavailable while committing batch " + batch.sequence(), e);
            }
            throw new CommitFailedException("Commit of batch " + batch.sequence() + " rejected: " + e.getMessage(), e);
        }
    }

    @Override
    public void ensureSchema() {
        read("schema setup", () -> {
            IndexResolver resolver = new MongoPersistentEntityIndexResolver(mongoTemplate.getConverter().getMappingContext());
            for (Class<?> type : COLLECTIONS) {
                if (!mongoTemplate.collectionExists(type)) {
                    mongoTemplate.createCollection(type);
                    log.info("Created collection {}", mongoTemplate.getCollectionName(type));
                }
                IndexOperations indexOps = mongoTemplate.indexOps(type);
                resolver.resolveIndexFor(type).forEach(indexOps::ensureIndex);
            }
            log.info("Indexes ensured for {} collections", COLLECTIONS.size());
            return null;
        });
    }

    @Override
    public StoreStatus status() {
        return read("status", () -> new StoreStatus(
                playerRepository.count(),
                gameRepository.count(),
                openingRepository.count(),
                ratingHistoryRepository.count()
        ));
    }

    /**
     * New players go through findAndModify so a concurrent insert of the same
     * name key is seen inside this transaction.
     *
     * @return the previously stored players, by name key, that this batch meant to create
     */
    private Map<String, PlayerDocument> upsertPlayers(List<PlayerUpsert> players) {
        if (players.isEmpty()) {
            return Map.of();
        }
        Instant now = Instant.now();
        Map<String, PlayerDocument> claimed = new HashMap<>();
        BulkOperations ops = null;
        for (PlayerUpsert player : players) {
            Update update = new Update()
                    .setOnInsert("displayName", player.displayName())
                    .setOnInsert("firstSeenAt", player.firstSeenAt())
                    .setOnInsert("createdAt", now)
                    .set("updatedAt", now)
                    .max("peakRating", player.peakRating())
                    .inc("gamesPlayed", player.gamesPlayedDelta());
            if (player.title() != null) {
                update.set("title", player.title());
            }
            Query byNameKey = query(where("nameKey").is(player.nameKey()));

            if (player.created()) {
                update.setOnInsert("_id", player.playerId());
                if (player.currentRating() != null) {
                    update.setOnInsert("currentRating", player.currentRating())
                            .setOnInsert("lastRatingAt", player.lastRatingAt());
                }
                PlayerDocument previous = mongoTemplate.findAndModify(byNameKey, update,
                        FindAndModifyOptions.options().upsert(true).returnNew(false), PlayerDocument.class);
                if (previous == null) {
                    continue;
                }
                claimed.put(player.nameKey(), previous);
            } else {
                ops = ops != null ? ops : mongoTemplate.bulkOps(BulkOperations.BulkMode.ORDERED, PlayerDocument.class);
                ops.upsert(byNameKey, update);
            }

            if (player.currentRating() != null) {
                ops = ops != null ? ops : mongoTemplate.bulkOps(BulkOperations.BulkMode.ORDERED, PlayerDocument.class);
                ops.updateOne(notNewerThan(player), new Update()
                        .set("currentRating", player.currentRating())
                        .set("lastRatingAt", player.lastRatingAt()));
            }
        }
        if (ops != null) {
            ops.execute();
        }
        return claimed;
    }

    /**
     * Matches the player only while its stored rating is not newer than this batch's latest game.
     */
    private static Query notNewerThan(PlayerUpsert player) {
        return query(where("nameKey").is(player.nameKey())
                .orOperator(where("lastRatingAt").is(null), where("lastRatingAt").lte(player.lastRatingAt())));
    }

    private void upsertOpenings(List<OpeningUpsert> openings) {
        if (openings.isEmpty()) {
            return;
        }
        Instant now = Instant.now();
        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.ORDERED, OpeningDocument.class);
        for (OpeningUpsert opening : openings) {
            Update update = new Update()
                    .setOnInsert("ecoCode", opening.ecoCode())
                    .setOnInsert("openingName", opening.openingName())
                    .setOnInsert("createdAt", now)
                    .set("updatedAt", now)
                    .inc("totalGames", opening.games())
                    .inc("whiteWins", opening.whiteWins())
                    .inc("blackWins", opening.blackWins())
                    .inc("draws", opening.draws())
                    .inc("totalWhiteRating", opening.whiteRatingSum())
                    .inc("totalBlackRating", opening.blackRatingSum());
            ops.upsert(query(where("_id").is(opening.ecoCode())), update);
        }
        ops.execute();
    }

    private <T> T read(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            if (isConnectivityFailure(e)) {
                throw new StoreUnavailableException("Store unavailable during " + operation, e);
            }
            throw e;
        }
    }

    private static boolean isConnectivityFailure(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof DataAccessResourceFailureException
                    || t instanceof MongoSocketException
                    || t instanceof MongoTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
