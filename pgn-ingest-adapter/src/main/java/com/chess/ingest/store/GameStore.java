package com.chess.ingest.store;

import com.chess.ingest.model.OpeningDocument;
import com.chess.ingest.model.PlayerDocument;
import com.chess.ingest.pipeline.ResolvedBatch;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * What the ingestion pipeline needs from its storage.
 * <p>
 * Implementations translate their own failures: connectivity problems surface
 * as {@link StoreUnavailableException}, any other rejected write as
 * {@link CommitFailedException}.
 */
public interface GameStore {

    /**
     * @return the subset of the given game keys that are already committed
     */
    Set<String> findExistingGameKeys(Collection<String> gameKeys);

    /**
     * @return stored players by natural key; absent keys are simply missing from the map
     */
    Map<String, PlayerDocument> findPlayersByNameKeys(Collection<String> nameKeys);

    /**
     * @return stored openings by ECO code
     */
    Map<String, OpeningDocument> findOpeningsByCodes(Collection<String> ecoCodes);

    /**
     * Write the batch as one unit: game inserts, player upserts, opening upserts
     * and rating history appends are all visible afterwards, or none are.
     * <p>
     * A player the batch planned to create may already have been stored by
     * another writer under the same natural key. The commit then binds the
     * batch's games and rating points to the stored player instead.
     *
     * @return the batch as written, after any such rebinding
     */
    ResolvedBatch commit(ResolvedBatch batch);

    /**
     * Create collections and indexes. Safe to call repeatedly.
     */
    void ensureSchema();

    StoreStatus status();
}
