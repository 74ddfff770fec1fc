package com.chess.ingest.repository;

import com.chess.ingest.model.GameDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.Collection;
import java.util.List;

public interface GameRepository extends MongoRepository<GameDocument, String> {

    /**
     * Which of the given game keys are already stored (lightweight query, ids only)
     */
    @Query(value = "{ '_id': { $in: ?0 } }", fields = "{ '_id': 1 }")
    List<GameDocument> findIdsByIdIn(Collection<String> gameKeys);
}
