package com.chess.ingest.repository;

import com.chess.ingest.model.PlayerDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface PlayerRepository extends MongoRepository<PlayerDocument, String> {

    /**
     * Find players by multiple natural keys (bulk lookup)
     */
    List<PlayerDocument> findByNameKeyIn(Collection<String> nameKeys);
}
