package com.chess.analytics.repository.readonly;

import com.chess.analytics.model.readonly.GameDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Read-only repository for games.
 * Note: Write operations will fail with MongoDB authorization error.
 */
@Repository
public interface GameReadRepository extends MongoRepository<GameDocument, String> {
}
