package com.chess.ingest.repository;

import com.chess.ingest.model.RatingHistoryDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface RatingHistoryRepository extends MongoRepository<RatingHistoryDocument, String> {
}
