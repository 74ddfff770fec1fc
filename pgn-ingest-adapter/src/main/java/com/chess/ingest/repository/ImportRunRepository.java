package com.chess.ingest.repository;

import com.chess.ingest.model.ImportRunDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ImportRunRepository extends MongoRepository<ImportRunDocument, String> {

    List<ImportRunDocument> findTop10ByOrderByStartedAtDesc();
}
