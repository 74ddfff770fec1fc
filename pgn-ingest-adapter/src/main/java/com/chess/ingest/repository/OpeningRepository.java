package com.chess.ingest.repository;

import com.chess.ingest.model.OpeningDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface OpeningRepository extends MongoRepository<OpeningDocument, String> {

    List<OpeningDocument> findByEcoCodeIn(Collection<String> ecoCodes);
}
