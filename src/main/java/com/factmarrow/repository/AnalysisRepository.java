package com.factmarrow.repository;

import com.factmarrow.model.AnalysisRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Repository for persisted analyses (collection analyses).
 */
public interface AnalysisRepository extends MongoRepository<AnalysisRecord, String> {

    List<AnalysisRecord> findAllByOrderByCreatedAtDesc();
}
