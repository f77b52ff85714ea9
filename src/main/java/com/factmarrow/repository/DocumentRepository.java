package com.factmarrow.repository;

import com.factmarrow.model.DocumentRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Repository for submitted documents (collection documents).
 */
public interface DocumentRepository extends MongoRepository<DocumentRecord, String> {
}
