package com.shlawgathon.leafscan.backend.repository;

import com.shlawgathon.leafscan.backend.model.LeafImageDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for indexed leaf images.
 */
@Repository
public interface LeafImageRepository extends MongoRepository<LeafImageDocument, String> {
}
