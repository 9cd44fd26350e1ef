package com.shlawgathon.leafscan.backend.index;

import com.shlawgathon.leafscan.backend.model.FeatureVector;
import com.shlawgathon.leafscan.backend.model.ImageRecord;
import com.shlawgathon.leafscan.backend.model.IndexStatistics;
import com.shlawgathon.leafscan.backend.model.NeighborMatch;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Client of the vector store holding the reference corpus.
 * <p>
 * Every implementation ranks by Euclidean distance over the full feature vector, ties broken by record id.
 * Concurrent queries are safe; writes interleaved with a running evaluation are the caller's concern.
 */
public interface SimilarityIndex {

    /**
     * Insert or replace the record stored under {@code record.getId()}.
     *
     * @throws com.shlawgathon.leafscan.backend.exception.StorageException on backend failure
     */
    void index(ImageRecord record);

    /**
     * Up to {@code k} nearest records, ascending by distance.
     *
     * @throws com.shlawgathon.leafscan.backend.exception.EmptyIndexException if the store holds no records
     * @throws com.shlawgathon.leafscan.backend.exception.StorageException    on backend failure
     */
    default List<NeighborMatch> query(FeatureVector vector, int k) {
        return query(vector, k, Set.of());
    }

    /**
     * Like {@link #query(FeatureVector, int)} but never returns a record whose id is in {@code excludedIds}.
     * Returns an empty list when the store is non-empty but every record is excluded.
     */
    List<NeighborMatch> query(FeatureVector vector, int k, Set<String> excludedIds);

    Optional<ImageRecord> findById(String id);

    long count();

    IndexStatistics statistics();

    /**
     * Remove every record.
     */
    void clear();
}
