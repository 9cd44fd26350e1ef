package com.shlawgathon.leafscan.backend.index;

import com.shlawgathon.leafscan.backend.exception.EmptyIndexException;
import com.shlawgathon.leafscan.backend.model.Category;
import com.shlawgathon.leafscan.backend.model.FeatureVector;
import com.shlawgathon.leafscan.backend.model.ImageRecord;
import com.shlawgathon.leafscan.backend.model.IndexStatistics;
import com.shlawgathon.leafscan.backend.model.NeighborMatch;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local index for tests and small offline corpora. Exact search.
 */
@Service
@ConditionalOnProperty(name = "leafscan.index.backend", havingValue = "memory")
public class InMemorySimilarityIndex implements SimilarityIndex {

    private final Map<String, ImageRecord> records = new ConcurrentHashMap<>();

    @Override
    public void index(ImageRecord record) {
        records.put(record.getId(), record);
    }

    @Override
    public List<NeighborMatch> query(FeatureVector vector, int k, Set<String> excludedIds) {
        if (records.isEmpty()) {
            throw new EmptyIndexException("Similarity index holds no records");
        }
        NearestNeighborCollector collector = new NearestNeighborCollector(vector, k);
        for (ImageRecord record : records.values()) {
            if (!excludedIds.contains(record.getId())) {
                collector.offer(record);
            }
        }
        return collector.toSortedList();
    }

    @Override
    public Optional<ImageRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public long count() {
        return records.size();
    }

    @Override
    public IndexStatistics statistics() {
        Map<Category, Long> byCategory = new TreeMap<>();
        for (ImageRecord record : records.values()) {
            byCategory.merge(record.getCategory(), 1L, Long::sum);
        }
        return IndexStatistics.builder()
                .totalRecords(records.size())
                .recordsByCategory(byCategory)
                .build();
    }

    @Override
    public void clear() {
        records.clear();
    }
}
