package com.shlawgathon.leafscan.backend.index;

import com.mongodb.MongoException;
import com.shlawgathon.leafscan.backend.exception.EmptyIndexException;
import com.shlawgathon.leafscan.backend.exception.StorageException;
import com.shlawgathon.leafscan.backend.model.Category;
import com.shlawgathon.leafscan.backend.model.FeatureVector;
import com.shlawgathon.leafscan.backend.model.ImageRecord;
import com.shlawgathon.leafscan.backend.model.IndexStatistics;
import com.shlawgathon.leafscan.backend.model.LeafImageDocument;
import com.shlawgathon.leafscan.backend.model.NeighborMatch;
import com.shlawgathon.leafscan.backend.repository.LeafImageRepository;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Similarity index backed by the {@code leaf_images} MongoDB collection.
 * <p>
 * In {@code exact} mode (default) every stored vector is streamed and ranked in process. In {@code atlas} mode
 * ranking is delegated to an Atlas {@code $vectorSearch} index with {@code euclidean} similarity on the
 * {@code embedding} path.
 */
@Service
@ConditionalOnProperty(name = "leafscan.index.backend", havingValue = "mongo", matchIfMissing = true)
public class MongoSimilarityIndex implements SimilarityIndex {

    private static final Logger log = LoggerFactory.getLogger(MongoSimilarityIndex.class);

    private final LeafImageRepository leafImageRepository;
    private final MongoTemplate mongoTemplate;

    @Value("${leafscan.index.search-mode:exact}")
    private String searchMode;

    @Value("${leafscan.index.atlas-index-name:leaf_vector_index}")
    private String atlasIndexName;

    public MongoSimilarityIndex(LeafImageRepository leafImageRepository, MongoTemplate mongoTemplate) {
        this.leafImageRepository = leafImageRepository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void index(ImageRecord record) {
        backend("upsert " + record.getId(), () -> leafImageRepository.save(LeafImageDocument.fromRecord(record)));
        log.debug("Indexed image: {} as {}", record.getId(), record.getCategory());
    }

    @Override
    public List<NeighborMatch> query(FeatureVector vector, int k, Set<String> excludedIds) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }
        if (count() == 0) {
            throw new EmptyIndexException("Collection " + LeafImageDocument.COLLECTION + " holds no records");
        }
        List<NeighborMatch> matches = "atlas".equalsIgnoreCase(searchMode)
                ? backend("vector search", () -> atlasSearch(vector, k, excludedIds))
                : backend("scan", () -> exactSearch(vector, k, excludedIds));
        log.debug("Similarity query returned {} of {} requested neighbors", matches.size(), k);
        return matches;
    }

    private List<NeighborMatch> exactSearch(FeatureVector vector, int k, Set<String> excludedIds) {
        Query query = new Query();
        if (!excludedIds.isEmpty()) {
            query.addCriteria(Criteria.where("_id").nin(excludedIds));
        }
        NearestNeighborCollector collector = new NearestNeighborCollector(vector, k);
        try (Stream<LeafImageDocument> documents = mongoTemplate.stream(query, LeafImageDocument.class)) {
            documents.forEach(doc -> collector.offer(doc.toRecord()));
        }
        return collector.toSortedList();
    }

    private List<NeighborMatch> atlasSearch(FeatureVector vector, int k, Set<String> excludedIds) {
        int limit = k + excludedIds.size();
        Document vectorSearchStage = new Document("$vectorSearch",
                new Document()
                        .append("index", atlasIndexName)
                        .append("path", "embedding")
                        .append("queryVector", vector.toList())
                        .append("numCandidates", limit * 10)
                        .append("limit", limit));
        Document projectStage = new Document("$project",
                new Document()
                        .append("category", 1)
                        .append("sourceReference", 1)
                        .append("embedding", 1)
                        .append("score", new Document("$meta", "vectorSearchScore")));

        List<Document> pipeline = List.of(vectorSearchStage, projectStage);

        List<NeighborMatch> matches = mongoTemplate.getCollection(LeafImageDocument.COLLECTION)
                .aggregate(pipeline, Document.class)
                .map(this::toMatch)
                .into(new ArrayList<>());

        return matches.stream()
                .filter(m -> !excludedIds.contains(m.getRecord().getId()))
                .sorted(NeighborMatch.BY_DISTANCE)
                .limit(k)
                .collect(Collectors.toList());
    }

    @SuppressWarnings("unchecked")
    private NeighborMatch toMatch(Document doc) {
        LeafImageDocument document = LeafImageDocument.builder()
                .id(doc.get("_id").toString())
                .category(doc.getString("category"))
                .sourceReference(doc.getString("sourceReference"))
                .embedding((List<Double>) doc.get("embedding", List.class))
                .build();
        // Atlas euclidean score is 1 / (1 + d^2)
        double score = doc.get("score", Number.class).doubleValue();
        double distance = score <= 0 ? Double.MAX_VALUE : Math.sqrt(Math.max(0, 1.0 / score - 1.0));
        return new NeighborMatch(document.toRecord(), distance);
    }

    @Override
    public Optional<ImageRecord> findById(String id) {
        return backend("find " + id, () -> leafImageRepository.findById(id).map(LeafImageDocument::toRecord));
    }

    @Override
    public long count() {
        return backend("count", leafImageRepository::count);
    }

    @Override
    public IndexStatistics statistics() {
        return backend("statistics", () -> {
            Aggregation aggregation = Aggregation.newAggregation(
                    Aggregation.group("category").count().as("count"));
            AggregationResults<Document> results = mongoTemplate.aggregate(
                    aggregation, LeafImageDocument.COLLECTION, Document.class);

            Map<Category, Long> byCategory = new TreeMap<>();
            long total = 0;
            for (Document doc : results.getMappedResults()) {
                long count = doc.get("count", Number.class).longValue();
                byCategory.put(Category.of(doc.getString("_id")), count);
                total += count;
            }
            return IndexStatistics.builder()
                    .totalRecords(total)
                    .recordsByCategory(byCategory)
                    .build();
        });
    }

    @Override
    public void clear() {
        backend("clear", () -> {
            leafImageRepository.deleteAll();
            return null;
        });
        log.info("Cleared collection {}", LeafImageDocument.COLLECTION);
    }

    private <T> T backend(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | MongoException e) {
            log.error("Vector store {} failed: {}", operation, e.getMessage());
            throw new StorageException("Vector store " + operation + " failed", e);
        }
    }
}
