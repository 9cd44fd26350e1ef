package com.shlawgathon.leafscan.backend.service;

import com.shlawgathon.leafscan.backend.config.DiagnosisSettings;
import com.shlawgathon.leafscan.backend.model.Category;
import com.shlawgathon.leafscan.backend.model.DiagnosisResult;
import com.shlawgathon.leafscan.backend.model.FeatureVector;
import com.shlawgathon.leafscan.backend.model.NeighborMatch;
import com.shlawgathon.leafscan.backend.model.NeighborStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Diagnoses a query from its ranked neighbors by inverse-distance-weighted majority vote.
 * <p>
 * Ties on total weight go to the category of the nearest neighbor, then to the lowest label. When every competing
 * category carries the same weight, confidence is the lowest competing share.
 */
@Service
public class DiagnosisService {

    private static final double TIE_TOLERANCE = 1e-9;

    private final DiagnosisSettings settings;

    public DiagnosisService(DiagnosisSettings settings) {
        this.settings = settings;
    }

    public DiagnosisResult diagnose(List<NeighborMatch> neighbors) {
        if (neighbors == null || neighbors.isEmpty()) {
            throw new IllegalArgumentException("Cannot diagnose without neighbors");
        }
        List<NeighborMatch> ranked = new ArrayList<>(neighbors);
        ranked.sort(NeighborMatch.BY_DISTANCE);

        Map<Category, Double> weights = new LinkedHashMap<>();
        double totalWeight = 0;
        for (NeighborMatch match : ranked) {
            double weight = 1.0 / (match.getDistance() + settings.getDistanceEpsilon());
            weights.merge(match.getCategory(), weight, Double::sum);
            totalWeight += weight;
        }

        double maxWeight = weights.values().stream().mapToDouble(Double::doubleValue).max().orElse(0);
        List<Category> tied = weights.entrySet().stream()
                .filter(e -> maxWeight - e.getValue() <= TIE_TOLERANCE * maxWeight)
                .map(Map.Entry::getKey)
                .sorted()
                .collect(Collectors.toList());

        Category nearest = ranked.get(0).getCategory();
        Category winner = tied.contains(nearest) ? nearest : tied.get(0);

        Map<Category, Double> shares = new LinkedHashMap<>();
        final double total = totalWeight;
        weights.entrySet().stream()
                .sorted(Map.Entry.<Category, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<Category, Double>comparingByKey()))
                .forEach(e -> shares.put(e.getKey(), 100.0 * e.getValue() / total));

        double confidence = shares.get(winner);
        if (tied.size() > 1 && tied.size() == weights.size()) {
            confidence = shares.values().stream().mapToDouble(Double::doubleValue).min().orElse(confidence);
        }
        confidence = Math.max(0, Math.min(100, confidence));

        return DiagnosisResult.builder()
                .category(winner)
                .confidence(confidence)
                .matches(ranked)
                .categoryDistribution(shares)
                .statistics(statistics(ranked, winner))
                .build();
    }

    private NeighborStatistics statistics(List<NeighborMatch> ranked, Category winner) {
        int n = ranked.size();
        long agreeing = ranked.stream().filter(m -> m.getCategory().equals(winner)).count();

        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        double sum = 0;
        for (NeighborMatch match : ranked) {
            double s = match.getSimilarity();
            max = Math.max(max, s);
            min = Math.min(min, s);
            sum += s;
        }
        double mean = sum / n;
        double squares = 0;
        for (NeighborMatch match : ranked) {
            squares += Math.pow(match.getSimilarity() - mean, 2);
        }

        return NeighborStatistics.builder()
                .neighborCount(n)
                .agreementRatio((double) agreeing / n)
                .nearestDistance(ranked.get(0).getDistance())
                .maxSimilarity(max)
                .minSimilarity(min)
                .meanSimilarity(mean)
                .stdSimilarity(Math.sqrt(squares / n))
                .similarityGap(max - min)
                .shapeVariability(shapeVariability(ranked))
                .build();
    }

    /**
     * Root-mean-square distance of the neighbors' shape bands to their centroid. Shape values are unit scaled,
     * so the result lies in [0, 1] and stays small when only one neighbor carries a few stray lesion pixels.
     */
    static double shapeVariability(List<NeighborMatch> neighbors) {
        int n = neighbors.size();
        double[] centroid = new double[FeatureVector.SHAPE_BAND_SIZE];
        for (NeighborMatch match : neighbors) {
            double[] shape = match.getRecord().getFeatures().shapeBand();
            for (int f = 0; f < shape.length; f++) {
                centroid[f] += shape[f] / n;
            }
        }
        double squares = 0;
        for (NeighborMatch match : neighbors) {
            double[] shape = match.getRecord().getFeatures().shapeBand();
            for (int f = 0; f < shape.length; f++) {
                squares += Math.pow(shape[f] - centroid[f], 2);
            }
        }
        return Math.sqrt(squares / n);
    }
}
