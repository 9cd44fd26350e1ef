package com.shlawgathon.leafscan.backend.feature;

import com.shlawgathon.leafscan.backend.config.FeatureExtractionSettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds connected regions of off-baseline hue inside the leaf.
 */
public class LesionBlobAnalyzer {

    private static final int[] DX = {-1, 0, 1, -1, 1, -1, 0, 1};
    private static final int[] DY = {-1, -1, -1, 0, 0, 1, 1, 1};

    private final FeatureExtractionSettings settings;

    public LesionBlobAnalyzer(FeatureExtractionSettings settings) {
        this.settings = settings;
    }

    public boolean isLeaf(HsvImage image, int index) {
        return image.saturation(index) >= settings.getMinSaturation()
                && image.value(index) >= settings.getMinValue();
    }

    public boolean isLesion(HsvImage image, int index) {
        int hue = image.hue(index);
        return isLeaf(image, index)
                && (hue < settings.getBaselineHueMin() || hue > settings.getBaselineHueMax());
    }

    public BlobStatistics analyze(HsvImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int n = width * height;

        boolean[] lesion = new boolean[n];
        long leafArea = 0;
        for (int i = 0; i < n; i++) {
            if (isLeaf(image, i)) {
                leafArea++;
                lesion[i] = isLesion(image, i);
            }
        }

        List<Integer> areas = new ArrayList<>();
        boolean[] visited = new boolean[n];
        int[] stack = new int[n];
        for (int start = 0; start < n; start++) {
            if (!lesion[start] || visited[start]) {
                continue;
            }
            int area = 0;
            int top = 0;
            stack[top++] = start;
            visited[start] = true;
            while (top > 0) {
                int p = stack[--top];
                area++;
                int px = p % width;
                int py = p / width;
                for (int d = 0; d < DX.length; d++) {
                    int nx = px + DX[d];
                    int ny = py + DY[d];
                    if (nx < 0 || ny < 0 || nx >= width || ny >= height) {
                        continue;
                    }
                    int q = ny * width + nx;
                    if (lesion[q] && !visited[q]) {
                        visited[q] = true;
                        stack[top++] = q;
                    }
                }
            }
            if (area >= settings.getMinBlobArea()) {
                areas.add(area);
            }
        }

        if (areas.isEmpty()) {
            return new BlobStatistics(0, 0, 0, 0, leafArea);
        }

        double mean = areas.stream().mapToInt(Integer::intValue).average().orElse(0);
        double squares = 0;
        int largest = 0;
        for (int area : areas) {
            squares += (area - mean) * (area - mean);
            largest = Math.max(largest, area);
        }
        double ratio = leafArea == 0 ? 0 : (double) largest / leafArea;
        return new BlobStatistics(areas.size(), mean, Math.sqrt(squares / areas.size()), ratio, leafArea);
    }
}
