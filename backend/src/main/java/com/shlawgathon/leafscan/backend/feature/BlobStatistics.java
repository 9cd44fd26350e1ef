package com.shlawgathon.leafscan.backend.feature;

import lombok.Value;

/**
 * Lesion blob summary. Every area-derived value is 0 when no blob was found.
 */
@Value
public class BlobStatistics {

    int blobCount;
    double meanArea;
    double areaStdDev;

    /**
     * Largest blob area divided by leaf area.
     */
    double largestToLeafRatio;

    long leafArea;
}
