package com.shlawgathon.leafscan.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class IndexStatistics {
    long totalRecords;

    @Singular("category")
    Map<Category, Long> recordsByCategory;
}
