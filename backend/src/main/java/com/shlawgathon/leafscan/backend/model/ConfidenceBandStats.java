package com.shlawgathon.leafscan.backend.model;

import lombok.Value;

@Value
public class ConfidenceBandStats {
    ConfidenceBand band;
    long count;
    double accuracy;
}
