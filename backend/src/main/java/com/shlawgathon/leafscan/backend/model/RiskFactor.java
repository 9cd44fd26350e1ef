package com.shlawgathon.leafscan.backend.model;

import lombok.Value;

/**
 * A triggered risk condition with the observed value behind it.
 */
@Value
public class RiskFactor {
    RiskFactorCode code;
    double scoreDelta;
    String explanation;
}
