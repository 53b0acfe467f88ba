package com.vdbfuzz.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Thresholds and switches of the result comparator. */
public final class ComparisonPolicy {

    public static final double DEFAULT_OVERLAP_THRESHOLD = 0.5;

    private final double searchOverlapThreshold;
    private final boolean compareTopHit;
    private final UnhealthyServicePolicy unhealthyServicePolicy;

    @JsonCreator
    public ComparisonPolicy(
            @JsonProperty("searchOverlapThreshold") Double searchOverlapThreshold,
            @JsonProperty("compareTopHit") Boolean compareTopHit,
            @JsonProperty("unhealthyServicePolicy") UnhealthyServicePolicy unhealthyServicePolicy) {
        this.searchOverlapThreshold = searchOverlapThreshold != null ? searchOverlapThreshold : DEFAULT_OVERLAP_THRESHOLD;
        this.compareTopHit = compareTopHit == null || compareTopHit;
        this.unhealthyServicePolicy = unhealthyServicePolicy != null ? unhealthyServicePolicy : UnhealthyServicePolicy.EXCLUDE;
    }

    public static ComparisonPolicy defaults() {
        return new ComparisonPolicy(null, null, null);
    }

    /** Search overlap |A∩B|/|A∪B| strictly below this value is a divergence. */
    public double getSearchOverlapThreshold() {
        return searchOverlapThreshold;
    }

    /** Whether differing best hits are reported even when overlap is above the threshold. */
    public boolean isCompareTopHit() {
        return compareTopHit;
    }

    public UnhealthyServicePolicy getUnhealthyServicePolicy() {
        return unhealthyServicePolicy;
    }

    public ComparisonPolicy withSearchOverlapThreshold(double threshold) {
        return new ComparisonPolicy(threshold, compareTopHit, unhealthyServicePolicy);
    }

    public ComparisonPolicy withCompareTopHit(boolean compare) {
        return new ComparisonPolicy(searchOverlapThreshold, compare, unhealthyServicePolicy);
    }

    public ComparisonPolicy withUnhealthyServicePolicy(UnhealthyServicePolicy policy) {
        return new ComparisonPolicy(searchOverlapThreshold, compareTopHit, policy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ComparisonPolicy that = (ComparisonPolicy) o;
        return Double.compare(searchOverlapThreshold, that.searchOverlapThreshold) == 0
                && compareTopHit == that.compareTopHit && unhealthyServicePolicy == that.unhealthyServicePolicy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(searchOverlapThreshold, compareTopHit, unhealthyServicePolicy);
    }
}
