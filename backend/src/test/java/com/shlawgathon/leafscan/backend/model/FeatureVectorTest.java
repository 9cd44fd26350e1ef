package com.shlawgathon.leafscan.backend.model;

import com.shlawgathon.leafscan.backend.TestImages;
import com.shlawgathon.leafscan.backend.exception.DegenerateFeatureException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeatureVectorTest {

    @Test
    void shouldRejectWrongLength() {
        assertThatThrownBy(() -> FeatureVector.of(new double[105]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("106");
    }

    @Test
    void shouldRejectNonFiniteValues() {
        double[] values = new double[FeatureVector.LENGTH];
        values[FeatureVector.TEXTURE_OFFSET] = Double.NaN;

        assertThatThrownBy(() -> FeatureVector.of(values))
                .isInstanceOf(DegenerateFeatureException.class)
                .hasMessageContaining("texture_k3_mean");

        values[FeatureVector.TEXTURE_OFFSET] = Double.POSITIVE_INFINITY;
        assertThatThrownBy(() -> FeatureVector.of(values)).isInstanceOf(DegenerateFeatureException.class);
    }

    @Test
    void shouldNotShareBackingArray() {
        double[] values = new double[FeatureVector.LENGTH];
        FeatureVector vector = FeatureVector.of(values);
        values[0] = 42;

        assertThat(vector.get(0)).isZero();
        vector.toArray()[1] = 42;
        assertThat(vector.get(1)).isZero();
    }

    @Test
    void shouldComputeEuclideanDistance() {
        FeatureVector a = TestImages.vector(0, 0);
        FeatureVector b = TestImages.vector(3, 4);

        assertThat(a.distanceTo(a)).isZero();
        assertThat(a.distanceTo(b)).isCloseTo(5.0, within(1e-12));
        assertThat(b.distanceTo(a)).isEqualTo(a.distanceTo(b));
    }

    @Test
    void shouldSplitIntoBands() {
        FeatureVector vector = TestImages.vector(2, 7);

        assertThat(vector.colorBand()).hasSize(96);
        assertThat(vector.textureBand()).hasSize(6);
        assertThat(vector.shapeBand()).containsExactly(2, 7, 0, 0);
    }

    @Test
    void shouldNameEveryPosition() {
        assertThat(FeatureVector.featureNames()).hasSize(106).doesNotHaveDuplicates();
        assertThat(FeatureVector.featureName(0)).isEqualTo("hue_bin_00");
        assertThat(FeatureVector.featureName(95)).isEqualTo("value_bin_31");
        assertThat(FeatureVector.featureName(99)).isEqualTo("texture_k5_std");
        assertThat(FeatureVector.featureName(105)).isEqualTo("largest_blob_ratio");
    }

    @Test
    void shouldRoundTripThroughList() {
        FeatureVector vector = TestImages.vector(3, 12.5);

        assertThat(FeatureVector.fromList(vector.toList())).isEqualTo(vector);
    }
}
