package com.shlawgathon.leafscan.backend.feature;

import com.shlawgathon.leafscan.backend.TestImages;
import com.shlawgathon.leafscan.backend.model.PixelGrid;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HsvImageTest {

    @Test
    void shouldConvertToOpenCvScale() {
        // Given
        int[][][] pixels = TestImages.canvas(2, 2, TestImages.LEAF_GREEN);
        pixels[0][1] = TestImages.LESION_BROWN;
        pixels[1][0] = new int[]{0, 0, 0};
        pixels[1][1] = new int[]{255, 0, 0};
        PixelGrid grid = TestImages.toGrid(pixels);

        // When
        HsvImage hsv = HsvImage.of(grid);

        // Then
        assertThat(hsv.hue(0)).isEqualTo(60);
        assertThat(hsv.saturation(0)).isEqualTo(186);
        assertThat(hsv.value(0)).isEqualTo(148);

        assertThat(hsv.hue(1)).isEqualTo(13);
        assertThat(hsv.saturation(1)).isEqualTo(221);
        assertThat(hsv.value(1)).isEqualTo(150);

        assertThat(hsv.hue(2)).isZero();
        assertThat(hsv.saturation(2)).isZero();
        assertThat(hsv.value(2)).isZero();

        assertThat(hsv.hue(3)).isZero();
        assertThat(hsv.saturation(3)).isEqualTo(255);
    }

    @Test
    void shouldBuildNormalizedHistograms() {
        HsvImage hsv = HsvImage.of(TestImages.healthyLeaf());

        double[] histogram = ColorHistogram.hsv(hsv, 32);

        assertThat(histogram).hasSize(96);
        // hue 60 of 180, saturation 186 and value 148 of 256
        assertThat(histogram[10]).isEqualTo(1.0);
        assertThat(histogram[32 + 23]).isEqualTo(1.0);
        assertThat(histogram[64 + 18]).isEqualTo(1.0);
        double sum = 0;
        for (double v : histogram) {
            sum += v;
        }
        assertThat(sum).isEqualTo(3.0);
    }

    @Test
    void shouldPutTopOfRangeInLastBin() {
        double[] out = new double[4];

        ColorHistogram.fill(new int[]{0, 179, 179, 90}, HsvImage.HUE_RANGE, 4, out, 0);

        assertThat(out).containsExactly(0.25, 0.0, 0.25, 0.5);
    }
}
