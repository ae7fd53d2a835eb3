package org.ionresults.datapipeline.api.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SpatialMaskTest {

    @Test
    void nonZeroCellsAreSampled() {
        SpatialMask mask = SpatialMask.of(new int[][] {{1, 0, 2}, {0, 1, 0}});

        assertThat(mask.getRows()).isEqualTo(2);
        assertThat(mask.getCols()).isEqualTo(3);
        assertThat(mask.sampledPixelCount()).isEqualTo(3);
        assertThat(mask.isSampled(0, 2)).isTrue();
        assertThat(mask.isSampled(1, 0)).isFalse();
        assertThat(mask.isSampled(4)).isTrue();
        assertThat(mask.matchesShape(2, 3)).isTrue();
        assertThat(mask.matchesShape(3, 2)).isFalse();
    }

    @Test
    void fullMaskSamplesEverything() {
        assertThat(SpatialMask.full(3, 4).sampledPixelCount()).isEqualTo(12);
    }

    @Test
    void rejectsMalformedGrids() {
        assertThatThrownBy(() -> SpatialMask.of(new int[][] {{1, 1}, {1}})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SpatialMask.of(new int[0][0])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SpatialMask.full(2, 2).isSampled(2, 0)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
