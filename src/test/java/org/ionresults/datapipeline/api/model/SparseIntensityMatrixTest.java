package org.ionresults.datapipeline.api.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SparseIntensityMatrixTest {

    @Test
    void fromDenseKeepsNonZeroCellsOnly() {
        SparseIntensityMatrix matrix = SparseIntensityMatrix.fromDense(new double[][] {{0, 1.5}, {2, 0}});

        assertThat(matrix.storedEntries()).isEqualTo(2);
        assertThat(matrix.rowAt(0)).isZero();
        assertThat(matrix.colAt(0)).isEqualTo(1);
        assertThat(matrix.valueAt(1)).isEqualTo(2.0);
        assertThat(matrix.toDense()).containsExactly(0.0, 1.5, 2.0, 0.0);
    }

    @Test
    void builderRetainsExplicitZeros() {
        SparseIntensityMatrix matrix = SparseIntensityMatrix.builder(1, 3).add(0, 2, 0.0).build();

        assertThat(matrix.storedEntries()).isEqualTo(1);
        assertThat(matrix.toDense()).containsOnly(0.0);
    }

    @Test
    void rejectsEntriesOutsideShape() {
        assertThatThrownBy(() -> SparseIntensityMatrix.builder(2, 2).add(2, 0, 1.0))
            .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> SparseIntensityMatrix.builder(0, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SparseIntensityMatrix.fromDense(new double[][] {{1, 2}, {3}}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
