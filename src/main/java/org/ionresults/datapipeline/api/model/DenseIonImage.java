package org.ionresults.datapipeline.api.model;

/**
 * A densified isotope image, ready to be handed to an image store.
 * <p>
 * The raster has the shape of the dataset's {@link SpatialMask}. Pixels the mask marks as
 * unsampled always hold {@code 0.0}; the mask travels with the raster so that stores can
 * render those pixels transparent.
 */
public final class DenseIonImage {

    private final double[] intensities;   // row-major
    private final SpatialMask mask;
    private final double maxIntensity;

    public DenseIonImage(double[] intensities, SpatialMask mask) {
        if (intensities.length != mask.getPixelCount()) {
            throw new IllegalArgumentException(String.format(
                "Raster has %d pixels but mask %dx%d expects %d",
                intensities.length, mask.getRows(), mask.getCols(), mask.getPixelCount()));
        }
        this.intensities = intensities;
        this.mask = mask;
        double max = 0.0;
        for (double v : intensities) {
            if (v > max) max = v;
        }
        this.maxIntensity = max;
    }

    public int getRows() {
        return mask.getRows();
    }

    public int getCols() {
        return mask.getCols();
    }

    public SpatialMask getMask() {
        return mask;
    }

    public double intensityAt(int row, int col) {
        return intensities[row * mask.getCols() + col];
    }

    public double getMaxIntensity() {
        return maxIntensity;
    }

    /**
     * Returns a copy of the row-major raster.
     */
    public double[] toArray() {
        return intensities.clone();
    }
}
