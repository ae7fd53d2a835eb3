package org.ionresults.datapipeline.materialize;

import java.util.ArrayList;
import java.util.List;

import org.ionresults.datapipeline.api.UpstreamDataException;
import org.ionresults.datapipeline.api.model.DenseIonImage;
import org.ionresults.datapipeline.api.model.IonIsotopeImages;
import org.ionresults.datapipeline.api.model.SparseIntensityMatrix;
import org.ionresults.datapipeline.api.model.SpatialMask;

/**
 * Decides which isotope slots of an ion hold an image and expands them against the dataset mask.
 * <p>
 * A slot is present iff it is not the absence marker. Sparse matrices without non-zero
 * entries are present. An ion whose slots are all absent is passed on unchanged; filtering
 * empty ions is not done here.
 * <p>
 * <strong>Thread Safety:</strong> Immutable, shared by all posting workers.
 */
public final class SparseImageReconstructor {

    private final SpatialMask mask;

    public SparseImageReconstructor(SpatialMask mask) {
        this.mask = mask;
    }

    public SpatialMask getMask() {
        return mask;
    }

    public static boolean isPresent(SparseIntensityMatrix slot) {
        return slot != null;
    }

    /**
     * Presence flag per slot, in slot order.
     */
    public boolean[] presence(IonIsotopeImages ion) {
        boolean[] present = new boolean[ion.slotCount()];
        for (int i = 0; i < present.length; i++) {
            present[i] = isPresent(ion.slot(i));
        }
        return present;
    }

    /**
     * Expands one present slot into a raster of the mask's shape. Intensities at unsampled
     * pixels are dropped.
     *
     * @param formulaIndex ion the slot belongs to, used in error messages
     * @param slot         present sparse image
     * @return the dense image
     * @throws UpstreamDataException if the matrix does not have the mask's shape
     */
    public DenseIonImage densify(int formulaIndex, SparseIntensityMatrix slot) throws UpstreamDataException {
        if (!mask.matchesShape(slot.getRows(), slot.getCols())) {
            throw new UpstreamDataException(String.format(
                "Isotope image of formula_i=%d has shape %dx%d, dataset mask is %dx%d",
                formulaIndex, slot.getRows(), slot.getCols(), mask.getRows(), mask.getCols()));
        }
        double[] raster = slot.toDense();
        for (int i = 0; i < raster.length; i++) {
            if (!mask.isSampled(i)) {
                raster[i] = 0.0;
            }
        }
        return new DenseIonImage(raster, mask);
    }

    /**
     * Densifies every present slot of an ion; absent slots stay {@code null}.
     */
    public List<DenseIonImage> reconstruct(IonIsotopeImages ion) throws UpstreamDataException {
        List<DenseIonImage> images = new ArrayList<>(ion.slotCount());
        for (SparseIntensityMatrix slot : ion.slots()) {
            images.add(isPresent(slot) ? densify(ion.formulaIndex(), slot) : null);
        }
        return images;
    }
}
