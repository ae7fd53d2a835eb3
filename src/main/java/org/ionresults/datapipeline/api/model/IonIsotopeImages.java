package org.ionresults.datapipeline.api.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The isotope peak images of one ion, in peak order.
 * <p>
 * A {@code null} slot means no signal was detected for that peak. This is a distinct
 * state from a present matrix whose entries are all zero.
 *
 * @param formulaIndex identifier of the ion's formula/adduct pair ({@code formula_i})
 * @param slots        peak images in isotope order, {@code null} for absent peaks
 */
public record IonIsotopeImages(int formulaIndex, List<SparseIntensityMatrix> slots) {

    public IonIsotopeImages {
        if (slots == null) {
            throw new IllegalArgumentException("slots must not be null (use absent entries instead)");
        }
        // List.copyOf rejects nulls, absent slots are part of the contract
        slots = Collections.unmodifiableList(new ArrayList<>(slots));
    }

    public static IonIsotopeImages of(int formulaIndex, SparseIntensityMatrix... slots) {
        return new IonIsotopeImages(formulaIndex, Arrays.asList(slots));
    }

    public int slotCount() {
        return slots.size();
    }

    public SparseIntensityMatrix slot(int index) {
        return slots.get(index);
    }
}
