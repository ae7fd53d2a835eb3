package org.ionresults.datapipeline.api.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Image store references of one ion, aligned with its isotope peak slots.
 * <p>
 * Entry {@code i} is the id returned for peak slot {@code i}, or {@code null} if the slot
 * was absent and nothing was posted.
 *
 * @param imageIds references in slot order, nulls preserved positionally
 */
public record IonImageIds(List<String> imageIds) {

    public IonImageIds {
        if (imageIds == null) {
            throw new IllegalArgumentException("imageIds must not be null");
        }
        imageIds = Collections.unmodifiableList(new ArrayList<>(imageIds));
    }

    public static IonImageIds of(String... imageIds) {
        return new IonImageIds(Arrays.asList(imageIds));
    }

    /**
     * References for an ion without any posted image.
     *
     * @param slotCount number of isotope peak slots of the job
     */
    public static IonImageIds allAbsent(int slotCount) {
        return new IonImageIds(Arrays.asList(new String[slotCount]));
    }

    public int size() {
        return imageIds.size();
    }

    public String[] toArray() {
        return imageIds.toArray(new String[0]);
    }
}
