package org.ionresults.datapipeline.api.resources;

/**
 * Hands every posting worker its own {@link IImageStore} handle.
 */
@FunctionalInterface
public interface IImageStoreProvider {

    IImageStore openHandle();
}
