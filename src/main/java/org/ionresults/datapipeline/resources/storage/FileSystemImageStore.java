package org.ionresults.datapipeline.resources.storage;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import org.ionresults.datapipeline.api.model.DenseIonImage;
import org.ionresults.datapipeline.api.resources.IImageStore;
import org.ionresults.datapipeline.api.resources.IImageStoreProvider;
import org.ionresults.datapipeline.api.resources.IMonitorable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Image store keeping PNG files on a local or mounted filesystem.
 * <p>
 * Layout: {@code <rootDirectory>/<datasetId>/<imageId>.png}. Image ids are random, so posting
 * the same image twice stores two files; duplicates left by retried partitions are harmless
 * and never referenced by a result row.
 * <p>
 * Configuration:
 * <pre>
 * imageStore {
 *   rootDirectory = "/data/ion-images"   # required, absolute
 *   storeKind = "fs"                     # kind accepted by postImage
 * }
 * </pre>
 * <strong>Thread Safety:</strong> Thread-safe; {@link #openHandle()} returns this instance.
 */
public class FileSystemImageStore implements IImageStore, IImageStoreProvider, IMonitorable {

    private static final Logger log = LoggerFactory.getLogger(FileSystemImageStore.class);
    private static final String EXTENSION = ".png";

    private final String name;
    private final File rootDirectory;
    private final String storeKind;

    private final AtomicLong imagesWritten = new AtomicLong(0);
    private final AtomicLong bytesWritten = new AtomicLong(0);
    private final AtomicLong writeErrors = new AtomicLong(0);

    public FileSystemImageStore(String name, Config options) {
        this.name = name;
        if (!options.hasPath("rootDirectory")) {
            throw new IllegalArgumentException("rootDirectory is required for FileSystemImageStore");
        }
        String rootPath = options.getString("rootDirectory");
        this.rootDirectory = new File(rootPath);
        if (!this.rootDirectory.isAbsolute()) {
            throw new IllegalArgumentException("rootDirectory must be an absolute path: " + rootPath);
        }
        if (!this.rootDirectory.exists() && !this.rootDirectory.mkdirs()) {
            throw new IllegalArgumentException("Cannot create rootDirectory: " + rootPath);
        }
        if (!this.rootDirectory.canWrite()) {
            throw new IllegalArgumentException("rootDirectory is not writable: " + rootPath);
        }
        this.storeKind = options.hasPath("storeKind") ? options.getString("storeKind") : "fs";
        log.debug("Image store '{}' writing to {}", name, rootDirectory.getAbsolutePath());
    }

    public String getResourceName() {
        return name;
    }

    @Override
    public IImageStore openHandle() {
        return this;
    }

    @Override
    public String postImage(String requestedKind, String datasetId, DenseIonImage image) throws IOException {
        if (!storeKind.equals(requestedKind)) {
            throw new IllegalArgumentException(String.format(
                "Image store '%s' serves kind '%s', got '%s'", name, storeKind, requestedKind));
        }
        validateKey(datasetId);
        String imageId = UUID.randomUUID().toString().replace("-", "");
        try {
            byte[] png = IonImagePngEncoder.encode(image);
            putRaw(datasetId + "/" + imageId + EXTENSION, png);
            imagesWritten.incrementAndGet();
            bytesWritten.addAndGet(png.length);
            return imageId;
        } catch (IOException e) {
            writeErrors.incrementAndGet();
            throw e;
        }
    }

    /**
     * Reads the PNG bytes of a stored image.
     *
     * @throws IOException if the image does not exist
     */
    public byte[] readImage(String datasetId, String imageId) throws IOException {
        validateKey(datasetId);
        validateKey(imageId);
        File file = new File(rootDirectory, datasetId + "/" + imageId + EXTENSION);
        if (!file.exists()) {
            throw new IOException("Image does not exist: " + datasetId + "/" + imageId);
        }
        return Files.readAllBytes(file.toPath());
    }

    /**
     * Deletes a stored image.
     *
     * @return {@code true} if the image existed
     */
    public boolean deleteImage(String datasetId, String imageId) throws IOException {
        validateKey(datasetId);
        validateKey(imageId);
        return Files.deleteIfExists(new File(rootDirectory, datasetId + "/" + imageId + EXTENSION).toPath());
    }

    @Override
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("images_written", imagesWritten.get());
        metrics.put("bytes_written", bytesWritten.get());
        metrics.put("write_errors", writeErrors.get());
        return metrics;
    }

    private void putRaw(String physicalPath, byte[] data) throws IOException {
        File file = new File(rootDirectory, physicalPath);

        File parentDir = file.getParentFile();
        if (parentDir != null) {
            parentDir.mkdirs();
            if (!parentDir.isDirectory()) {
                throw new IOException("Failed to create parent directories for: " + file.getAbsolutePath());
            }
        }

        // Atomic write: temp file, then move. Suffix keeps temp files out of listings by id.
        File tempFile = new File(parentDir, file.getName() + "." + UUID.randomUUID() + ".tmp");
        Files.write(tempFile.toPath(), data);

        try {
            Files.move(tempFile.toPath(), file.toPath(), StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile.toPath());
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile);
            }
            throw e;
        }
    }

    private static void validateKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key must not be blank");
        }
        if (key.contains("..") || key.contains("/") || key.contains("\\")) {
            throw new IllegalArgumentException("Key must be a single path segment: " + key);
        }
    }
}
