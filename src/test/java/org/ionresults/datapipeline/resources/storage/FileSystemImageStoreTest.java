package org.ionresults.datapipeline.resources.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.ionresults.datapipeline.api.model.DenseIonImage;
import org.ionresults.datapipeline.api.model.SpatialMask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

@Tag("unit")
class FileSystemImageStoreTest {

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G'};

    @TempDir
    Path tempDir;

    private FileSystemImageStore store;
    private DenseIonImage image;

    @BeforeEach
    void setUp() {
        Config config = ConfigFactory.empty()
            .withValue("rootDirectory", ConfigValueFactory.fromAnyRef(tempDir.toAbsolutePath().toString()));
        store = new FileSystemImageStore("test-store", config);
        image = new DenseIonImage(new double[] {1, 2, 3, 0}, SpatialMask.of(new int[][] {{1, 1}, {1, 0}}));
    }

    @Test
    void writesPngUnderDatasetDirectory() throws Exception {
        String id = store.postImage("fs", "ds-1", image);

        assertThat(id).matches("[0-9a-f]{32}");
        Path file = tempDir.resolve("ds-1").resolve(id + ".png");
        assertThat(file).exists();
        assertThat(store.readImage("ds-1", id)).startsWith(PNG_SIGNATURE);
    }

    @Test
    void repostingCreatesDistinctImages() throws Exception {
        String first = store.postImage("fs", "ds-1", image);
        String second = store.postImage("fs", "ds-1", image);

        assertThat(second).isNotEqualTo(first);
        try (Stream<Path> files = Files.list(tempDir.resolve("ds-1"))) {
            assertThat(files.map(p -> p.getFileName().toString())).allMatch(name -> name.endsWith(".png")).hasSize(2);
        }
    }

    @Test
    void deleteRemovesImage() throws Exception {
        String id = store.postImage("fs", "ds-1", image);

        assertThat(store.deleteImage("ds-1", id)).isTrue();
        assertThat(store.deleteImage("ds-1", id)).isFalse();
        assertThatThrownBy(() -> store.readImage("ds-1", id)).isInstanceOf(IOException.class);
    }

    @Test
    void countsWrittenImages() throws Exception {
        store.postImage("fs", "ds-1", image);
        store.postImage("fs", "ds-2", image);

        assertThat(store.getMetrics().get("images_written")).isEqualTo(2L);
        assertThat(store.getMetrics().get("bytes_written").longValue()).isPositive();
        assertThat(store.getMetrics().get("write_errors")).isEqualTo(0L);
    }

    @Test
    void rejectsOtherStoreKind() {
        assertThatThrownBy(() -> store.postImage("s3", "ds-1", image))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("s3");
    }

    @Test
    void rejectsPathTraversal() {
        assertThatThrownBy(() -> store.postImage("fs", "../escape", image)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.readImage("ds-1", "a/b")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void handleIsTheStoreItself() {
        assertThat(store.openHandle()).isSameAs(store);
        assertThat(store.getResourceName()).isEqualTo("test-store");
    }

    @Test
    void requiresAbsoluteRootDirectory() {
        Config relative = ConfigFactory.parseString("rootDirectory = \"relative/images\"");

        assertThatThrownBy(() -> new FileSystemImageStore("bad", relative)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FileSystemImageStore("bad", ConfigFactory.empty()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
