package org.ionresults.datapipeline.resources.storage;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;

import javax.imageio.ImageIO;

import org.ionresults.datapipeline.api.model.DenseIonImage;
import org.ionresults.datapipeline.api.model.SpatialMask;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class IonImagePngEncoderTest {

    @Test
    void encodesGreyscaleWithMaskAsAlpha() throws Exception {
        SpatialMask mask = SpatialMask.of(new int[][] {{1, 1, 1}, {1, 1, 0}});
        DenseIonImage image = new DenseIonImage(new double[] {0, 5, 10, 2.5, 10, 0}, mask);

        byte[] png = IonImagePngEncoder.encode(image);
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(png));

        assertThat(decoded.getWidth()).isEqualTo(3);
        assertThat(decoded.getHeight()).isEqualTo(2);
        assertThat(decoded.getRGB(0, 0)).isEqualTo(0xFF000000);
        assertThat(decoded.getRGB(2, 0)).isEqualTo(0xFFFFFFFF);
        assertThat(decoded.getRGB(1, 0) & 0xFF).isEqualTo(128);
        assertThat(decoded.getRGB(2, 1) >>> 24).isZero();
    }

    @Test
    void greyLevelScalesToMaximum() {
        assertThat(IonImagePngEncoder.greyLevel(10, 10)).isEqualTo(255);
        assertThat(IonImagePngEncoder.greyLevel(0, 10)).isZero();
        assertThat(IonImagePngEncoder.greyLevel(5, 0)).isZero();
        assertThat(IonImagePngEncoder.greyLevel(1, 4)).isEqualTo(64);
    }
}
