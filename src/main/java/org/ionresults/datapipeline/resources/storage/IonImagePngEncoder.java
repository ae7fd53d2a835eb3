package org.ionresults.datapipeline.resources.storage;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

import org.ionresults.datapipeline.api.model.DenseIonImage;

/**
 * Encodes a dense isotope image as greyscale PNG with the sampling mask as alpha channel.
 * <p>
 * Intensities are scaled linearly so that the image maximum maps to 255. Unsampled pixels
 * are fully transparent, sampled pixels fully opaque. An image without positive intensity
 * renders black.
 * <p>
 * <strong>Thread Safety:</strong> Stateless.
 */
public final class IonImagePngEncoder {

    private IonImagePngEncoder() {
        // Utility class
    }

    public static byte[] encode(DenseIonImage image) throws IOException {
        int width = image.getCols();
        int height = image.getRows();
        BufferedImage frame = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] pixels = ((DataBufferInt) frame.getRaster().getDataBuffer()).getData();

        double max = image.getMaxIntensity();
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int grey = greyLevel(image.intensityAt(row, col), max);
                int alpha = image.getMask().isSampled(row, col) ? 0xFF : 0x00;
                pixels[row * width + col] = (alpha << 24) | (grey << 16) | (grey << 8) | grey;
            }
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(frame, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }

    static int greyLevel(double intensity, double max) {
        if (max <= 0.0 || intensity <= 0.0) {
            return 0;
        }
        return (int) Math.round(Math.min(intensity / max, 1.0) * 255.0);
    }
}
