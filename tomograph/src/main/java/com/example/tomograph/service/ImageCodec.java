package com.example.tomograph.service;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Converts between image files and row-major grayscale grids.
 */
@Component
public class ImageCodec {

    /**
     * Reads any format ImageIO knows. Gray images are read as is; colour and
     * palette images are reduced to luma (ITU-R 601-2 weights).
     */
    public INDArray decode(byte[] data) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(data));
        } catch (IOException e) {
            throw new IllegalArgumentException("Could not read the uploaded image.", e);
        }
        if (image == null) {
            throw new IllegalArgumentException("Unsupported or empty image payload (" + data.length + " bytes)");
        }
        int width = image.getWidth();
        int height = image.getHeight();
        Raster raster = image.getRaster();
        ColorModel colorModel = image.getColorModel();
        // palette samples are indices, not intensities
        boolean gray = !(colorModel instanceof IndexColorModel)
                && colorModel.getColorSpace().getType() == ColorSpace.TYPE_GRAY
                && raster.getNumBands() == 1;

        double[][] pixels = new double[height][width];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                if (gray) {
                    pixels[row][col] = raster.getSample(col, row, 0);
                } else {
                    int rgb = image.getRGB(col, row);
                    int r = (rgb >> 16) & 0xff;
                    int g = (rgb >> 8) & 0xff;
                    int b = rgb & 0xff;
                    pixels[row][col] = (r * 19595 + g * 38470 + b * 7471 + 0x8000) >> 16;
                }
            }
        }
        return Nd4j.createFromArray(pixels);
    }

    /**
     * Writes an 8-bit grayscale PNG; values are rounded and clamped to 0..255.
     */
    public byte[] encode(INDArray values) {
        double[][] pixels = values.toDoubleMatrix();
        int height = pixels.length;
        int width = pixels[0].length;
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);

        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                int gray = (int) Math.round(pixels[row][col]);
                gray = Math.max(0, Math.min(255, gray));
                image.getRaster().setSample(col, row, 0, gray);
            }
        }

        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(image, "PNG", baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new RuntimeException("Failed to encode image as PNG.", e);
        }
    }
}
