package com.example.tomograph.service;

import org.junit.jupiter.api.Test;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageCodecTest {

    private final ImageCodec codec = new ImageCodec();

    @Test
    void grayscaleValuesAreRoundedAndClamped() {
        INDArray values = Nd4j.createFromArray(new double[][]{{12.6, 300, -5}, {0, 128, 255}});

        INDArray decoded = codec.decode(codec.encode(values));

        assertThat(decoded.toDoubleMatrix()).isDeepEqualTo(new double[][]{{13, 255, 0}, {0, 128, 255}});
    }

    @Test
    void colourImagesAreReducedToLuma() throws IOException {
        BufferedImage rgb = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(0, 0, 0xff0000);
        rgb.setRGB(1, 0, 0xffffff);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(rgb, "PNG", out);

        INDArray decoded = codec.decode(out.toByteArray());

        assertThat(decoded.toDoubleMatrix()).isDeepEqualTo(new double[][]{{76, 255}});
    }

    @Test
    void paletteImagesAreMappedThroughTheirColours() throws IOException {
        byte[] levels = {(byte) 0xff, 0};
        IndexColorModel palette = new IndexColorModel(1, 2, levels, levels, levels);
        BufferedImage indexed = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_BINARY, palette);
        indexed.getRaster().setSample(0, 0, 0, 0);
        indexed.getRaster().setSample(1, 0, 0, 1);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(indexed, "PNG", out);

        INDArray decoded = codec.decode(out.toByteArray());

        assertThat(decoded.toDoubleMatrix()).isDeepEqualTo(new double[][]{{255, 0}});
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> codec.decode(new byte[]{1, 2, 3, 4}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
