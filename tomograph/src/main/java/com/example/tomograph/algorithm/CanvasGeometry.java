package com.example.tomograph.algorithm;

/**
 * Square canvas large enough to hold a {@code height x width} image at any
 * rotation. The side is the ceiling of the image diagonal; when the padding
 * on an axis is odd the extra pixel goes after the image (bottom / right).
 */
public record CanvasGeometry(int height, int width, int side, int padTop, int padLeft) {

    public static CanvasGeometry of(int height, int width) {
        if (height <= 0 || width <= 0) {
            throw new InvalidGeometryException("Image shape must be positive, got " + height + "x" + width);
        }
        int side = (int) Math.ceil(Math.sqrt((double) height * height + (double) width * width));
        int padTop = (int) Math.floor((side - height) / 2.0);
        int padLeft = (int) Math.floor((side - width) / 2.0);
        return new CanvasGeometry(height, width, side, padTop, padLeft);
    }

    public int padBottom() {
        return side - height - padTop;
    }

    public int padRight() {
        return side - width - padLeft;
    }

    public int center() {
        return side / 2;
    }

    public int radius() {
        return side / 2;
    }

    public double[][] pad(double[][] image) {
        if (image.length != height || image[0].length != width) {
            throw new ShapeMismatchException("Expected a " + height + "x" + width + " image, got "
                    + image.length + "x" + image[0].length);
        }
        double[][] canvas = new double[side][side];
        for (int row = 0; row < height; row++) {
            System.arraycopy(image[row], 0, canvas[row + padTop], padLeft, width);
        }
        return canvas;
    }
}
