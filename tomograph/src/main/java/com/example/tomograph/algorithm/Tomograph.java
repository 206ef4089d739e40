package com.example.tomograph.algorithm;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points of the simulated scanner: forward projection of an image into
 * a sinogram, backprojection of a sinogram into an image, and the error
 * between two images.
 *
 * <p>Calls keep no state between them. Images and sinograms are 2-D arrays;
 * sinograms are indexed {@code [detector][scan]}.
 */
public class Tomograph {

    private static final Logger logger = LoggerFactory.getLogger(Tomograph.class);

    private final ForwardProjector forwardProjector;
    private final BackProjector backProjector;

    public Tomograph(boolean parallel) {
        this.forwardProjector = new ForwardProjector(parallel);
        this.backProjector = new BackProjector(parallel);
    }

    /**
     * @return sinogram of shape {@code (detectorCount, scanCount)}, every scan
     * column stretched independently onto {@code [0, 255]}
     */
    public INDArray buildSinogram(INDArray image, int scanCount, int detectorCount, double angleSpanDegrees) {
        requireMatrix(image, "image");
        CanvasGeometry canvas = CanvasGeometry.of((int) image.rows(), (int) image.columns());
        ScanGeometry geometry = ScanGeometry.forCanvas(canvas, angleSpanDegrees, detectorCount, scanCount);
        logger.debug("Forward projection of {}x{} image on a {} px canvas: {} scans, {} detectors, span {}",
                canvas.height(), canvas.width(), canvas.side(), scanCount, detectorCount, angleSpanDegrees);

        double[][] padded = canvas.pad(image.toDoubleMatrix());
        return Nd4j.createFromArray(forwardProjector.projectAll(padded, geometry));
    }

    /**
     * Backprojects {@code sinogram} onto the canvas of a {@code height x width}
     * image, averages by hit count, optionally smooths, stretches onto
     * {@code [0, 255]} and crops to the requested shape.
     */
    public INDArray reconstruct(int height, int width, INDArray sinogram, double angleSpanDegrees, boolean useFilter) {
        requireMatrix(sinogram, "sinogram");
        CanvasGeometry canvas = CanvasGeometry.of(height, width);
        ScanGeometry geometry = ScanGeometry.forCanvas(canvas, angleSpanDegrees,
                (int) sinogram.rows(), (int) sinogram.columns());
        logger.debug("Backprojection of {}x{} sinogram onto a {} px canvas, filter={}",
                sinogram.rows(), sinogram.columns(), canvas.side(), useFilter);

        ReconstructionAccumulator accumulator =
                backProjector.backProjectAll(sinogram.toDoubleMatrix(), geometry, canvas.side());
        double[][] image = accumulator.normalize();
        if (useFilter) {
            image = SmoothingFilter.apply(image);
        }
        INDArray stretched = ImageScaling.rescale(Nd4j.createFromArray(image));
        if (stretched.maxNumber().doubleValue() == 0) {
            logger.warn("Reconstruction has no contrast; returning a blank {}x{} image", height, width);
        }
        return Nd4j.createFromArray(ImageScaling.unpad(stretched.toDoubleMatrix(), height, width));
    }

    public double rmse(INDArray original, INDArray reconstructed) {
        requireMatrix(original, "original");
        requireMatrix(reconstructed, "reconstructed");
        return QualityMetric.rmse(original, reconstructed);
    }

    /**
     * Number of scans that sweeps 180 degrees in steps of {@code angleStepDegrees}.
     */
    public static int scanCountForStep(double angleStepDegrees) {
        if (!(angleStepDegrees > 0)) {
            throw new InvalidGeometryException("Angle step must be positive, got " + angleStepDegrees);
        }
        int scans = (int) (ScanGeometry.SWEEP_DEGREES / angleStepDegrees);
        if (scans <= 0) {
            throw new InvalidGeometryException("Angle step " + angleStepDegrees + " leaves no scans");
        }
        return scans;
    }

    /**
     * Copy of the first {@code count} scan columns, e.g. for one frame of an
     * angle-sweep animation.
     */
    public static INDArray leadingScans(INDArray sinogram, int count) {
        requireMatrix(sinogram, "sinogram");
        if (count <= 0 || count > sinogram.columns()) {
            throw new InvalidGeometryException("Scan prefix " + count + " outside 1.." + sinogram.columns());
        }
        double[][] full = sinogram.toDoubleMatrix();
        double[][] prefix = new double[full.length][count];
        for (int detector = 0; detector < full.length; detector++) {
            System.arraycopy(full[detector], 0, prefix[detector], 0, count);
        }
        return Nd4j.createFromArray(prefix);
    }

    private static void requireMatrix(INDArray array, String name) {
        if (array == null || array.rank() != 2 || array.rows() == 0 || array.columns() == 0) {
            throw new InvalidGeometryException("The " + name + " must be a non-empty 2-D array");
        }
    }
}
