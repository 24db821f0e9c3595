package com.fiberfit.service;

import com.fiberfit.model.AnalysisOutput;
import com.fiberfit.model.AnalysisRequest;
import com.fiberfit.model.AnalysisSettings;
import com.fiberfit.model.ArtifactKind;
import com.fiberfit.model.DisplayGeometry;
import ij.process.ColorProcessor;
import ij.process.FHT;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fibre orientation from the power spectrum of a square gray image.
 * <p>
 * The spectrum is integrated along rays between the lower and upper cut-off radius, which
 * gives a distribution over fibre angles (spectral angle minus 90 degrees, axial, in
 * [-90, 90)). An axial von Mises density is fitted to it: {@code th} is the mean
 * orientation, {@code k} the concentration and {@code R2} the goodness of fit.
 */
public class FiberOrientationService implements AnalysisAdapter {

    private static final Logger logger = LoggerFactory.getLogger(FiberOrientationService.class);

    private static final int MIN_SIZE = 8;
    private static final int DEFAULT_PLOT_SIZE = 400;
    private static final double MAX_KAPPA = 500.0;
    static final long MAX_ANGLE_BINS = 18_000;          // 0.01 degree increments
    static final long MAX_RADIAL_SAMPLES = 100_000;     // per ray

    private final ImageLoader loader;

    public FiberOrientationService() {
        this(new ImageLoader());
    }

    public FiberOrientationService(ImageLoader loader) {
        this.loader = loader;
    }

    @Override
    public AnalysisOutput analyze(AnalysisRequest request) throws Exception {
        long start = System.nanoTime();
        AnalysisSettings s = request.settings();

        FloatProcessor image = loader.load(request.file());
        int w = image.getWidth(), h = image.getHeight();
        if (w != h) throw new NonSquareImageException(request.file(), w, h);
        if (w < MIN_SIZE) throw new UnsupportedImageException(request.file(), "image is smaller than " + MIN_SIZE + " px");
        checkDomain(s);

        FloatProcessor spectrum = powerSpectrum(image);
        double[] angles = binAngles(s.angleIncrement);
        double[] weights = integrate(spectrum, angles, s);
        OrientationFit fit = fit(angles, weights);

        int plot = plotSize(request.geometry());
        Map<ArtifactKind, BufferedImage> images = new EnumMap<>(ArtifactKind.class);
        image.resetMinAndMax();
        images.put(ArtifactKind.ORIGINAL, image.convertToByteProcessor(true).getBufferedImage());
        images.put(ArtifactKind.LOG_SCALE, logScaled(spectrum).getBufferedImage());
        images.put(ArtifactKind.ANGULAR_DISTRIBUTION, drawRose(angles, fit, plot));
        images.put(ArtifactKind.CARTESIAN_DISTRIBUTION, drawCartesian(angles, fit, plot));

        double elapsed = (System.nanoTime() - start) / 1e9;
        logger.debug("{}: th={} k={} R2={} in {}s", request.file().getFileName(), fit.mu, fit.kappa, fit.r2, elapsed);
        return new AnalysisOutput(fit.kappa, fit.mu, fit.r2, new double[]{fit.spread, fit.muError},
                images, plot, plot, elapsed);
    }

    static void checkDomain(AnalysisSettings s) {
        if (s.angleIncrement <= 0 || s.angleIncrement > 90)
            throw new ArithmeticException("Angle increment out of range: " + s.angleIncrement);
        binCount(s.angleIncrement);
        if (s.radialStep <= 0)
            throw new ArithmeticException("Radial step must be positive: " + s.radialStep);
        double samples = Math.floor((s.upperCut - s.lowerCut) / s.radialStep);
        if (samples > MAX_RADIAL_SAMPLES)
            throw new ArithmeticException("Radial step too small for the cut-off range: " + s.radialStep);
    }

    // --- SPECTRUM ---
    FloatProcessor powerSpectrum(FloatProcessor image) {
        int n = Integer.highestOneBit(image.getWidth());
        ImageProcessor work = image.duplicate();
        if (n != image.getWidth()) {
            work.setInterpolationMethod(ImageProcessor.BILINEAR);
            work = work.resize(n, n);
        }
        work.add(-work.getStatistics().mean);

        FHT fht = new FHT(work);
        fht.transform();
        float[] hp = (float[]) fht.getPixels();

        // Hartley -> power, with the zero frequency moved to the centre
        int half = n / 2;
        float[] ps = new float[n * n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                double a = hp[r * n + c];
                double b = hp[((n - r) % n) * n + (n - c) % n];
                ps[((r + half) % n) * n + (c + half) % n] = (float) ((a * a + b * b) / 2.0);
            }
        }
        return new FloatProcessor(n, n, ps);
    }

    private ImageProcessor logScaled(FloatProcessor spectrum) {
        float[] src = (float[]) spectrum.getPixels();
        float[] dst = new float[src.length];
        for (int i = 0; i < src.length; i++) dst[i] = (float) Math.log1p(src[i]);
        FloatProcessor fp = new FloatProcessor(spectrum.getWidth(), spectrum.getHeight(), dst);
        fp.resetMinAndMax();
        return fp.convertToByteProcessor(true);
    }

    /** Fibre angles of the bin starts, from -90 (inclusive) to 90 (exclusive). */
    static double[] binAngles(double increment) {
        int count = binCount(increment);
        double step = 180.0 / count;
        double[] angles = new double[count];
        for (int i = 0; i < count; i++) angles[i] = -90.0 + i * step;
        return angles;
    }

    private static int binCount(double increment) {
        long count = Math.round(180.0 / increment);
        if (count < 2) throw new ArithmeticException("Angle increment too large: " + increment);
        if (count > MAX_ANGLE_BINS) throw new ArithmeticException("Angle increment too small: " + increment);
        return (int) count;
    }

    private double[] integrate(FloatProcessor spectrum, double[] angles, AnalysisSettings s) {
        int n = spectrum.getWidth();
        double cx = n / 2.0, cy = n / 2.0;
        int steps = (int) Math.floor((s.upperCut - s.lowerCut) / s.radialStep);
        double[] weights = new double[angles.length];
        for (int i = 0; i < angles.length; i++) {
            double phi = Math.toRadians(angles[i] + 90.0);
            double cos = Math.cos(phi), sin = Math.sin(phi);
            double sum = 0;
            for (int j = 0; j <= steps; j++) {
                double r = s.lowerCut + j * s.radialStep;
                if (r <= 0) continue;
                if (r > cx) break;
                sum += spectrum.getInterpolatedValue(cx + r * cos, cy - r * sin) * s.radialStep;
            }
            weights[i] = sum;
        }
        return weights;
    }

    // --- FIT ---
    static final class OrientationFit {
        double mu, kappa, r2, spread, muError;
        double[] density;   // observed, per degree
        double[] fitted;    // von Mises, per degree
    }

    static OrientationFit fit(double[] angles, double[] weights) {
        double step = 180.0 / angles.length;
        double total = 0;
        for (double w : weights) total += w;
        if (!(total > 0))
            throw new ArithmeticException("No spectral power between the cut-off radii");

        double c = 0, s = 0;
        double[] density = new double[angles.length];
        for (int i = 0; i < angles.length; i++) {
            double a = Math.toRadians(2 * angles[i]);
            c += weights[i] * Math.cos(a);
            s += weights[i] * Math.sin(a);
            density[i] = weights[i] / (total * step);
        }
        c /= total;
        s /= total;
        double resultant = Math.hypot(c, s);

        OrientationFit fit = new OrientationFit();
        double mu = Math.toDegrees(Math.atan2(s, c)) / 2.0;
        if (mu >= 90.0) mu -= 180.0;
        fit.mu = mu;
        fit.kappa = kappa(resultant);
        fit.density = density;

        double norm = 180.0 * besselI0Scaled(fit.kappa);
        double mean = 1.0 / 180.0;
        double ssRes = 0, ssTot = 0;
        fit.fitted = new double[angles.length];
        for (int i = 0; i < angles.length; i++) {
            double d = Math.toRadians(2 * (angles[i] - mu));
            fit.fitted[i] = Math.exp(fit.kappa * (Math.cos(d) - 1.0)) / norm;
            ssRes += (density[i] - fit.fitted[i]) * (density[i] - fit.fitted[i]);
            ssTot += (density[i] - mean) * (density[i] - mean);
        }
        if (ssTot == 0)
            throw new ArithmeticException("Orientation distribution is flat, fit is undefined");
        fit.r2 = 1.0 - ssRes / ssTot;

        double rho = Math.max(resultant, 1e-12);
        fit.spread = Math.toDegrees(Math.sqrt(-2.0 * Math.log(rho))) / 2.0;
        fit.muError = fit.spread / Math.sqrt(angles.length);
        return fit;
    }

    /** Inverse of A1 (Best and Fisher approximation), capped. */
    static double kappa(double r) {
        double k;
        if (r < 0.53) k = 2 * r + r * r * r + 5 * Math.pow(r, 5) / 6;
        else if (r < 0.85) k = -0.4 + 1.39 * r + 0.43 / (1 - r);
        else {
            double denom = r * r * r - 4 * r * r + 3 * r;
            k = denom > 0 ? 1.0 / denom : MAX_KAPPA;
        }
        return Math.min(k, MAX_KAPPA);
    }

    /** exp(-x) * I0(x). */
    static double besselI0Scaled(double x) {
        if (x <= 15) {
            double term = 1, sum = 1, q = x * x / 4;
            for (int j = 1; j < 200 && term > 1e-17 * sum; j++) {
                term *= q / ((double) j * j);
                sum += term;
            }
            return sum * Math.exp(-x);
        }
        return (1 + 1 / (8 * x) + 9 / (128 * x * x) + 225 / (3072 * x * x * x)) / Math.sqrt(2 * Math.PI * x);
    }

    // --- PLOTS ---
    private int plotSize(DisplayGeometry g) {
        if (g == null || !g.isKnown()) return DEFAULT_PLOT_SIZE;
        int size = (int) Math.round(Math.min(g.width(), g.height()) * 0.35);
        return Math.max(200, Math.min(800, size));
    }

    private BufferedImage drawCartesian(double[] angles, OrientationFit fit, int size) {
        ColorProcessor cp = new ColorProcessor(size, size);
        cp.setColor(Color.WHITE);
        cp.fill();

        int m = size / 10;
        int left = m, right = size - m, top = m, bottom = size - m;
        double yMax = 0;
        for (int i = 0; i < angles.length; i++) yMax = Math.max(yMax, Math.max(fit.density[i], fit.fitted[i]));
        yMax *= 1.1;

        cp.setColor(Color.LIGHT_GRAY);
        for (int i = 0; i < angles.length; i++) {
            int x = left + (int) ((angles[i] + 90.0) / 180.0 * (right - left));
            int y = bottom - (int) (fit.density[i] / yMax * (bottom - top));
            cp.drawLine(x, bottom, x, y);
        }

        cp.setColor(Color.BLUE);
        cp.setLineWidth(2);
        int px = -1, py = -1;
        for (int i = 0; i < angles.length; i++) {
            int x = left + (int) ((angles[i] + 90.0) / 180.0 * (right - left));
            int y = bottom - (int) (fit.fitted[i] / yMax * (bottom - top));
            if (px >= 0) cp.drawLine(px, py, x, y);
            px = x;
            py = y;
        }

        cp.setColor(Color.RED);
        int xm = left + (int) ((fit.mu + 90.0) / 180.0 * (right - left));
        cp.drawLine(xm, bottom, xm, top);

        cp.setColor(Color.BLACK);
        cp.setLineWidth(1);
        cp.drawLine(left, bottom, right, bottom);
        cp.drawLine(left, bottom, left, top);
        return cp.getBufferedImage();
    }

    private BufferedImage drawRose(double[] angles, OrientationFit fit, int size) {
        ColorProcessor cp = new ColorProcessor(size, size);
        cp.setColor(Color.WHITE);
        cp.fill();

        int cx = size / 2, cy = size / 2;
        int radius = (int) (size * 0.42);
        double max = 0;
        for (double d : fit.density) max = Math.max(max, d);

        cp.setColor(Color.BLACK);
        cp.drawOval(cx - radius, cy - radius, 2 * radius, 2 * radius);

        cp.setColor(Color.DARK_GRAY);
        for (int i = 0; i < angles.length; i++) {
            double len = max > 0 ? radius * fit.density[i] / max : 0;
            double a = Math.toRadians(angles[i]);
            int dx = (int) Math.round(len * Math.cos(a));
            int dy = (int) Math.round(len * Math.sin(a));
            cp.drawLine(cx - dx, cy + dy, cx + dx, cy - dy);
        }

        cp.setColor(Color.RED);
        cp.setLineWidth(2);
        double a = Math.toRadians(fit.mu);
        int dx = (int) Math.round(radius * Math.cos(a));
        int dy = (int) Math.round(radius * Math.sin(a));
        cp.drawLine(cx - dx, cy + dy, cx + dx, cy - dy);
        return cp.getBufferedImage();
    }
}
