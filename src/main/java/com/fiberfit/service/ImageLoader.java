package com.fiberfit.service;

import ij.process.FloatProcessor;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads one image file into a float processor. FITS files go through nom-tam-fits, the
 * rest through ImageIO, where only 8-bit gray images are accepted.
 */
public class ImageLoader {

    public FloatProcessor load(Path file) throws Exception {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".fits") || name.endsWith(".fit") || name.endsWith(".fts"))
            return loadFits(file);
        return loadRaster(file);
    }

    private FloatProcessor loadRaster(Path file) throws Exception {
        BufferedImage img = ImageIO.read(file.toFile());
        if (img == null)
            throw new UnsupportedImageException(file, "no image reader for this format");

        Raster raster = img.getRaster();
        int w = img.getWidth(), h = img.getHeight();
        if (raster.getNumBands() != 1 || raster.getSampleModel().getSampleSize(0) != 8)
            throw new UnsupportedImageException(file, "image must have 8-bit depth, got "
                    + raster.getNumBands() + " band(s) of " + raster.getSampleModel().getSampleSize(0) + " bit");

        int[] lut = grayLut(file, img);
        float[] px = new float[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int v = raster.getSample(x, y, 0);
                px[y * w + x] = lut == null ? v : lut[v];
            }
        }
        return new FloatProcessor(w, h, px);
    }

    // Palette images are accepted only when every entry is a shade of gray
    private int[] grayLut(Path file, BufferedImage img) throws UnsupportedImageException {
        if (!(img.getColorModel() instanceof IndexColorModel)) {
            if (img.getColorModel().getNumColorComponents() != 1)
                throw new UnsupportedImageException(file, "image is not in gray color space");
            return null;
        }
        IndexColorModel icm = (IndexColorModel) img.getColorModel();
        int[] lut = new int[256];
        for (int i = 0; i < icm.getMapSize(); i++) {
            int r = icm.getRed(i), g = icm.getGreen(i), b = icm.getBlue(i);
            if (r != g || g != b)
                throw new UnsupportedImageException(file, "palette image is not gray");
            lut[i] = r;
        }
        return lut;
    }

    private FloatProcessor loadFits(Path file) throws Exception {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null)
                throw new UnsupportedImageException(file, "FITS file has no primary HDU");
            Object kernel = hdu.getKernel();
            float[][] data = toFloat(kernel);
            if (data == null || data.length == 0 || data[0].length == 0)
                throw new UnsupportedImageException(file, "FITS data is not a 2D image");

            int h = data.length, w = data[0].length;
            float[] px = new float[w * h];
            for (int y = 0; y < h; y++)
                for (int x = 0; x < w; x++)
                    px[y * w + x] = data[y][x];
            return new FloatProcessor(w, h, px);
        }
    }

    private float[][] toFloat(Object k) {
        if (k instanceof byte[][]) {
            byte[][] b = (byte[][]) k;
            float[][] f = new float[b.length][b[0].length];
            for (int i = 0; i < b.length; i++) for (int j = 0; j < b[0].length; j++) f[i][j] = b[i][j] & 0xFF;
            return f;
        }
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            float[][] f = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) f[i][j] = s[i][j] & 0xFFFF;
            return f;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            float[][] f = new float[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) f[i][j] = s[i][j];
            return f;
        }
        if (k instanceof float[][]) {
            return (float[][]) k;
        }
        if (k instanceof double[][]) {
            double[][] d = (double[][]) k;
            float[][] f = new float[d.length][d[0].length];
            for (int i = 0; i < d.length; i++) for (int j = 0; j < d[0].length; j++) f[i][j] = (float) d[i][j];
            return f;
        }
        return null;
    }
}
