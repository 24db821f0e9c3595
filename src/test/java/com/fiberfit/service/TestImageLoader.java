package com.fiberfit.service;

import static com.fiberfit.service.SampleImages.stripes;
import static com.fiberfit.service.SampleImages.writePng;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import nom.tam.fits.Fits;
import nom.tam.util.BufferedFile;

public class TestImageLoader {

    @TempDir
    Path dir;

    private final ImageLoader loader = new ImageLoader();

    @Test
    public void test_grayPng() throws Exception {
        var img = stripes(16, true);
        var fp = loader.load(writePng(img, dir.resolve("g.png")));
        assertEquals(16, fp.getWidth());
        assertEquals(16, fp.getHeight());
        assertEquals(img.getRaster().getSample(3, 5, 0), fp.getf(3, 5), 0);
    }

    @Test
    public void test_grayPalettePng() throws Exception {
        byte[] gray = new byte[256];
        for (int i = 0; i < 256; i++) gray[i] = (byte)(255 - i);
        var icm = new IndexColorModel(8, 256, gray, gray, gray);
        var img = new BufferedImage(8, 8, BufferedImage.TYPE_BYTE_INDEXED, icm);
        img.getRaster().setSample(1, 2, 0, 10);

        var fp = loader.load(writePng(img, dir.resolve("p.png")));
        assertEquals(245, fp.getf(1, 2), 0);
        assertEquals(255, fp.getf(0, 0), 0);
    }

    @Test
    public void test_colourPngIsRejected() throws Exception {
        Path file = writePng(new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB), dir.resolve("c.png"));
        var e = assertThrows(UnsupportedImageException.class, () -> loader.load(file));
        assertEquals(file, e.getFile());
    }

    @Test
    public void test_sixteenBitPngIsRejected() throws Exception {
        Path file = writePng(new BufferedImage(8, 8, BufferedImage.TYPE_USHORT_GRAY), dir.resolve("u16.png"));
        assertThrows(UnsupportedImageException.class, () -> loader.load(file));
    }

    @Test
    public void test_textFileIsRejected() throws Exception {
        Path file = Files.write(dir.resolve("notes.png"), "not an image".getBytes(StandardCharsets.UTF_8));
        assertThrows(UnsupportedImageException.class, () -> loader.load(file));
    }

    @Test
    public void test_fitsFloatImage() throws Exception {
        float[][] data = new float[4][6];
        for (int y = 0; y < 4; y++)
            for (int x = 0; x < 6; x++)
                data[y][x] = y * 10 + x + 0.5f;
        Path file = dir.resolve("img.fits");
        try (Fits fits = new Fits(); BufferedFile out = new BufferedFile(file.toFile(), "rw")) {
            fits.addHDU(Fits.makeHDU(data));
            fits.write(out);
        }

        var fp = loader.load(file);
        assertEquals(6, fp.getWidth());
        assertEquals(4, fp.getHeight());
        assertEquals(25.5f, fp.getf(5, 2), 0);
    }

    @Test
    public void test_fitsShortImageIsUnsigned() throws Exception {
        short[][] data = {{(short)0xFFFF, 1}, {2, 3}};
        Path file = dir.resolve("img.fit");
        try (Fits fits = new Fits(); BufferedFile out = new BufferedFile(file.toFile(), "rw")) {
            fits.addHDU(Fits.makeHDU(data));
            fits.write(out);
        }
        assertEquals(65535, loader.load(file).getf(0, 0), 0);
    }
}
