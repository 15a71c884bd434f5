package org.starcull.imageio.fits;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import nom.tam.fits.FitsException;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.starcull.imageio.FormatKind;
import org.starcull.imageio.RawImage;

/**
 *
 * @author tonyj
 */
public class FitsImageLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testShortImage() throws IOException, FitsException {
        short[][] data = {{1, 2, 3}, {4, 5, 6}};
        Path path = FitsTestFiles.write(folder.getRoot().toPath().resolve("light.fits"), data);
        RawImage raw = FitsImageLoader.read(path);
        assertEquals(FormatKind.FITS, raw.getFormat());
        assertEquals(3, raw.getWidth());
        assertEquals(2, raw.getHeight());
        assertEquals(1, raw.getChannels());
        assertArrayEquals(new float[]{1, 2, 3, 4, 5, 6}, raw.getSamples(), 0f);
    }

    @Test
    public void testFloatImageFromBytes() throws IOException, FitsException {
        float[][] data = {{0.5f, Float.NaN}, {-1f, 2f}};
        Path path = FitsTestFiles.write(folder.getRoot().toPath().resolve("float.fits"), data);
        RawImage raw = FitsImageLoader.read(Files.readAllBytes(path));
        float[] samples = raw.getSamples();
        assertEquals(0.5f, samples[0], 0f);
        assertTrue(Float.isNaN(samples[1]));
        assertEquals(-1f, samples[2], 0f);
        assertEquals(2f, samples[3], 0f);
    }

    @Test
    public void testColourPlanes() throws IOException, FitsException {
        int[][][] data = new int[3][2][4];
        for (int c = 0; c < 3; c++) {
            for (int y = 0; y < 2; y++) {
                for (int x = 0; x < 4; x++) {
                    data[c][y][x] = 100 * c + 10 * y + x;
                }
            }
        }
        Path path = FitsTestFiles.write(folder.getRoot().toPath().resolve("rgb.fits"), data);
        RawImage raw = FitsImageLoader.read(path);
        assertEquals(4, raw.getWidth());
        assertEquals(2, raw.getHeight());
        assertEquals(3, raw.getChannels());
        // channel 2, row 1, column 3
        assertEquals(213f, raw.getSamples()[2 * 8 + 1 * 4 + 3], 0f);
    }

    @Test
    public void testNotFits() throws IOException {
        Path path = folder.newFile("junk.fits").toPath();
        Files.write(path, new byte[]{'n', 'o', 't', ' ', 'f', 'i', 't', 's'});
        try {
            RawImage raw = FitsImageLoader.read(path);
            fail("should not reach here: " + raw);
        } catch (IOException x) {
            // expected
        }
    }
}
