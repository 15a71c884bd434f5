package org.starcull.imageio.fits;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.lang.reflect.Array;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.ImageHDU;
import nom.tam.fits.header.Standard;
import nom.tam.image.compression.hdu.CompressedImageHDU;
import org.starcull.imageio.FormatKind;
import org.starcull.imageio.ImageFormatException;
import org.starcull.imageio.ImageFormatException.Reason;
import org.starcull.imageio.RawImage;

/**
 * Reads the pixel data of the first HDU of a FITS file which carries image
 * data. Integer data is scaled with BZERO/BSCALE, floating point data is read
 * as is (NaN included).
 *
 * @author tonyj
 */
public class FitsImageLoader {

    private static final Logger LOG = Logger.getLogger(FitsImageLoader.class.getName());

    static {
        FitsFactory.setUseHierarch(true);
    }

    private FitsImageLoader() {
    }

    public static RawImage read(Path path) throws IOException {
        try (Fits fits = new Fits(path.toFile())) {
            return read(fits, path.toString());
        } catch (FitsException x) {
            throw new ImageFormatException(Reason.MALFORMED_CONTAINER, "Invalid FITS file " + path + ": " + x.getMessage(), x);
        }
    }

    public static RawImage read(byte[] fileBytes) throws IOException {
        try (Fits fits = new Fits(new ByteArrayInputStream(fileBytes))) {
            return read(fits, "<memory>");
        } catch (FitsException x) {
            throw new ImageFormatException(Reason.MALFORMED_CONTAINER, "Invalid FITS data: " + x.getMessage(), x);
        }
    }

    private static RawImage read(Fits fits, String name) throws IOException, FitsException {
        BasicHDU<?>[] hdus = fits.read();
        if (hdus != null) {
            for (int i = 0; i < hdus.length; i++) {
                BasicHDU<?> hdu = hdus[i];
                if (hdu instanceof CompressedImageHDU) {
                    hdu = ((CompressedImageHDU) hdu).asImageHDU();
                } else if (!(hdu instanceof ImageHDU)) {
                    continue;
                }
                Object kernel = hdu.getKernel();
                if (kernel instanceof Object[] && ((Object[]) kernel).length > 0) {
                    LOG.log(Level.FINE, "Reading image data from HDU {0} of {1}", new Object[]{i, name});
                    return toRawImage(hdu.getHeader(), (Object[]) kernel);
                }
            }
        }
        throw new ImageFormatException(Reason.MALFORMED_CONTAINER, "No image data found in FITS file " + name);
    }

    private static RawImage toRawImage(Header header, Object[] kernel) throws ImageFormatException {
        double bzero = header.getDoubleValue(Standard.BZERO, 0.0);
        double bscale = header.getDoubleValue(Standard.BSCALE, 1.0);
        Object[][] planes;
        if (kernel[0] instanceof Object[]) {
            // NAXIS=3, one plane per channel
            planes = new Object[kernel.length][];
            for (int c = 0; c < kernel.length; c++) {
                if (!(kernel[c] instanceof Object[])) {
                    throw new ImageFormatException(Reason.UNSUPPORTED_CHANNEL_LAYOUT, "Only 2 or 3 dimensional FITS images are supported");
                }
                Object[] plane = (Object[]) kernel[c];
                if (plane.length == 0 || plane[0] instanceof Object[]) {
                    throw new ImageFormatException(Reason.UNSUPPORTED_CHANNEL_LAYOUT, "Only 2 or 3 dimensional FITS images are supported");
                }
                planes[c] = plane;
            }
        } else {
            planes = new Object[][]{kernel};
        }
        int channels = planes.length;
        int height = planes[0].length;
        int width = Array.getLength(planes[0][0]);
        if (width == 0) {
            throw new ImageFormatException(Reason.INVALID_GEOMETRY, "FITS image has zero width");
        }
        float[] samples = new float[channels * height * width];
        int p = 0;
        for (Object[] plane : planes) {
            if (plane.length != height) {
                throw new ImageFormatException(Reason.SIZE_MISMATCH, "FITS planes differ in height");
            }
            for (Object row : plane) {
                copyRow(row, samples, p, width, bzero, bscale);
                p += width;
            }
        }
        return new RawImage(FormatKind.FITS, width, height, channels, samples);
    }

    private static void copyRow(Object row, float[] out, int offset, int width, double bzero, double bscale) throws ImageFormatException {
        if (row == null || Array.getLength(row) != width) {
            throw new ImageFormatException(Reason.SIZE_MISMATCH, "FITS rows differ in width");
        }
        if (row instanceof byte[]) {
            byte[] b = (byte[]) row;
            // BITPIX=8 is unsigned
            for (int x = 0; x < width; x++) {
                out[offset + x] = (float) (bzero + bscale * (b[x] & 0xff));
            }
        } else if (row instanceof short[]) {
            short[] s = (short[]) row;
            for (int x = 0; x < width; x++) {
                out[offset + x] = (float) (bzero + bscale * s[x]);
            }
        } else if (row instanceof int[]) {
            int[] i = (int[]) row;
            for (int x = 0; x < width; x++) {
                out[offset + x] = (float) (bzero + bscale * i[x]);
            }
        } else if (row instanceof long[]) {
            long[] l = (long[]) row;
            for (int x = 0; x < width; x++) {
                out[offset + x] = (float) (bzero + bscale * l[x]);
            }
        } else if (row instanceof float[]) {
            float[] f = (float[]) row;
            for (int x = 0; x < width; x++) {
                out[offset + x] = (float) (bzero + bscale * f[x]);
            }
        } else if (row instanceof double[]) {
            double[] d = (double[]) row;
            for (int x = 0; x < width; x++) {
                out[offset + x] = (float) (bzero + bscale * d[x]);
            }
        } else {
            throw new ImageFormatException(Reason.UNSUPPORTED_SAMPLE_FORMAT, "Unsupported FITS data type: " + row.getClass().getSimpleName());
        }
    }
}
