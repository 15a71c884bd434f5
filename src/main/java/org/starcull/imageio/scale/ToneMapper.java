package org.starcull.imageio.scale;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.starcull.imageio.DecodedImage;
import org.starcull.imageio.ImageFormatException;
import org.starcull.imageio.ImageFormatException.Reason;
import org.starcull.imageio.Timed;

/**
 * Turns a normalized image into an 8 bit raster for display. The mapper
 * remembers the last image and parameters it was asked for, so repeated
 * requests (for example a slider released at the value it started from) do
 * not recompute anything. Not thread safe, it belongs to the interactive
 * path.
 *
 * @author tonyj
 */
public class ToneMapper {

    private static final Logger LOG = Logger.getLogger(ToneMapper.class.getName());

    private DecodedImage lastImage;
    private ToneMapParameters lastParameters;
    private BufferedImage lastResult;
    private float[] scratch;
    private int recomputeCount;

    /**
     * Tone-map an image. The returned image must not be modified by the
     * caller since it may be handed out again for the same request.
     *
     * @param image The normalized image
     * @param parameters The display parameters
     * @return An 8 bit grey or BGR image
     * @throws ImageFormatException If the image has neither 1 nor 3 channels
     */
    public BufferedImage apply(DecodedImage image, ToneMapParameters parameters) throws ImageFormatException {
        if (image == lastImage && parameters.isCloseTo(lastParameters)) {
            LOG.log(Level.FINE, "Reusing tone-mapped image for {0}", parameters);
            return lastResult;
        }
        checkChannels(image.getChannels());
        if (scratch == null || scratch.length != image.getSampleCount()) {
            scratch = new float[image.getSampleCount()];
        }
        float[] out = scratch;
        image.asReadOnlyBuffer().get(out);
        Timed.compute(() -> {
            transform(out, out, parameters);
            return null;
        }, "Tone-map of %s with %s took %dms", image, parameters);
        BufferedImage result = rasterize(out, image.getWidth(), image.getHeight(), image.getChannels());
        recomputeCount++;
        lastImage = image;
        lastParameters = parameters;
        lastResult = result;
        return result;
    }

    /**
     * Forget the remembered result, for example when the current file is
     * modified on disk.
     */
    public void reset() {
        lastImage = null;
        lastParameters = null;
        lastResult = null;
    }

    int getRecomputeCount() {
        return recomputeCount;
    }

    /**
     * Apply stretch, gamma, brightness and contrast to every sample. Input and
     * output may be the same array.
     *
     * @param in Normalized samples in [0,1]
     * @param out Destination, at least as long as in
     * @param parameters The display parameters
     */
    public static void transform(float[] in, float[] out, ToneMapParameters parameters) {
        double k = parameters.getStretch();
        double gamma = parameters.getGamma();
        double inverseGamma = 1.0 / gamma;
        double brightness = parameters.getBrightness();
        double contrast = parameters.getContrast();
        for (int i = 0; i < in.length; i++) {
            double v = AsinhStretch.apply(in[i], k);
            if (gamma != 1.0) {
                v = Math.pow(v, inverseGamma);
            }
            v = clip(v * brightness);
            if (contrast != 1.0) {
                v = clip((v - 0.5) * contrast + 0.5);
            }
            out[i] = (float) v;
        }
    }

    /**
     * Convert tone-mapped channel planar samples into an 8 bit image.
     *
     * @param samples Samples in [0,1], channel planar
     * @param width The width
     * @param height The height
     * @param channels 1 for grey, 3 for RGB
     * @return The image
     * @throws ImageFormatException For any other channel count
     */
    public static BufferedImage rasterize(float[] samples, int width, int height, int channels) throws ImageFormatException {
        checkChannels(channels);
        int n = width * height;
        if (channels == 1) {
            BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
            byte[] data = ((DataBufferByte) result.getRaster().getDataBuffer()).getData();
            for (int i = 0; i < n; i++) {
                data[i] = toByte(samples[i]);
            }
            return result;
        } else {
            BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
            byte[] data = ((DataBufferByte) result.getRaster().getDataBuffer()).getData();
            for (int i = 0; i < n; i++) {
                data[3 * i] = toByte(samples[2 * n + i]);
                data[3 * i + 1] = toByte(samples[n + i]);
                data[3 * i + 2] = toByte(samples[i]);
            }
            return result;
        }
    }

    /**
     * The 8 bit value a tone-mapped sample is displayed with.
     *
     * @param t A sample, nominally in [0,1]
     * @return Value in 0..255
     */
    public static int toEightBit(float t) {
        int v = (int) (t * 255);
        return v < 0 ? 0 : v > 255 ? 255 : v;
    }

    private static byte toByte(float t) {
        return (byte) toEightBit(t);
    }

    private static void checkChannels(int channels) throws ImageFormatException {
        if (channels != 1 && channels != 3) {
            throw new ImageFormatException(Reason.UNSUPPORTED_CHANNEL_LAYOUT, "Cannot display an image with " + channels + " channels");
        }
    }

    private static double clip(double v) {
        return v < 0 ? 0 : v > 1 ? 1 : v;
    }
}
