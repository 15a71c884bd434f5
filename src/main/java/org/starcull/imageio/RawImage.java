package org.starcull.imageio;

/**
 * Raw (un-normalized) sample values read from one exposure, stored channel
 * planar: all of channel 0 row by row, then channel 1, and so on.
 *
 * @author tonyj
 */
public class RawImage {

    private final FormatKind format;
    private final int width;
    private final int height;
    private final int channels;
    private final float[] samples;

    public RawImage(FormatKind format, int width, int height, int channels, float[] samples) {
        if (samples.length != (long) width * height * channels) {
            throw new IllegalArgumentException("Sample count " + samples.length + " does not match " + width + "x" + height + "x" + channels);
        }
        this.format = format;
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.samples = samples;
    }

    public FormatKind getFormat() {
        return format;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    /**
     * The backing sample array. Only the normalization step reads it.
     * @return The samples
     */
    public float[] getSamples() {
        return samples;
    }

    @Override
    public String toString() {
        return "RawImage{" + "format=" + format + ", width=" + width + ", height=" + height + ", channels=" + channels + '}';
    }
}
