package org.starcull.imageio;

import java.nio.FloatBuffer;

/**
 * A decoded exposure with every sample normalized to [0,1] using the file's
 * own minimum and maximum. Instances are never modified after creation, if
 * the display parameters change a new tone-mapped raster is computed instead.
 *
 * @author tonyj
 */
public class DecodedImage {

    private final FormatKind format;
    private final int width;
    private final int height;
    private final int channels;
    private final float[] samples;

    /**
     * Create a decoded image. The sample array is owned by the new instance.
     *
     * @param format The container format the samples came from
     * @param width The width in pixels
     * @param height The height in pixels
     * @param channels The number of channel planes
     * @param samples Normalized samples, channel planar
     */
    public DecodedImage(FormatKind format, int width, int height, int channels, float[] samples) {
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

    public int getSampleCount() {
        return samples.length;
    }

    public float getSample(int x, int y) {
        return getSample(x, y, 0);
    }

    public float getSample(int x, int y, int channel) {
        return samples[channel * width * height + y * width + x];
    }

    /**
     * Read only view of all samples, channel planar.
     *
     * @return The view
     */
    public FloatBuffer asReadOnlyBuffer() {
        return FloatBuffer.wrap(samples).asReadOnlyBuffer();
    }

    /**
     * Copy the samples of one channel into the given array.
     *
     * @param channel The channel
     * @param dest The destination, at least width*height long
     */
    public void copyChannel(int channel, float[] dest) {
        System.arraycopy(samples, channel * width * height, dest, 0, width * height);
    }

    @Override
    public String toString() {
        return "DecodedImage{" + "format=" + format + ", width=" + width + ", height=" + height + ", channels=" + channels + '}';
    }
}
