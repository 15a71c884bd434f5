package org.starcull.imageio.xisf;

import org.starcull.imageio.codec.CompressionDescriptor;

/**
 * The parsed description of the image stored in an XISF file.
 *
 * @author tonyj
 */
public class XisfHeader {

    private final int width;
    private final int height;
    private final int channels;
    private final SampleFormat sampleFormat;
    private final CompressionDescriptor compression;
    private final int shuffleItemSize;
    private final long dataOffset;
    private final long compressedSize;
    private final long uncompressedSize;
    private final String rawMetadataText;

    XisfHeader(int width, int height, int channels, SampleFormat sampleFormat, CompressionDescriptor compression,
            int shuffleItemSize, long dataOffset, long compressedSize, long uncompressedSize, String rawMetadataText) {
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.sampleFormat = sampleFormat;
        this.compression = compression;
        this.shuffleItemSize = shuffleItemSize;
        this.dataOffset = dataOffset;
        this.compressedSize = compressedSize;
        this.uncompressedSize = uncompressedSize;
        this.rawMetadataText = rawMetadataText;
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

    public SampleFormat getSampleFormat() {
        return sampleFormat;
    }

    public CompressionDescriptor getCompression() {
        return compression;
    }

    public int getShuffleItemSize() {
        return shuffleItemSize;
    }

    public long getDataOffset() {
        return dataOffset;
    }

    /**
     * @return The number of bytes stored in the file for the pixel data
     */
    public long getCompressedSize() {
        return compressedSize;
    }

    public long getUncompressedSize() {
        return uncompressedSize;
    }

    /**
     * @return Size in bytes of the raw samples implied by the geometry
     */
    public long getImageSize() {
        return (long) width * height * channels * sampleFormat.getBytesPerSample();
    }

    /**
     * The XML header exactly as found in the file, from the XML declaration
     * up to and including the closing xisf tag.
     *
     * @return The metadata text
     */
    public String getRawMetadataText() {
        return rawMetadataText;
    }

    @Override
    public String toString() {
        return "XisfHeader{" + "geometry=" + width + ":" + height + ":" + channels + ", sampleFormat=" + sampleFormat
                + ", compression=" + compression + ", dataOffset=" + dataOffset + ", compressedSize=" + compressedSize
                + ", uncompressedSize=" + uncompressedSize + '}';
    }
}
