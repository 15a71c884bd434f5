package org.starcull.imageio;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.jpountz.lz4.LZ4Factory;
import org.starcull.imageio.codec.ByteShuffle;

/**
 * Builds small XISF files for tests.
 *
 * @author tonyj
 */
public class XisfTestFiles {

    public static final int DATA_OFFSET = 4096;

    private XisfTestFiles() {
    }

    /**
     * Little endian unsigned 16 bit samples.
     *
     * @param values The sample values
     * @return The bytes
     */
    public static byte[] uint16(int... values) {
        ByteBuffer bb = ByteBuffer.allocate(values.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (int v : values) {
            bb.putShort((short) v);
        }
        return bb.array();
    }

    public static byte[] lz4(byte[] data) {
        return LZ4Factory.fastestInstance().fastCompressor().compress(data);
    }

    /**
     * An XML header with a single Image element.
     *
     * @param imageAttributes Attributes of the Image element
     * @param children Extra XML placed in the root element after the image
     * @return The header text
     */
    public static String header(String imageAttributes, String children) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<xisf version=\"1.0\" xmlns=\"http://www.pixinsight.com/xisf\">\n"
                + "  <Image " + imageAttributes + "/>\n"
                + children
                + "</xisf>";
    }

    /**
     * A complete file: signature, header and the payload at
     * {@link #DATA_OFFSET}.
     *
     * @param xml The header text
     * @param payload The attachment
     * @return The file content
     */
    public static byte[] file(String xml, byte[] payload) {
        byte[] xmlBytes = xml.getBytes(StandardCharsets.UTF_8);
        if (16 + xmlBytes.length > DATA_OFFSET) {
            throw new IllegalArgumentException("Header too long for test file");
        }
        ByteBuffer bb = ByteBuffer.allocate(DATA_OFFSET + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        bb.put("XISF0100".getBytes(StandardCharsets.US_ASCII));
        bb.putInt(xmlBytes.length);
        bb.putInt(0);
        bb.put(xmlBytes);
        bb.position(DATA_OFFSET);
        bb.put(payload);
        return bb.array();
    }

    public static byte[] uncompressed(int width, int height, int channels, int... samples) {
        byte[] payload = uint16(samples);
        String xml = header(String.format("geometry=\"%d:%d:%d\" sampleFormat=\"UInt16\" location=\"attachment:%d:%d\"",
                width, height, channels, DATA_OFFSET, payload.length), "");
        return file(xml, payload);
    }

    public static byte[] lz4Shuffled(int width, int height, int... samples) {
        byte[] raw = uint16(samples);
        byte[] payload;
        try {
            payload = lz4(ByteShuffle.shuffle16(raw));
        } catch (ImageFormatException x) {
            throw new IllegalArgumentException(x);
        }
        String xml = header(String.format("geometry=\"%d:%d:1\" sampleFormat=\"UInt16\" compression=\"lz4+sh:%d:2\" location=\"attachment:%d:%d\"",
                width, height, raw.length, DATA_OFFSET, payload.length), "");
        return file(xml, payload);
    }

    /**
     * A 4x2 image declaring the given compression over a 16 byte attachment
     * of zeros, for files whose compression attribute is broken.
     *
     * @param compression The compression attribute
     * @return The file content
     */
    public static byte[] declaringCompression(String compression) {
        byte[] payload = new byte[16];
        String xml = header(String.format("geometry=\"4:2:1\" sampleFormat=\"UInt16\" compression=\"%s\" location=\"attachment:%d:%d\"",
                compression, DATA_OFFSET, payload.length), "");
        return file(xml, payload);
    }

    /**
     * A gradient image, each sample is x + y.
     *
     * @param width The width
     * @param height The height
     * @return The file content
     */
    public static byte[] gradient(int width, int height) {
        int[] samples = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                samples[y * width + x] = x + y;
            }
        }
        return uncompressed(width, height, 1, samples);
    }

    public static Path write(Path dir, String name, byte[] content) throws IOException {
        Path path = dir.resolve(name);
        Files.write(path, content);
        return path;
    }
}
