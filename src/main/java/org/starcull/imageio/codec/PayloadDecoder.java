package org.starcull.imageio.codec;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.starcull.imageio.ImageFormatException;

/**
 * Turns the stored bytes of an image attachment back into raw sample bytes,
 * undoing block compression and byte shuffling as described by the
 * compression descriptor.
 *
 * @author tonyj
 */
public class PayloadDecoder {

    private static final Logger LOG = Logger.getLogger(PayloadDecoder.class.getName());
    // Upper bound of the deflate compression ratio, lz4 stays well below it
    private static final long MAX_EXPANSION = 1032;

    private PayloadDecoder() {
    }

    /**
     * Decode one attachment.
     *
     * @param src Buffer holding the stored attachment
     * @param offset Offset of the attachment in src
     * @param length Stored (possibly compressed) length
     * @param descriptor How the attachment was stored
     * @param uncompressedSize The declared size after decompression
     * @param shuffleItemSize Bytes per shuffled item
     * @param expectedSize The size implied by the image geometry
     * @return Raw sample bytes, exactly expectedSize long
     * @throws ImageFormatException If the declared sizes disagree, decompression
     * fails or the result has the wrong size
     */
    public static byte[] decode(byte[] src, int offset, int length, CompressionDescriptor descriptor,
            long uncompressedSize, int shuffleItemSize, long expectedSize) throws ImageFormatException {
        byte[] data;
        if (!descriptor.isCompressed()) {
            data = Arrays.copyOfRange(src, offset, offset + length);
        } else {
            // Checked before anything is allocated for the decompressed block
            if (uncompressedSize != expectedSize) {
                throw new ImageFormatException(ImageFormatException.Reason.DECOMPRESSION_FAILED,
                        "Declared uncompressed size " + uncompressedSize + " does not match geometry size " + expectedSize);
            }
            if (uncompressedSize > Integer.MAX_VALUE) {
                throw new ImageFormatException(ImageFormatException.Reason.SIZE_MISMATCH, "Uncompressed size too large: " + uncompressedSize);
            }
            if (uncompressedSize > (long) length * MAX_EXPANSION) {
                throw new ImageFormatException(ImageFormatException.Reason.DECOMPRESSION_FAILED,
                        "A block of " + length + " bytes cannot inflate to " + uncompressedSize + " bytes");
            }
            BlockDecompressor decompressor = BlockDecompressor.forCodec(descriptor.getCodec());
            data = decompressor.decompress(src, offset, length, (int) uncompressedSize);
            if (descriptor.isShuffled()) {
                if (shuffleItemSize != 2) {
                    LOG.log(Level.FINE, "Shuffle item size {0} treated as 2 byte samples", shuffleItemSize);
                }
                data = ByteShuffle.unshuffle16(data);
            }
        }
        if (data.length != expectedSize) {
            throw new ImageFormatException(ImageFormatException.Reason.SIZE_MISMATCH,
                    "Pixel data is " + data.length + " bytes, geometry requires " + expectedSize);
        }
        return data;
    }
}
