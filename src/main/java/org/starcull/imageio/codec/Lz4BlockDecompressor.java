package org.starcull.imageio.codec;

import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;
import org.starcull.imageio.ImageFormatException;

/**
 * LZ4 block decompression (used for both the lz4 and lz4hc codecs, which
 * share a block format).
 *
 * @author tonyj
 */
public class Lz4BlockDecompressor implements BlockDecompressor {

    static final Lz4BlockDecompressor INSTANCE = new Lz4BlockDecompressor();

    private final LZ4SafeDecompressor decompressor;

    Lz4BlockDecompressor() {
        decompressor = LZ4Factory.fastestInstance().safeDecompressor();
    }

    @Override
    public byte[] decompress(byte[] src, int offset, int length, int uncompressedSize) throws ImageFormatException {
        byte[] result = new byte[uncompressedSize];
        int decompressedLength;
        try {
            decompressedLength = decompressor.decompress(src, offset, length, result, 0, uncompressedSize);
        } catch (LZ4Exception x) {
            throw new ImageFormatException(ImageFormatException.Reason.DECOMPRESSION_FAILED, "Corrupt lz4 block of " + length + " bytes", x);
        }
        if (decompressedLength != uncompressedSize) {
            throw new ImageFormatException(ImageFormatException.Reason.DECOMPRESSION_FAILED,
                    "lz4 block inflated to " + decompressedLength + " bytes, expected " + uncompressedSize);
        }
        return result;
    }
}
