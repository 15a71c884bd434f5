package org.starcull.imageio.codec;

import java.util.zip.DataFormatException;
import java.util.zip.Inflater;
import org.starcull.imageio.ImageFormatException;

/**
 * zlib block decompression.
 *
 * @author tonyj
 */
public class ZlibBlockDecompressor implements BlockDecompressor {

    @Override
    public byte[] decompress(byte[] src, int offset, int length, int uncompressedSize) throws ImageFormatException {
        // Inflater is not thread safe, so one is created for every block
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(src, offset, length);
            byte[] result = new byte[uncompressedSize];
            int p = 0;
            while (!inflater.finished() && p < result.length) {
                int l = inflater.inflate(result, p, result.length - p);
                if (l == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                p += l;
            }
            // Oversized output shows up as extra bytes after the declared size
            int extra = 0;
            if (!inflater.finished() && p == result.length) {
                extra = inflater.inflate(new byte[1]);
            }
            if (!inflater.finished() || extra > 0 || p != uncompressedSize) {
                throw new ImageFormatException(ImageFormatException.Reason.DECOMPRESSION_FAILED,
                        "zlib block inflated to " + (p + extra) + (inflater.finished() ? "" : "+") + " bytes, expected " + uncompressedSize);
            }
            return result;
        } catch (DataFormatException x) {
            throw new ImageFormatException(ImageFormatException.Reason.DECOMPRESSION_FAILED, "Corrupt zlib block of " + length + " bytes", x);
        } finally {
            inflater.end();
        }
    }
}
