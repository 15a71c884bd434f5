package org.starcull.imageio.codec;

import org.starcull.imageio.ImageFormatException;

/**
 * Reverses one block compression codec.
 *
 * @author tonyj
 */
public interface BlockDecompressor {

    /**
     * Decompress a block into exactly {@code uncompressedSize} bytes.
     *
     * @param src The buffer holding the compressed block
     * @param offset Offset of the block within src
     * @param length Length of the compressed block
     * @param uncompressedSize The declared uncompressed size
     * @return The decompressed bytes, exactly uncompressedSize long
     * @throws ImageFormatException with reason DECOMPRESSION_FAILED if the
     * block is corrupt or does not inflate to the declared size
     */
    byte[] decompress(byte[] src, int offset, int length, int uncompressedSize) throws ImageFormatException;

    /**
     * Find the decompressor for an XISF codec name.
     *
     * @param codec The codec, as in {@link CompressionDescriptor#getCodec()}
     * @return The decompressor
     * @throws ImageFormatException If the codec is not supported
     */
    static BlockDecompressor forCodec(String codec) throws ImageFormatException {
        switch (codec) {
            case "lz4":
            case "lz4hc":
                return Lz4BlockDecompressor.INSTANCE;
            case "zlib":
                return new ZlibBlockDecompressor();
            default:
                throw new ImageFormatException(ImageFormatException.Reason.DECOMPRESSION_FAILED, "Unsupported compression codec: " + codec);
        }
    }
}
