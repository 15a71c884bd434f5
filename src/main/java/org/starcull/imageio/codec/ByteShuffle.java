package org.starcull.imageio.codec;

import org.starcull.imageio.ImageFormatException;

/**
 * Byte plane (un)shuffling of 16 bit samples. A shuffled buffer holds the low
 * byte of every sample followed by the high byte of every sample.
 *
 * @author tonyj
 */
public class ByteShuffle {

    private ByteShuffle() {
    }

    /**
     * Regroup byte planes back into little endian 16 bit samples.
     *
     * @param in The shuffled bytes
     * @return The unshuffled bytes, same length as the input
     * @throws ImageFormatException If the input length is odd
     */
    public static byte[] unshuffle16(byte[] in) throws ImageFormatException {
        checkEven(in);
        int length = in.length / 2;
        byte[] out = new byte[in.length];
        for (int i = 0; i < length; i++) {
            out[2 * i] = in[i];
            out[2 * i + 1] = in[i + length];
        }
        return out;
    }

    /**
     * Split little endian 16 bit samples into a low byte plane followed by a
     * high byte plane.
     *
     * @param in The sample bytes
     * @return The shuffled bytes
     * @throws ImageFormatException If the input length is odd
     */
    public static byte[] shuffle16(byte[] in) throws ImageFormatException {
        checkEven(in);
        int length = in.length / 2;
        byte[] out = new byte[in.length];
        for (int i = 0; i < length; i++) {
            out[i] = in[2 * i];
            out[i + length] = in[2 * i + 1];
        }
        return out;
    }

    private static void checkEven(byte[] in) throws ImageFormatException {
        if (in.length % 2 != 0) {
            throw new ImageFormatException(ImageFormatException.Reason.SIZE_MISMATCH, "Shuffled 16 bit data has odd length " + in.length);
        }
    }
}
