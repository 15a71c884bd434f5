package org.starcull.imageio.xisf;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.ShortBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.starcull.imageio.FormatKind;
import org.starcull.imageio.ImageFormatException;
import org.starcull.imageio.ImageFormatException.Reason;
import org.starcull.imageio.RawImage;
import org.starcull.imageio.codec.PayloadDecoder;

/**
 * Reads the raw samples of an XISF file. Only the header and the image
 * attachment are read from disk.
 *
 * @author tonyj
 */
public class XisfReader {

    private XisfReader() {
    }

    public static RawImage read(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            XisfHeader header = XisfHeaderParser.parse(XisfHeaderParser.readHeaderBytes(channel));
            checkAttachment(header, channel.size());
            ByteBuffer bb = ByteBuffer.allocate((int) header.getCompressedSize());
            XisfHeaderParser.readFully(channel, bb, header.getDataOffset());
            return toRawImage(header, bb.array(), 0);
        }
    }

    /**
     * Read from a complete in-memory copy of the file.
     *
     * @param fileBytes The whole file
     * @return The raw image
     * @throws ImageFormatException If the file is invalid
     */
    public static RawImage read(byte[] fileBytes) throws ImageFormatException {
        XisfHeader header = XisfHeaderParser.parse(fileBytes);
        checkAttachment(header, fileBytes.length);
        return toRawImage(header, fileBytes, (int) header.getDataOffset());
    }

    private static void checkAttachment(XisfHeader header, long fileSize) throws ImageFormatException {
        if (header.getCompressedSize() > Integer.MAX_VALUE) {
            throw new ImageFormatException(Reason.SIZE_MISMATCH, "Attachment too large: " + header.getCompressedSize());
        }
        if (header.getDataOffset() + header.getCompressedSize() > fileSize) {
            throw new ImageFormatException(Reason.SIZE_MISMATCH, "Attachment " + header.getDataOffset() + ":" + header.getCompressedSize()
                    + " extends past end of file (" + fileSize + " bytes)");
        }
    }

    private static RawImage toRawImage(XisfHeader header, byte[] src, int offset) throws ImageFormatException {
        byte[] data = PayloadDecoder.decode(src, offset, (int) header.getCompressedSize(), header.getCompression(),
                header.getUncompressedSize(), header.getShuffleItemSize(), header.getImageSize());
        ShortBuffer shorts = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN).asShortBuffer();
        float[] samples = new float[shorts.remaining()];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = shorts.get(i) & 0xffff;
        }
        return new RawImage(FormatKind.XISF, header.getWidth(), header.getHeight(), header.getChannels(), samples);
    }
}
