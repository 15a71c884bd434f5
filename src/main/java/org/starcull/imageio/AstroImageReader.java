package org.starcull.imageio;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.stream.ImageInputStream;
import org.starcull.imageio.ImageFormatException.Reason;
import org.starcull.imageio.scale.ToneMapper;

/**
 * Image I/O reader for XISF and FITS files. The whole input is decoded once
 * per {@link #setInput} and tone-mapped according to the
 * {@link ToneMapReadParam} given to {@link #read(int, ImageReadParam)}.
 *
 * @author tonyj
 */
public class AstroImageReader extends ImageReader {

    private static final Logger LOG = Logger.getLogger(AstroImageReader.class.getName());
    private static final int BUFFER_SIZE = 64 * 1024;

    private final ToneMapper toneMapper = new ToneMapper();
    private DecodedImage decoded;

    public AstroImageReader(ImageReaderSpi originatingProvider) {
        super(originatingProvider);
    }

    @Override
    public void setInput(Object input, boolean seekForwardOnly, boolean ignoreMetadata) {
        super.setInput(input, seekForwardOnly, ignoreMetadata);
        decoded = null;
        toneMapper.reset();
    }

    @Override
    public void reset() {
        super.reset();
        decoded = null;
        toneMapper.reset();
    }

    @Override
    public ToneMapReadParam getDefaultReadParam() {
        return new ToneMapReadParam();
    }

    @Override
    public int getNumImages(boolean allowSearch) throws IOException {
        return 1;
    }

    @Override
    public int getWidth(int imageIndex) throws IOException {
        checkIndex(imageIndex);
        return load().getWidth();
    }

    @Override
    public int getHeight(int imageIndex) throws IOException {
        checkIndex(imageIndex);
        return load().getHeight();
    }

    @Override
    public Iterator<ImageTypeSpecifier> getImageTypes(int imageIndex) throws IOException {
        checkIndex(imageIndex);
        int type = load().getChannels() == 1 ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_3BYTE_BGR;
        return Collections.singleton(ImageTypeSpecifier.createFromBufferedImageType(type)).iterator();
    }

    @Override
    public IIOMetadata getStreamMetadata() throws IOException {
        return null;
    }

    @Override
    public IIOMetadata getImageMetadata(int imageIndex) throws IOException {
        return null;
    }

    @Override
    public BufferedImage read(int imageIndex, ImageReadParam param) throws IOException {
        checkIndex(imageIndex);
        DecodedImage image = load();
        ToneMapReadParam toneMapParam = param instanceof ToneMapReadParam ? (ToneMapReadParam) param : getDefaultReadParam();
        processImageStarted(imageIndex);
        BufferedImage full = toneMapper.apply(image, toneMapParam.getParameters());
        BufferedImage result = full;
        if (param != null && (param.getSourceXSubsampling() > 1 || param.getSourceYSubsampling() > 1
                || param.getSubsamplingXOffset() > 0 || param.getSubsamplingYOffset() > 0)) {
            result = subsample(full, param.getSourceXSubsampling(), param.getSourceYSubsampling(),
                    param.getSubsamplingXOffset(), param.getSubsamplingYOffset());
        }
        processImageComplete();
        return result;
    }

    static BufferedImage subsample(BufferedImage source, int xStep, int yStep, int xOffset, int yOffset) {
        int width = Math.max(1, (source.getWidth() - xOffset + xStep - 1) / xStep);
        int height = Math.max(1, (source.getHeight() - yOffset + yStep - 1) / yStep);
        BufferedImage result = new BufferedImage(width, height, source.getType());
        WritableRaster in = source.getRaster();
        WritableRaster out = result.getRaster();
        Object pixel = null;
        for (int y = 0; y < height; y++) {
            int sy = Math.min(source.getHeight() - 1, yOffset + y * yStep);
            for (int x = 0; x < width; x++) {
                int sx = Math.min(source.getWidth() - 1, xOffset + x * xStep);
                pixel = in.getDataElements(sx, sy, pixel);
                out.setDataElements(x, y, pixel);
            }
        }
        return result;
    }

    private DecodedImage load() throws IOException {
        if (decoded == null) {
            if (!(getInput() instanceof ImageInputStream)) {
                throw new IllegalStateException("No input set");
            }
            ImageInputStream in = (ImageInputStream) getInput();
            byte[] bytes = Timed.execute(() -> readAll(in), "Reading input took %dms");
            FormatKind kind = FormatKind.sniff(bytes).orElseThrow(()
                    -> new ImageFormatException(Reason.UNSUPPORTED_FILE_TYPE, "Input is neither XISF nor FITS"));
            LOG.log(Level.FINE, "Decoding {0} bytes of {1}", new Object[]{bytes.length, kind});
            decoded = ImageDecoder.decode(bytes, kind);
        }
        return decoded;
    }

    private static byte[] readAll(ImageInputStream in) throws IOException {
        in.seek(0);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[BUFFER_SIZE];
        for (;;) {
            int l = in.read(buffer);
            if (l < 0) {
                break;
            }
            out.write(buffer, 0, l);
        }
        return out.toByteArray();
    }

    private void checkIndex(int imageIndex) {
        if (imageIndex != 0) {
            throw new IndexOutOfBoundsException("Only image 0 is available: " + imageIndex);
        }
    }
}
