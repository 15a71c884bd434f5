package org.starcull.imageio;

import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import javax.imageio.ImageReader;
import javax.imageio.spi.ImageReaderSpi;
import javax.imageio.stream.ImageInputStream;

/**
 *
 * @author tonyj
 */
public class AstroImageReaderSpi extends ImageReaderSpi {

    private static final int SIGNATURE_LENGTH = 16;

    public AstroImageReaderSpi() {
        super("StarCull", "1.0-SNAPSHOT", new String[]{"XISF", "FITS"}, new String[]{"xisf", "xifs", "fits", "fit", "fts"},
                new String[]{"image/xisf", "image/fits"},
                AstroImageReader.class.getName(),
                new Class[]{ImageInputStream.class}, null, false, null, null, null, null, false,
                null, null, null, null);
    }

    @Override
    public boolean canDecodeInput(Object source) throws IOException {
        if (!(source instanceof ImageInputStream)) {
            return false;
        }
        ImageInputStream in = (ImageInputStream) source;
        byte[] prefix = new byte[SIGNATURE_LENGTH];
        in.mark();
        try {
            int n = 0;
            while (n < prefix.length) {
                int l = in.read(prefix, n, prefix.length - n);
                if (l < 0) {
                    break;
                }
                n += l;
            }
            if (n < prefix.length) {
                prefix = Arrays.copyOf(prefix, n);
            }
        } finally {
            in.reset();
        }
        return FormatKind.sniff(prefix).isPresent();
    }

    @Override
    public ImageReader createReaderInstance(Object extension) throws IOException {
        return new AstroImageReader(this);
    }

    @Override
    public String getDescription(Locale locale) {
        return "XISF and FITS astronomical image";
    }
}
