package org.starcull.imageio;

import java.io.IOException;
import java.nio.file.Path;
import org.starcull.imageio.ImageFormatException.Reason;
import org.starcull.imageio.fits.FitsImageLoader;
import org.starcull.imageio.scale.Normalizer;
import org.starcull.imageio.xisf.XisfReader;

/**
 * Entry point of the decode path: file to raw samples to normalized image.
 * Every failure is reported as an {@link ImageFormatException}, plain I/O
 * errors with reason {@link Reason#IO_ERROR}.
 *
 * @author tonyj
 */
public class ImageDecoder {

    private ImageDecoder() {
    }

    public static RawImage readRaw(Path path) throws ImageFormatException {
        FormatKind kind = FormatKind.of(path);
        try {
            return switch (kind) {
                case XISF ->
                    XisfReader.read(path);
                case FITS ->
                    FitsImageLoader.read(path);
            };
        } catch (ImageFormatException x) {
            throw x;
        } catch (IOException x) {
            throw new ImageFormatException(Reason.IO_ERROR, "Error reading " + path, x);
        }
    }

    public static RawImage readRaw(byte[] fileBytes, FormatKind kind) throws ImageFormatException {
        try {
            return switch (kind) {
                case XISF ->
                    XisfReader.read(fileBytes);
                case FITS ->
                    FitsImageLoader.read(fileBytes);
            };
        } catch (ImageFormatException x) {
            throw x;
        } catch (IOException x) {
            throw new ImageFormatException(Reason.IO_ERROR, "Error reading " + kind + " data", x);
        }
    }

    public static DecodedImage decode(Path path) throws ImageFormatException {
        try {
            return Timed.execute(() -> Normalizer.normalize(readRaw(path)), "Decoding %s took %dms", path);
        } catch (ImageFormatException x) {
            throw x;
        } catch (IOException x) {
            throw new ImageFormatException(Reason.IO_ERROR, "Error decoding " + path, x);
        }
    }

    public static DecodedImage decode(byte[] fileBytes, FormatKind kind) throws ImageFormatException {
        return Normalizer.normalize(readRaw(fileBytes, kind));
    }
}
