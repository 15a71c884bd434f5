package org.starcull.imageio;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The container formats understood by the reader. The kind is chosen once per
 * file and passed along the decode path.
 *
 * @author tonyj
 */
public enum FormatKind {

    XISF("xisf", "xifs"),
    FITS("fits", "fit", "fts");

    private static final byte[] XISF_SIGNATURE = "XISF0100".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] FITS_SIGNATURE = "SIMPLE  =".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] XML_START = "<?xml".getBytes(StandardCharsets.US_ASCII);

    private final List<String> suffixes;

    FormatKind(String... suffixes) {
        this.suffixes = Collections.unmodifiableList(Arrays.asList(suffixes));
    }

    public List<String> getSuffixes() {
        return suffixes;
    }

    public static Optional<FormatKind> forPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String suffix = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (FormatKind kind : values()) {
            if (kind.suffixes.contains(suffix)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static FormatKind of(Path path) throws ImageFormatException {
        return forPath(path).orElseThrow(()
                -> new ImageFormatException(ImageFormatException.Reason.UNSUPPORTED_FILE_TYPE, "Unsupported file type: " + path));
    }

    /**
     * Identify the format from the first bytes of a file.
     *
     * @param prefix The leading bytes (at least 9 for a reliable answer)
     * @return The format, or empty if neither signature matches
     */
    public static Optional<FormatKind> sniff(byte[] prefix) {
        if (startsWith(prefix, XISF_SIGNATURE) || startsWith(prefix, XML_START)) {
            return Optional.of(XISF);
        } else if (startsWith(prefix, FITS_SIGNATURE)) {
            return Optional.of(FITS);
        }
        return Optional.empty();
    }

    private static boolean startsWith(byte[] data, byte[] signature) {
        if (data.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if (data[i] != signature[i]) {
                return false;
            }
        }
        return true;
    }
}
