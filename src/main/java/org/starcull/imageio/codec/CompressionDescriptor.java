package org.starcull.imageio.codec;

import java.util.Locale;
import java.util.Objects;

/**
 * The compression attribute of an XISF image, e.g. {@code none}, {@code lz4}
 * or {@code lz4+sh:20000:2}. Only the codec and the shuffle flag are held
 * here, the sizes encoded in the suffix are interpreted by the header parser.
 *
 * @author tonyj
 */
public class CompressionDescriptor {

    public static final CompressionDescriptor NONE = new CompressionDescriptor("none", Kind.NONE, "none");

    private static final String SHUFFLE_SUFFIX = "+sh";

    public enum Kind {
        NONE, BLOCK, BLOCK_SHUFFLED
    }

    private final String text;
    private final Kind kind;
    private final String codec;

    private CompressionDescriptor(String text, Kind kind, String codec) {
        this.text = text;
        this.kind = kind;
        this.codec = codec;
    }

    /**
     * Interpret a compression attribute value. Parsing never fails, an
     * unknown codec is only rejected when decompression is attempted.
     *
     * @param attribute The attribute value, case is ignored
     * @return The descriptor
     */
    public static CompressionDescriptor parse(String attribute) {
        String text = attribute == null ? "none" : attribute.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty() || "none".equals(text)) {
            return NONE;
        }
        int colon = text.indexOf(':');
        String head = colon < 0 ? text : text.substring(0, colon);
        if (head.endsWith(SHUFFLE_SUFFIX)) {
            return new CompressionDescriptor(text, Kind.BLOCK_SHUFFLED, head.substring(0, head.length() - SHUFFLE_SUFFIX.length()));
        } else {
            return new CompressionDescriptor(text, Kind.BLOCK, head);
        }
    }

    public String getText() {
        return text;
    }

    public Kind getKind() {
        return kind;
    }

    public String getCodec() {
        return codec;
    }

    public boolean isCompressed() {
        return kind != Kind.NONE;
    }

    public boolean isShuffled() {
        return kind == Kind.BLOCK_SHUFFLED;
    }

    /**
     * The text after the shuffle marker, e.g. {@code 20000:2} for
     * {@code lz4+sh:20000:2}.
     *
     * @return The suffix, or null if the descriptor is not shuffled or has no
     * suffix
     */
    public String getShuffleSuffix() {
        int index = text.indexOf(SHUFFLE_SUFFIX + ":");
        return kind == Kind.BLOCK_SHUFFLED && index >= 0 ? text.substring(index + SHUFFLE_SUFFIX.length() + 1) : null;
    }

    @Override
    public String toString() {
        return text;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(text);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final CompressionDescriptor other = (CompressionDescriptor) obj;
        return Objects.equals(this.text, other.text);
    }
}
