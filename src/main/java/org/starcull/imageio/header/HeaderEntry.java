package org.starcull.imageio.header;

/**
 * One line of a header listing.
 *
 * @author tonyj
 */
public final class HeaderEntry {

    public enum Section {
        /** A card of a FITS primary header */
        FITS_CARD,
        /** A FITSKeyword element of an XISF header */
        XISF_KEYWORD,
        /** A Property element of an XISF header */
        XISF_PROPERTY
    }

    private final Section section;
    private final String key;
    private final String value;
    private final String comment;
    private final String type;
    private final boolean highlighted;

    HeaderEntry(Section section, String key, String value, String comment, String type, boolean highlighted) {
        this.section = section;
        this.key = key;
        this.value = value == null ? "" : value;
        this.comment = comment == null ? "" : comment;
        this.type = type == null ? "" : type;
        this.highlighted = highlighted;
    }

    public Section getSection() {
        return section;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public String getComment() {
        return comment;
    }

    /**
     * @return The XISF property type, empty for other entries
     */
    public String getType() {
        return type;
    }

    public boolean isHighlighted() {
        return highlighted;
    }

    /**
     * The entry formatted the way it is displayed.
     *
     * @return The display line
     */
    public String toLine() {
        return switch (section) {
            case FITS_CARD ->
                key + " = " + value + (comment.isEmpty() ? "" : " / " + comment);
            case XISF_KEYWORD ->
                key + " = " + value + " (" + comment + ")";
            case XISF_PROPERTY ->
                key + " = " + value + " [Type: " + type + "]";
        };
    }

    @Override
    public String toString() {
        return toLine();
    }
}
