package org.starcull.imageio.header;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.BufferedFile;
import nom.tam.util.Cursor;
import org.starcull.imageio.FormatKind;
import org.starcull.imageio.ImageFormatException;
import org.starcull.imageio.ImageFormatException.Reason;
import org.starcull.imageio.header.HeaderEntry.Section;
import org.starcull.imageio.xisf.XisfHeaderParser;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

/**
 * Read only listing of the keywords of a file, for display next to the
 * image. Keywords an operator typically checks while culling are flagged as
 * highlighted.
 *
 * @author tonyj
 */
public class HeaderListing {

    public static final Set<String> HIGHLIGHTED_KEYS = Set.of(
            "IMAGETYP", "EXPOSURE", "GAIN", "OFFSET", "CAMERAID", "FILTER", "DATE-OBS", "CCD-TEMP", "RA", "DEC", "OBJECT",
            "Instrument:Camera:Gain", "Instrument:Camera:Offset", "Observation:Time:Start");
    static final String PROPERTIES_SEPARATOR = "--- XISF Properties ---";

    private final FormatKind format;
    private final List<HeaderEntry> entries;

    static {
        FitsFactory.setUseHierarch(true);
    }

    private HeaderListing(FormatKind format, List<HeaderEntry> entries) {
        this.format = format;
        this.entries = Collections.unmodifiableList(entries);
    }

    public static HeaderListing read(Path path) throws IOException {
        return switch (FormatKind.of(path)) {
            case XISF ->
                fromXisfMetadata(XisfHeaderParser.readHeader(path).getRawMetadataText());
            case FITS ->
                readFitsPrimaryHeader(path);
        };
    }

    /**
     * List the FITSKeyword and Property elements of an XISF header.
     *
     * @param xml The XISF header text
     * @return The listing
     * @throws ImageFormatException If the text is not well formed
     */
    public static HeaderListing fromXisfMetadata(String xml) throws ImageFormatException {
        Document document = XisfHeaderParser.parseDocument(xml);
        List<HeaderEntry> result = new ArrayList<>();
        NodeList keywords = document.getElementsByTagNameNS(XisfHeaderParser.XISF_NAMESPACE, "FITSKeyword");
        for (int i = 0; i < keywords.getLength(); i++) {
            Element keyword = (Element) keywords.item(i);
            String name = keyword.getAttribute("name");
            result.add(new HeaderEntry(Section.XISF_KEYWORD, name, keyword.getAttribute("value"), keyword.getAttribute("comment"), null, isHighlighted(name)));
        }
        NodeList properties = document.getElementsByTagNameNS(XisfHeaderParser.XISF_NAMESPACE, "Property");
        for (int i = 0; i < properties.getLength(); i++) {
            Element property = (Element) properties.item(i);
            String id = property.getAttribute("id");
            String value = property.hasAttribute("value") ? property.getAttribute("value") : property.getTextContent().trim();
            result.add(new HeaderEntry(Section.XISF_PROPERTY, id, value, null, property.getAttribute("type"), isHighlighted(id)));
        }
        return new HeaderListing(FormatKind.XISF, result);
    }

    static HeaderListing fromFitsHeader(Header header) {
        List<HeaderEntry> result = new ArrayList<>();
        Cursor<String, HeaderCard> cursor = header.iterator();
        while (cursor.hasNext()) {
            HeaderCard card = cursor.next();
            String key = card.getKey();
            if ("END".equals(key)) {
                continue;
            }
            result.add(new HeaderEntry(Section.FITS_CARD, key, card.getValue(), card.getComment(), null, isHighlighted(key)));
        }
        return new HeaderListing(FormatKind.FITS, result);
    }

    private static HeaderListing readFitsPrimaryHeader(Path path) throws IOException {
        try (BufferedFile bf = new BufferedFile(path.toFile(), "r")) {
            return fromFitsHeader(new Header(bf));
        } catch (FitsException x) {
            throw new ImageFormatException(Reason.MALFORMED_CONTAINER, "Invalid FITS header in " + path + ": " + x.getMessage(), x);
        }
    }

    public static boolean isHighlighted(String key) {
        return key != null && HIGHLIGHTED_KEYS.contains(key);
    }

    public FormatKind getFormat() {
        return format;
    }

    public List<HeaderEntry> getEntries() {
        return entries;
    }

    public List<HeaderEntry> getHighlighted() {
        return entries.stream().filter(HeaderEntry::isHighlighted).collect(Collectors.toList());
    }

    /**
     * Find the first entry with the given key.
     *
     * @param key The keyword name or property id
     * @return The entry, if present
     */
    public Optional<HeaderEntry> find(String key) {
        return entries.stream().filter(e -> e.getKey().equals(key)).findFirst();
    }

    /**
     * The listing as display text, one entry per line. For XISF files the
     * properties follow the keywords after a separator line.
     *
     * @return The text
     */
    public String toText() {
        StringBuilder builder = new StringBuilder();
        boolean separated = false;
        for (HeaderEntry entry : entries) {
            if (entry.getSection() == Section.XISF_PROPERTY && !separated) {
                builder.append('\n').append(PROPERTIES_SEPARATOR).append('\n');
                separated = true;
            }
            builder.append(entry.toLine()).append('\n');
        }
        if (format == FormatKind.XISF && !separated) {
            builder.append('\n').append(PROPERTIES_SEPARATOR).append('\n');
        }
        return builder.toString();
    }
}
