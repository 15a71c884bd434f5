package org.starcull.imageio.xisf;

import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.starcull.imageio.ImageFormatException;
import org.starcull.imageio.ImageFormatException.Reason;
import org.starcull.imageio.codec.CompressionDescriptor;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Locates and parses the XML header embedded in an XISF file.
 *
 * @author tonyj
 */
public class XisfHeaderParser {

    public static final String XISF_NAMESPACE = "http://www.pixinsight.com/xisf";

    private static final Logger LOG = Logger.getLogger(XisfHeaderParser.class.getName());
    private static final byte[] START_MARKER = "<?xml".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] END_MARKER = "</xisf>".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] SIGNATURE = "XISF0100".getBytes(StandardCharsets.US_ASCII);
    // signature, header length, reserved
    static final int PREAMBLE_LENGTH = 16;

    private static final Pattern GEOMETRY_PATTERN = Pattern.compile("(\\d+):(\\d+):(\\d+)");
    private static final Pattern LOCATION_PATTERN = Pattern.compile("attachment:(\\d+):(\\d+)");
    private static final Pattern SHUFFLE_PATTERN = Pattern.compile("(\\d+):(\\d+)(:.*)?");

    private XisfHeaderParser() {
    }

    /**
     * Parse the header from the bytes of a file, or from a leading slice of
     * the file which contains the whole XML block.
     *
     * @param bytes The file content
     * @return The parsed header
     * @throws ImageFormatException If the header is missing, malformed or
     * describes an unsupported image
     */
    public static XisfHeader parse(byte[] bytes) throws ImageFormatException {
        String xml = extractMetadata(bytes);
        Element image = findImageElement(parseDocument(xml));

        int[] geometry = parseGeometry(image.getAttribute("geometry"));
        int width = geometry[0];
        int height = geometry[1];
        int channels = geometry[2];

        String sampleFormatName = attribute(image, "sampleFormat", "UInt16");
        SampleFormat sampleFormat = SampleFormat.forXisfName(sampleFormatName);
        if (sampleFormat == null) {
            throw new ImageFormatException(Reason.UNSUPPORTED_SAMPLE_FORMAT, "Only UInt16 is supported, but sampleFormat is " + sampleFormatName);
        }
        long imageSize = (long) width * height * channels * sampleFormat.getBytesPerSample();

        CompressionDescriptor compression = CompressionDescriptor.parse(attribute(image, "compression", "none"));
        long uncompressedSize = imageSize;
        int itemSize = 1;
        if (compression.isShuffled()) {
            String suffix = compression.getShuffleSuffix();
            Matcher matcher = suffix == null ? null : SHUFFLE_PATTERN.matcher(suffix);
            if (matcher != null && matcher.matches()) {
                try {
                    uncompressedSize = Long.parseLong(matcher.group(1));
                    itemSize = Integer.parseInt(matcher.group(2));
                } catch (NumberFormatException x) {
                    LOG.log(Level.WARNING, "Malformed shuffle suffix in compression \"{0}\", using geometry size", compression);
                    uncompressedSize = imageSize;
                    itemSize = 1;
                }
            } else {
                LOG.log(Level.WARNING, "Malformed shuffle suffix in compression \"{0}\", using geometry size", compression);
            }
        }

        String location = attribute(image, "location", "attachment:0:0");
        if (!location.startsWith("attachment:")) {
            throw new ImageFormatException(Reason.UNSUPPORTED_LOCATION, "Only attachment locations are supported: " + location);
        }
        Matcher matcher = LOCATION_PATTERN.matcher(location);
        long dataOffset;
        long compressedSize;
        try {
            if (!matcher.matches()) {
                throw new NumberFormatException(location);
            }
            dataOffset = Long.parseLong(matcher.group(1));
            compressedSize = Long.parseLong(matcher.group(2));
        } catch (NumberFormatException x) {
            throw new ImageFormatException(Reason.MALFORMED_CONTAINER, "Invalid location: " + location, x);
        }

        return new XisfHeader(width, height, channels, sampleFormat, compression, itemSize,
                dataOffset, compressedSize, uncompressedSize, xml);
    }

    /**
     * Read only as much of a file as needed to parse its header.
     *
     * @param path The file
     * @return The parsed header
     * @throws IOException If the file cannot be read or the header is invalid
     */
    public static XisfHeader readHeader(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            return parse(readHeaderBytes(channel));
        }
    }

    static byte[] readHeaderBytes(FileChannel channel) throws IOException {
        long fileSize = channel.size();
        ByteBuffer preamble = ByteBuffer.allocate((int) Math.min(PREAMBLE_LENGTH, fileSize));
        readFully(channel, preamble, 0);
        byte[] prefix = preamble.array();
        long length = fileSize;
        if (prefix.length == PREAMBLE_LENGTH && startsWith(prefix, SIGNATURE)) {
            long headerLength = ByteBuffer.wrap(prefix, 8, 4).order(ByteOrder.LITTLE_ENDIAN).getInt() & 0xffffffffL;
            length = Math.min(fileSize, PREAMBLE_LENGTH + headerLength);
        }
        if (length > Integer.MAX_VALUE) {
            throw new ImageFormatException(Reason.MALFORMED_CONTAINER, "Header too large: " + length);
        }
        ByteBuffer bb = ByteBuffer.allocate((int) length);
        readFully(channel, bb, 0);
        return bb.array();
    }

    static void readFully(FileChannel channel, ByteBuffer bb, long position) throws IOException {
        long p = position;
        while (bb.hasRemaining()) {
            int l = channel.read(bb, p);
            if (l < 0) {
                throw new ImageFormatException(Reason.SIZE_MISMATCH, "Unexpected end of file at " + p);
            }
            p += l;
        }
    }

    /**
     * Parse XISF header text into a DOM document.
     *
     * @param xml The header text
     * @return The document
     * @throws ImageFormatException If the text is not well formed XML
     */
    public static Document parseDocument(String xml) throws ImageFormatException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException | ParserConfigurationException x) {
            throw new ImageFormatException(Reason.MALFORMED_CONTAINER, "Invalid XML header: " + x.getMessage(), x);
        }
    }

    private static String extractMetadata(byte[] bytes) throws ImageFormatException {
        int start = indexOf(bytes, START_MARKER, 0);
        if (start < 0) {
            throw new ImageFormatException(Reason.MALFORMED_CONTAINER, "No XML header found");
        }
        int end = indexOf(bytes, END_MARKER, start);
        if (end < 0) {
            throw new ImageFormatException(Reason.MALFORMED_CONTAINER, "No </xisf> tag found");
        }
        return new String(bytes, start, end + END_MARKER.length - start, StandardCharsets.UTF_8);
    }

    private static Element findImageElement(Document document) throws ImageFormatException {
        Element root = document.getDocumentElement();
        for (Node node = root.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE
                    && "Image".equals(node.getLocalName())
                    && XISF_NAMESPACE.equals(node.getNamespaceURI())) {
                return (Element) node;
            }
        }
        throw new ImageFormatException(Reason.NO_IMAGE_ELEMENT, "No <Image> element found");
    }

    private static int[] parseGeometry(String geometry) throws ImageFormatException {
        Matcher matcher = GEOMETRY_PATTERN.matcher(geometry);
        if (!matcher.matches()) {
            throw new ImageFormatException(Reason.INVALID_GEOMETRY, "Invalid geometry: \"" + geometry + "\"");
        }
        int[] result = new int[3];
        for (int i = 0; i < 3; i++) {
            try {
                result[i] = Integer.parseInt(matcher.group(i + 1));
            } catch (NumberFormatException x) {
                throw new ImageFormatException(Reason.INVALID_GEOMETRY, "Invalid geometry: \"" + geometry + "\"", x);
            }
            if (result[i] <= 0) {
                throw new ImageFormatException(Reason.INVALID_GEOMETRY, "Non positive geometry: \"" + geometry + "\"");
            }
        }
        return result;
    }

    private static String attribute(Element element, String name, String defaultValue) {
        return element.hasAttribute(name) ? element.getAttribute(name) : defaultValue;
    }

    static int indexOf(byte[] data, byte[] pattern, int from) {
        outer:
        for (int i = from; i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        return indexOf(data, prefix, 0) == 0;
    }
}
