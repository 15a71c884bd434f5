package org.starcull.imageio.xisf;

import java.nio.charset.StandardCharsets;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import org.starcull.imageio.ImageFormatException;
import org.starcull.imageio.ImageFormatException.Reason;
import org.starcull.imageio.XisfTestFiles;

/**
 *
 * @author tonyj
 */
public class XisfHeaderParserTest {

    private static XisfHeader parse(String imageAttributes) throws ImageFormatException {
        return XisfHeaderParser.parse(XisfTestFiles.header(imageAttributes, "").getBytes(StandardCharsets.UTF_8));
    }

    private static void assertRejected(Reason reason, String xml) {
        try {
            XisfHeader header = XisfHeaderParser.parse(xml.getBytes(StandardCharsets.UTF_8));
            fail("should not reach here: " + header);
        } catch (ImageFormatException x) {
            assertEquals(reason, x.getReason());
        }
    }

    private static void assertImageRejected(Reason reason, String imageAttributes) {
        assertRejected(reason, XisfTestFiles.header(imageAttributes, ""));
    }

    @Test
    public void testUncompressed() throws ImageFormatException {
        XisfHeader header = parse("geometry=\"100:50:1\" sampleFormat=\"UInt16\" compression=\"none\" location=\"attachment:128:10000\"");
        assertEquals(100, header.getWidth());
        assertEquals(50, header.getHeight());
        assertEquals(1, header.getChannels());
        assertEquals(SampleFormat.UINT16, header.getSampleFormat());
        assertFalse(header.getCompression().isCompressed());
        assertEquals(128, header.getDataOffset());
        assertEquals(10000, header.getCompressedSize());
        assertEquals(10000, header.getImageSize());
    }

    @Test
    public void testShuffledCompression() throws ImageFormatException {
        XisfHeader header = parse("geometry=\"100:100:1\" sampleFormat=\"UInt16\" compression=\"lz4+sh:20000:2\" location=\"attachment:4096:1234\"");
        assertTrue(header.getCompression().isShuffled());
        assertEquals("lz4", header.getCompression().getCodec());
        assertEquals(20000, header.getUncompressedSize());
        assertEquals(2, header.getShuffleItemSize());
        assertEquals(1234, header.getCompressedSize());
    }

    @Test
    public void testCompressionIsCaseInsensitive() throws ImageFormatException {
        XisfHeader header = parse("geometry=\"10:10:1\" compression=\"LZ4HC\" location=\"attachment:4096:50\"");
        assertEquals("lz4hc", header.getCompression().getCodec());
        assertFalse(header.getCompression().isShuffled());
        assertEquals(200, header.getUncompressedSize());
    }

    @Test
    public void testMalformedShuffleSuffixFallsBackToGeometry() throws ImageFormatException {
        XisfHeader header = parse("geometry=\"10:10:1\" compression=\"lz4+sh:lots:2\" location=\"attachment:4096:50\"");
        assertTrue(header.getCompression().isShuffled());
        assertEquals(200, header.getUncompressedSize());
        assertEquals(1, header.getShuffleItemSize());

        header = parse("geometry=\"10:10:1\" compression=\"lz4+sh\" location=\"attachment:4096:50\"");
        assertEquals(200, header.getUncompressedSize());
        assertEquals(1, header.getShuffleItemSize());
    }

    @Test
    public void testDefaults() throws ImageFormatException {
        XisfHeader header = parse("geometry=\"4:3:3\"");
        assertEquals(SampleFormat.UINT16, header.getSampleFormat());
        assertFalse(header.getCompression().isCompressed());
        assertEquals(0, header.getDataOffset());
        assertEquals(0, header.getCompressedSize());
        assertEquals(72, header.getImageSize());
    }

    @Test
    public void testLowerCaseSampleFormat() throws ImageFormatException {
        assertEquals(SampleFormat.UINT16, parse("geometry=\"1:1:1\" sampleFormat=\"uint16\"").getSampleFormat());
    }

    @Test
    public void testMetadataKeptVerbatim() throws ImageFormatException {
        String xml = XisfTestFiles.header("geometry=\"1:1:1\"", "  <Metadata><Property id=\"XISF:CreatorApplication\" type=\"String\">test</Property></Metadata>\n");
        byte[] file = XisfTestFiles.file(xml, new byte[2]);
        assertEquals(xml, XisfHeaderParser.parse(file).getRawMetadataText());
    }

    @Test
    public void testMissingMarkers() {
        assertRejected(Reason.MALFORMED_CONTAINER, "SIMPLE  =                    T");
        assertRejected(Reason.MALFORMED_CONTAINER, "<?xml version=\"1.0\"?><xisf><Image geometry=\"1:1:1\"/>");
    }

    @Test
    public void testBadXml() {
        assertRejected(Reason.MALFORMED_CONTAINER, "<?xml version=\"1.0\"?><xisf><Image geometry=\"1:1:1\"</xisf>");
    }

    @Test
    public void testNoImageElement() {
        assertRejected(Reason.NO_IMAGE_ELEMENT, "<?xml version=\"1.0\"?><xisf xmlns=\"http://www.pixinsight.com/xisf\"><Metadata/></xisf>");
        // Image elements outside the XISF namespace do not count
        assertRejected(Reason.NO_IMAGE_ELEMENT, "<?xml version=\"1.0\"?><xisf><Image geometry=\"1:1:1\"/></xisf>");
    }

    @Test
    public void testInvalidGeometry() {
        assertImageRejected(Reason.INVALID_GEOMETRY, "sampleFormat=\"UInt16\"");
        assertImageRejected(Reason.INVALID_GEOMETRY, "geometry=\"100:50\"");
        assertImageRejected(Reason.INVALID_GEOMETRY, "geometry=\"100:0:1\"");
        assertImageRejected(Reason.INVALID_GEOMETRY, "geometry=\"a:b:c\"");
        assertImageRejected(Reason.INVALID_GEOMETRY, "geometry=\"99999999999:1:1\"");
    }

    @Test
    public void testUnsupportedSampleFormat() {
        assertImageRejected(Reason.UNSUPPORTED_SAMPLE_FORMAT, "geometry=\"10:10:1\" sampleFormat=\"Float32\"");
    }

    @Test
    public void testLocation() {
        assertImageRejected(Reason.UNSUPPORTED_LOCATION, "geometry=\"10:10:1\" location=\"inline:base64\"");
        assertImageRejected(Reason.MALFORMED_CONTAINER, "geometry=\"10:10:1\" location=\"attachment:x:100\"");
        assertImageRejected(Reason.MALFORMED_CONTAINER, "geometry=\"10:10:1\" location=\"attachment:100\"");
    }
}
