package org.starcull.imageio.header;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import nom.tam.fits.FitsException;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.starcull.imageio.FormatKind;
import org.starcull.imageio.ImageFormatException;
import org.starcull.imageio.ImageFormatException.Reason;
import org.starcull.imageio.XisfTestFiles;
import org.starcull.imageio.fits.FitsTestFiles;
import org.starcull.imageio.header.HeaderEntry.Section;

/**
 *
 * @author tonyj
 */
public class HeaderListingTest {

    private static final String METADATA
            = "  <Metadata>\n"
            + "    <Property id=\"Instrument:Camera:Gain\" type=\"Float32\" value=\"100\"/>\n"
            + "    <Property id=\"XISF:CreatorApplication\" type=\"String\">PixInsight</Property>\n"
            + "  </Metadata>\n"
            + "  <FITSKeyword name=\"IMAGETYP\" value=\"'Light Frame'\" comment=\"Type of image\"/>\n"
            + "  <FITSKeyword name=\"XBINNING\" value=\"1\" comment=\"Binning factor\"/>\n";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testXisfListing() throws ImageFormatException {
        HeaderListing listing = HeaderListing.fromXisfMetadata(XisfTestFiles.header("geometry=\"1:1:1\"", METADATA));
        assertEquals(FormatKind.XISF, listing.getFormat());
        List<HeaderEntry> entries = listing.getEntries();
        assertEquals(4, entries.size());
        // keywords come before properties
        assertEquals(Section.XISF_KEYWORD, entries.get(0).getSection());
        assertEquals("IMAGETYP = 'Light Frame' (Type of image)", entries.get(0).toLine());
        assertEquals("XBINNING = 1 (Binning factor)", entries.get(1).toLine());
        assertEquals("Instrument:Camera:Gain = 100 [Type: Float32]", entries.get(2).toLine());
        assertEquals("XISF:CreatorApplication = PixInsight [Type: String]", entries.get(3).toLine());

        assertTrue(entries.get(0).isHighlighted());
        assertFalse(entries.get(1).isHighlighted());
        assertTrue(entries.get(2).isHighlighted());
        assertEquals(2, listing.getHighlighted().size());
        assertEquals("1", listing.find("XBINNING").orElseThrow().getValue());

        String text = listing.toText();
        assertEquals("IMAGETYP = 'Light Frame' (Type of image)\n"
                + "XBINNING = 1 (Binning factor)\n"
                + "\n--- XISF Properties ---\n"
                + "Instrument:Camera:Gain = 100 [Type: Float32]\n"
                + "XISF:CreatorApplication = PixInsight [Type: String]\n", text);
    }

    @Test
    public void testXisfFile() throws IOException {
        byte[] payload = XisfTestFiles.uint16(7);
        String xml = XisfTestFiles.header("geometry=\"1:1:1\" location=\"attachment:" + XisfTestFiles.DATA_OFFSET + ":2\"", METADATA);
        Path path = XisfTestFiles.write(folder.getRoot().toPath(), "light.xisf", XisfTestFiles.file(xml, payload));
        HeaderListing listing = HeaderListing.read(path);
        assertEquals(4, listing.getEntries().size());
    }

    @Test
    public void testFitsFile() throws IOException, FitsException {
        Path path = FitsTestFiles.write(folder.getRoot().toPath().resolve("light.fits"), new short[][]{{1, 2}, {3, 4}},
                "OBJECT", "M31", "FILTER", "Ha");
        HeaderListing listing = HeaderListing.read(path);
        assertEquals(FormatKind.FITS, listing.getFormat());
        assertEquals("SIMPLE", listing.getEntries().get(0).getKey());
        HeaderEntry object = listing.find("OBJECT").orElseThrow();
        assertEquals("OBJECT = M31 / test value", object.toLine());
        assertTrue(object.isHighlighted());
        assertTrue(listing.find("FILTER").orElseThrow().isHighlighted());
        assertFalse(listing.find("BITPIX").orElseThrow().isHighlighted());
        assertFalse(listing.find("END").isPresent());
    }

    @Test
    public void testMalformed() {
        try {
            HeaderListing listing = HeaderListing.fromXisfMetadata("<?xml version=\"1.0\"?><xisf><FITSKeyword</xisf>");
            fail("should not reach here: " + listing);
        } catch (ImageFormatException x) {
            assertEquals(Reason.MALFORMED_CONTAINER, x.getReason());
        }
    }
}
