package org.starcull.imageio.folder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 *
 * @author tonyj
 */
public class FolderListingTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static Path create(Path dir, String name, int size) throws IOException {
        return Files.write(dir.resolve(name), new byte[size]);
    }

    private static String names(List<FolderListing.FileInfo> files) {
        StringBuilder builder = new StringBuilder();
        for (FolderListing.FileInfo info : files) {
            builder.append(info.getPath().getFileName()).append(' ');
        }
        return builder.toString().trim();
    }

    @Test
    public void testScan() throws IOException {
        Path dir = folder.getRoot().toPath();
        create(dir, "c.xisf", 10);
        create(dir, "B.fits", 3 * 1024 * 1024 / 2);
        create(dir, "a.XIFS", 10);
        create(dir, "notes.txt", 10);
        create(dir, "d.fit", 10);
        Files.createDirectory(dir.resolve("other.xisf"));
        Path rejected = Files.createDirectory(dir.resolve(FolderListing.REJECTED_FOLDER));
        create(rejected, "z.xisf", 10);
        create(rejected, "Y.fts", 10);

        FolderListing listing = FolderListing.scan(dir);
        assertEquals("a.XIFS B.fits c.xisf d.fit", names(listing.getActive()));
        assertEquals("Y.fts z.xisf", names(listing.getRejected()));
        assertEquals(dir.resolve("B.fits"), listing.getActivePaths().get(1));

        FolderListing.FileInfo b = listing.getActive().get(1);
        assertEquals(3 * 1024 * 1024 / 2, b.getSize());
        assertEquals(2, b.getSizeMiB());
        assertEquals("B.fits (2 MB)", b.getDisplayName());
        assertEquals("c.xisf (0 MB)", listing.getActive().get(2).getDisplayName());
    }

    @Test
    public void testNoRejectedFolder() throws IOException {
        Path dir = folder.getRoot().toPath();
        create(dir, "a.xisf", 10);
        FolderListing listing = FolderListing.scan(dir);
        assertEquals(1, listing.getActive().size());
        assertTrue(listing.getRejected().isEmpty());
    }

    @Test
    public void testNotADirectory() throws IOException {
        Path file = create(folder.getRoot().toPath(), "a.xisf", 10);
        try {
            FolderListing listing = FolderListing.scan(file);
            fail("should not reach here: " + listing);
        } catch (IOException x) {
            assertTrue(x.getMessage().contains("a.xisf"));
        }
    }
}
