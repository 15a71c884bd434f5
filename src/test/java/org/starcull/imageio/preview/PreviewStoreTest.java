package org.starcull.imageio.preview;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.nio.file.Paths;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class PreviewStoreTest {

    private static PreviewEntry entry(Path path) {
        return new PreviewEntry(path, new BufferedImage(4, 2, BufferedImage.TYPE_BYTE_GRAY), 40, 20);
    }

    @Test
    public void testPublishReplaceInvalidate() {
        PreviewStore store = new PreviewStore();
        Path a = Paths.get("a.xisf");
        Path b = Paths.get("b.fits");
        store.publish(entry(a));
        PreviewEntry replacement = entry(a);
        store.publish(replacement);
        store.publish(entry(b));
        assertEquals(2, store.size());
        assertSame(replacement, store.get(a).orElseThrow());

        store.invalidate(a);
        assertFalse(store.get(a).isPresent());
        assertTrue(store.contains(b));

        store.clear();
        assertEquals(0, store.size());
        store.report();
    }

    @Test
    public void testPublishIfUnchanged() {
        PreviewStore store = new PreviewStore();
        Path a = Paths.get("a.xisf");
        Path b = Paths.get("b.xisf");

        PreviewStore.Stamp stamp = store.stamp(a);
        assertTrue(store.publishIfUnchanged(entry(a), stamp, () -> true));
        assertTrue(store.contains(a));

        stamp = store.stamp(a);
        store.invalidate(a);
        assertFalse(store.publishIfUnchanged(entry(a), stamp, () -> true));
        assertFalse(store.contains(a));

        // invalidating another file does not matter
        stamp = store.stamp(a);
        store.invalidate(b);
        assertTrue(store.publishIfUnchanged(entry(a), stamp, () -> true));

        stamp = store.stamp(b);
        store.clear();
        assertFalse(store.publishIfUnchanged(entry(b), stamp, () -> true));
        assertEquals(0, store.size());

        stamp = store.stamp(b);
        assertFalse(store.publishIfUnchanged(entry(b), stamp, () -> false));
        assertEquals(0, store.size());
    }

    @Test
    public void testRejectedPublishKeepsExisting() {
        PreviewStore store = new PreviewStore();
        Path a = Paths.get("a.xisf");
        PreviewEntry current = entry(a);
        store.publish(current);
        assertFalse(store.publishIfUnchanged(entry(a), store.stamp(a), () -> false));
        assertSame(current, store.get(a).orElseThrow());
    }

    @Test
    public void testStampForOtherPath() {
        PreviewStore store = new PreviewStore();
        try {
            store.publishIfUnchanged(entry(Paths.get("a.xisf")), store.stamp(Paths.get("b.xisf")), () -> true);
            fail("should not reach here");
        } catch (IllegalArgumentException x) {
            // expected
        }
    }
}
