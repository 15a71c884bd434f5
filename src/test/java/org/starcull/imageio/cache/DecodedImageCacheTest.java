package org.starcull.imageio.cache;

import java.nio.file.Path;
import java.nio.file.Paths;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import org.junit.Test;
import org.starcull.imageio.DecodedImage;
import org.starcull.imageio.FormatKind;

/**
 *
 * @author tonyj
 */
public class DecodedImageCacheTest {

    private static DecodedImage image() {
        return new DecodedImage(FormatKind.XISF, 1, 1, 1, new float[1]);
    }

    private static Path path(int i) {
        return Paths.get("light_" + i + ".xisf");
    }

    @Test
    public void testDefaultCapacity() {
        assertEquals(5, new DecodedImageCache().capacity());
    }

    @Test
    public void testEvictsLeastRecentlyInserted() {
        DecodedImageCache cache = new DecodedImageCache(5);
        for (int i = 0; i < 6; i++) {
            cache.put(path(i), image());
            assertTrue(cache.size() <= 5);
        }
        assertEquals(5, cache.size());
        assertFalse(cache.get(path(0)).isPresent());
        for (int i = 1; i < 6; i++) {
            assertTrue(cache.get(path(i)).isPresent());
        }
    }

    @Test
    public void testAccessRefreshesEntry() {
        DecodedImageCache cache = new DecodedImageCache(3);
        DecodedImage first = image();
        cache.put(path(0), first);
        cache.put(path(1), image());
        cache.put(path(2), image());
        assertSame(first, cache.get(path(0)).orElseThrow());
        cache.put(path(3), image());
        assertTrue(cache.contains(path(0)));
        assertFalse(cache.contains(path(1)));
    }

    @Test
    public void testInvalidateAndClear() {
        DecodedImageCache cache = new DecodedImageCache(3);
        cache.put(path(0), image());
        cache.put(path(1), image());
        cache.invalidate(path(0));
        cache.invalidate(path(7));
        assertFalse(cache.get(path(0)).isPresent());
        assertEquals(1, cache.size());
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroCapacity() {
        new DecodedImageCache(0);
    }
}
