package org.starcull.imageio.cache;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.starcull.imageio.DecodedImage;

/**
 * A small least recently used cache of decoded images, keyed by file path.
 * Reading or writing an entry makes it the most recently used one. Not thread
 * safe: only the interactive path reads and writes it.
 *
 * @author tonyj
 */
public class DecodedImageCache {

    private static final Logger LOG = Logger.getLogger(DecodedImageCache.class.getName());
    static final int DEFAULT_CAPACITY = 5;

    private final int capacity;
    private final LinkedHashMap<Path, DecodedImage> entries;

    public DecodedImageCache() {
        this(Integer.getInteger("org.starcull.imageio.decodedCacheSize", DEFAULT_CAPACITY));
    }

    public DecodedImageCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<Path, DecodedImage>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<Path, DecodedImage> eldest) {
                boolean evict = size() > DecodedImageCache.this.capacity;
                if (evict) {
                    LOG.log(Level.FINE, "Evicting {0}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    public Optional<DecodedImage> get(Path path) {
        return Optional.ofNullable(entries.get(path));
    }

    public void put(Path path, DecodedImage image) {
        entries.put(path, image);
    }

    public void invalidate(Path path) {
        if (entries.remove(path) != null) {
            LOG.log(Level.FINE, "Invalidated {0}", path);
        }
    }

    public void clear() {
        entries.clear();
    }

    public boolean contains(Path path) {
        return entries.containsKey(path);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
