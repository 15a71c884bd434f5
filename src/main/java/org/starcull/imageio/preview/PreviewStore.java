package org.starcull.imageio.preview;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Previews keyed by path. Written by the background thumbnail run and read
 * by the interactive path, so it is backed by a concurrent Caffeine cache.
 * Entries are only removed by {@link #invalidate} or {@link #clear}.
 * <p>
 * A preview computed while its file was invalidated, or while the store was
 * cleared, must not be published. The background run therefore takes a
 * {@link Stamp} before reading the file and publishes through
 * {@link #publishIfUnchanged}, which compares the stamp under the same lock
 * that {@link #invalidate} takes for the path.
 *
 * @author tonyj
 */
public class PreviewStore {

    private static final Logger LOG = Logger.getLogger(PreviewStore.class.getName());

    private final Cache<Path, PreviewEntry> previews = Caffeine.newBuilder()
            .recordStats()
            .build();
    private final AtomicLong generation = new AtomicLong();
    private final ConcurrentMap<Path, Long> invalidations = new ConcurrentHashMap<>();

    public void publish(PreviewEntry entry) {
        previews.put(entry.getPath(), entry);
    }

    public Stamp stamp(Path path) {
        return new Stamp(path, generation.get(), invalidations.getOrDefault(path, 0L));
    }

    /**
     * Publish a preview unless its file was invalidated or the store cleared
     * since the stamp was taken.
     *
     * @param entry The preview
     * @param stamp Taken before the file was read
     * @param stillWanted Checked atomically with the publish
     * @return True if the entry was published
     */
    public boolean publishIfUnchanged(PreviewEntry entry, Stamp stamp, BooleanSupplier stillWanted) {
        if (!stamp.path.equals(entry.getPath())) {
            throw new IllegalArgumentException("Stamp for " + stamp.path + " used for " + entry.getPath());
        }
        boolean[] published = new boolean[1];
        previews.asMap().compute(entry.getPath(), (path, existing) -> {
            if (isUnchanged(stamp) && stillWanted.getAsBoolean()) {
                published[0] = true;
                return entry;
            }
            return existing;
        });
        return published[0];
    }

    private boolean isUnchanged(Stamp stamp) {
        return stamp.generation == generation.get()
                && stamp.invalidations == invalidations.getOrDefault(stamp.path, 0L);
    }

    public Optional<PreviewEntry> get(Path path) {
        return Optional.ofNullable(previews.getIfPresent(path));
    }

    public boolean contains(Path path) {
        return previews.asMap().containsKey(path);
    }

    public void invalidate(Path path) {
        previews.asMap().compute(path, (p, existing) -> {
            invalidations.merge(p, 1L, Long::sum);
            return null;
        });
    }

    public void clear() {
        generation.incrementAndGet();
        invalidations.clear();
        previews.invalidateAll();
    }

    public long size() {
        return previews.estimatedSize();
    }

    void report() {
        LOG.log(Level.INFO, "preview Cache size {0} stats {1}", new Object[]{previews.estimatedSize(), previews.stats()});
    }

    /**
     * State of one path at the time its preview computation started.
     */
    public static final class Stamp {

        private final Path path;
        private final long generation;
        private final long invalidations;

        private Stamp(Path path, long generation, long invalidations) {
            this.path = path;
            this.generation = generation;
            this.invalidations = invalidations;
        }

        public Path getPath() {
            return path;
        }

        @Override
        public String toString() {
            return "Stamp{" + "path=" + path + ", generation=" + generation + ", invalidations=" + invalidations + '}';
        }
    }
}
