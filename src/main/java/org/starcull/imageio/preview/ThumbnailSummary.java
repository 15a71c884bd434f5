package org.starcull.imageio.preview;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a thumbnail run.
 *
 * @author tonyj
 */
public final class ThumbnailSummary {

    private final int total;
    private final int created;
    private final int alreadyAvailable;
    private final int stale;
    private final List<Path> failed;
    private final boolean abandoned;

    ThumbnailSummary(int total, int created, int alreadyAvailable, int stale, List<Path> failed, boolean abandoned) {
        this.total = total;
        this.created = created;
        this.alreadyAvailable = alreadyAvailable;
        this.stale = stale;
        this.failed = Collections.unmodifiableList(failed);
        this.abandoned = abandoned;
    }

    public int getTotal() {
        return total;
    }

    public int getCreated() {
        return created;
    }

    public int getAlreadyAvailable() {
        return alreadyAvailable;
    }

    /**
     * @return Files invalidated while their preview was created
     */
    public int getStale() {
        return stale;
    }

    /**
     * @return Files with a preview in the store, whether created by this run
     * or before it
     */
    public int getAvailable() {
        return created + alreadyAvailable;
    }

    public List<Path> getFailed() {
        return failed;
    }

    public boolean isAbandoned() {
        return abandoned;
    }

    @Override
    public String toString() {
        return "Preview caching " + (abandoned ? "abandoned" : "complete") + ". " + getAvailable() + "/" + total
                + (failed.isEmpty() ? "" : " (" + failed.size() + " failed)")
                + (stale == 0 ? "" : " (" + stale + " changed)");
    }
}
