package org.starcull.imageio.preview;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.starcull.imageio.BrowsingSession.FolderToken;
import org.starcull.imageio.ImageFormatException;
import org.starcull.imageio.preview.ThumbnailProgress.Status;

/**
 * A lazy pass over a list of files, creating the previews which are not
 * already in the store. Each call to {@link #next()} handles one file and
 * reports what happened; after the last file one {@code COMPLETE} event
 * follows. If the folder changes while the run is in progress the run emits
 * one {@code ABANDONED} event and ends without publishing anything further.
 * A file invalidated while its preview was being created is reported as
 * {@code STALE} and left for a later run.
 *
 * @author tonyj
 */
public class ThumbnailRun implements Iterator<ThumbnailProgress> {

    private static final Logger LOG = Logger.getLogger(ThumbnailRun.class.getName());

    private final ThumbnailPipeline pipeline;
    private final List<Path> paths;
    private final FolderToken token;
    private final List<Path> failed = new ArrayList<>();
    private int index;
    private int created;
    private int alreadyAvailable;
    private int stale;
    private boolean abandoned;
    private boolean finished;

    ThumbnailRun(ThumbnailPipeline pipeline, List<Path> paths, FolderToken token) {
        this.pipeline = pipeline;
        this.paths = List.copyOf(paths);
        this.token = token;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public ThumbnailProgress next() {
        if (finished) {
            throw new NoSuchElementException();
        }
        int total = paths.size();
        if (!token.isCurrent()) {
            return abandon();
        }
        if (index == total) {
            finished = true;
            ThumbnailSummary summary = getSummary();
            LOG.log(Level.INFO, "{0}", summary);
            pipeline.getStore().report();
            return new ThumbnailProgress(index, total, null, Status.COMPLETE, summary.toString());
        }
        Path path = paths.get(index);
        PreviewStore store = pipeline.getStore();
        if (store.contains(path)) {
            index++;
            alreadyAvailable++;
            return new ThumbnailProgress(index, total, path, Status.ALREADY_AVAILABLE, "already cached");
        }
        PreviewStore.Stamp stamp = store.stamp(path);
        try {
            PreviewEntry entry = pipeline.generate(path);
            if (!store.publishIfUnchanged(entry, stamp, token::isCurrent)) {
                if (!token.isCurrent()) {
                    return abandon();
                }
                LOG.log(Level.FINE, "{0} was invalidated while its preview was created, not publishing", path);
                index++;
                stale++;
                return new ThumbnailProgress(index, total, path, Status.STALE, "changed while the preview was created");
            }
            index++;
            created++;
            return new ThumbnailProgress(index, total, path, Status.CREATED, "cached");
        } catch (ImageFormatException x) {
            return fail(path, x, x.getMessage());
        } catch (RuntimeException x) {
            // Any single file failing must not end the run
            return fail(path, x, x.toString());
        }
    }

    private ThumbnailProgress fail(Path path, Exception x, String message) {
        pipeline.getStore().invalidate(path);
        LOG.log(Level.WARNING, "Could not create preview for " + path, x);
        index++;
        failed.add(path);
        return new ThumbnailProgress(index, paths.size(), path, Status.FAILED, message);
    }

    private ThumbnailProgress abandon() {
        finished = true;
        abandoned = true;
        LOG.log(Level.FINE, "Folder changed, abandoning preview run for {0} after {1} files", new Object[]{token.getFolder(), index});
        return new ThumbnailProgress(index, paths.size(), null, Status.ABANDONED, "folder changed");
    }

    public ThumbnailSummary getSummary() {
        return new ThumbnailSummary(paths.size(), created, alreadyAvailable, stale, new ArrayList<>(failed), abandoned);
    }

    public FolderToken getToken() {
        return token;
    }
}
