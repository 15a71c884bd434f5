package org.starcull.imageio.preview;

import java.nio.file.Path;

/**
 * One step of a thumbnail run.
 *
 * @author tonyj
 */
public final class ThumbnailProgress {

    public enum Status {
        /** A preview was generated and published */
        CREATED,
        /** The store already held a preview for the file */
        ALREADY_AVAILABLE,
        /** The file could not be decoded, see the message */
        FAILED,
        /** The file was invalidated while its preview was created, nothing was published */
        STALE,
        /** The folder changed, the run stopped and nothing more is published */
        ABANDONED,
        /** Last event of a run that went through all files */
        COMPLETE
    }

    private final int index;
    private final int total;
    private final Path path;
    private final Status status;
    private final String message;

    ThumbnailProgress(int index, int total, Path path, Status status, String message) {
        this.index = index;
        this.total = total;
        this.path = path;
        this.status = status;
        this.message = message;
    }

    /**
     * @return Number of files handled so far, including this one
     */
    public int getIndex() {
        return index;
    }

    public int getTotal() {
        return total;
    }

    public int getPercent() {
        return total == 0 ? 100 : index * 100 / total;
    }

    /**
     * @return The file, or null for the {@code COMPLETE} and
     * {@code ABANDONED} events
     */
    public Path getPath() {
        return path;
    }

    public Status getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "ThumbnailProgress{" + index + "/" + total + " (" + getPercent() + "%) " + status + " " + (path == null ? "" : path + " ") + message + '}';
    }
}
