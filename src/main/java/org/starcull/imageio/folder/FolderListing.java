package org.starcull.imageio.folder;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.starcull.imageio.FormatKind;

/**
 * The supported files of a folder, split into the active files and the ones
 * already moved to the rejected sub-folder.
 *
 * @author tonyj
 */
public class FolderListing {

    private static final Logger LOG = Logger.getLogger(FolderListing.class.getName());
    public static final String REJECTED_FOLDER = "PRETRASH";

    private final Path folder;
    private final List<FileInfo> active;
    private final List<FileInfo> rejected;

    private FolderListing(Path folder, List<FileInfo> active, List<FileInfo> rejected) {
        this.folder = folder;
        this.active = Collections.unmodifiableList(active);
        this.rejected = Collections.unmodifiableList(rejected);
    }

    public static FolderListing scan(Path folder) throws IOException {
        if (!Files.isDirectory(folder)) {
            throw new IOException("Not a directory: " + folder);
        }
        List<FileInfo> active = list(folder);
        Path rejectedFolder = folder.resolve(REJECTED_FOLDER);
        List<FileInfo> rejected = Files.isDirectory(rejectedFolder) ? list(rejectedFolder) : new ArrayList<>();
        LOG.log(Level.FINE, "{0}: {1} active, {2} rejected", new Object[]{folder, active.size(), rejected.size()});
        return new FolderListing(folder, active, rejected);
    }

    private static List<FileInfo> list(Path dir) throws IOException {
        List<FileInfo> result = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path) && FormatKind.forPath(path).isPresent()) {
                    result.add(new FileInfo(path, Files.size(path)));
                }
            }
        }
        result.sort(Comparator.comparing(f -> f.getPath().toString().toLowerCase(Locale.ROOT)));
        return result;
    }

    public Path getFolder() {
        return folder;
    }

    public Path getRejectedFolder() {
        return folder.resolve(REJECTED_FOLDER);
    }

    public List<FileInfo> getActive() {
        return active;
    }

    public List<FileInfo> getRejected() {
        return rejected;
    }

    public List<Path> getActivePaths() {
        List<Path> result = new ArrayList<>(active.size());
        for (FileInfo info : active) {
            result.add(info.getPath());
        }
        return result;
    }

    /**
     * A file and its size.
     */
    public static final class FileInfo {

        private static final double MIB = 1024 * 1024;

        private final Path path;
        private final long size;

        FileInfo(Path path, long size) {
            this.path = path;
            this.size = size;
        }

        public Path getPath() {
            return path;
        }

        public long getSize() {
            return size;
        }

        public long getSizeMiB() {
            return Math.round(size / MIB);
        }

        /**
         * @return File name and rounded size, as shown in the file lists
         */
        public String getDisplayName() {
            return path.getFileName() + " (" + getSizeMiB() + " MB)";
        }

        @Override
        public String toString() {
            return getDisplayName();
        }
    }
}
