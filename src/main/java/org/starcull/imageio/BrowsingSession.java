package org.starcull.imageio;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.starcull.imageio.scale.ToneMapParameters;
import org.starcull.imageio.scale.ToneMapPreset;

/**
 * State of one browsing session: the open folder, the file being shown and
 * the current display parameters. Opening a folder hands out a new
 * {@link FolderToken}; tokens from earlier folders report themselves as stale
 * so that background work started for them can be discarded.
 *
 * @author tonyj
 */
public class BrowsingSession {

    private static final Logger LOG = Logger.getLogger(BrowsingSession.class.getName());

    private final AtomicLong generation = new AtomicLong();
    private volatile FolderToken folderToken = new FolderToken(this, 0, null);
    private Path currentFile;
    private ToneMapParameters parameters = ToneMapPreset.DEFAULT.getParameters();

    public FolderToken openFolder(Path folder) {
        FolderToken token = new FolderToken(this, generation.incrementAndGet(), folder);
        folderToken = token;
        currentFile = null;
        LOG.log(Level.FINE, "Opened folder {0} as generation {1}", new Object[]{folder, token.generation});
        return token;
    }

    public FolderToken getFolderToken() {
        return folderToken;
    }

    public boolean isCurrent(FolderToken token) {
        return token.session == this && token.generation == generation.get();
    }

    public Path getFolder() {
        return folderToken.getFolder();
    }

    public Path getCurrentFile() {
        return currentFile;
    }

    public void setCurrentFile(Path currentFile) {
        this.currentFile = currentFile;
    }

    public ToneMapParameters getParameters() {
        return parameters;
    }

    public void setParameters(ToneMapParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
    }

    public void applyPreset(ToneMapPreset preset) {
        setParameters(preset.getParameters());
    }

    /**
     * Identifies the folder a piece of background work was started for.
     */
    public static final class FolderToken {

        private final BrowsingSession session;
        private final long generation;
        private final Path folder;

        private FolderToken(BrowsingSession session, long generation, Path folder) {
            this.session = session;
            this.generation = generation;
            this.folder = folder;
        }

        public boolean isCurrent() {
            return session.isCurrent(this);
        }

        public long getGeneration() {
            return generation;
        }

        public Path getFolder() {
            return folder;
        }

        @Override
        public String toString() {
            return "FolderToken{" + "generation=" + generation + ", folder=" + folder + '}';
        }
    }
}
