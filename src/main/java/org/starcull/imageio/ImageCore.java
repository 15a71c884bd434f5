package org.starcull.imageio;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.starcull.imageio.cache.DecodedImageCache;
import org.starcull.imageio.folder.FolderListing;
import org.starcull.imageio.preview.PreviewEntry;
import org.starcull.imageio.preview.PreviewStore;
import org.starcull.imageio.preview.ThumbnailPipeline;
import org.starcull.imageio.preview.ThumbnailProgress;
import org.starcull.imageio.preview.ThumbnailRun;
import org.starcull.imageio.preview.ThumbnailSummary;
import org.starcull.imageio.scale.ToneMapParameters;
import org.starcull.imageio.scale.ToneMapper;

/**
 * What a viewer needs from the image pipeline: decoding with a small cache,
 * tone-mapping, previews and invalidation when files change. The decoded
 * cache and the tone mapper are used only from the interactive thread, the
 * preview store may also be written by a background thumbnail run.
 *
 * @author tonyj
 */
public class ImageCore {

    private static final Logger LOG = Logger.getLogger(ImageCore.class.getName());

    private final BrowsingSession session;
    private final DecodedImageCache decodedCache;
    private final ToneMapper toneMapper = new ToneMapper();
    private final PreviewStore previewStore;
    private final ThumbnailPipeline thumbnails;

    public ImageCore() {
        this(new BrowsingSession(), new DecodedImageCache(), new PreviewStore());
    }

    public ImageCore(BrowsingSession session, DecodedImageCache decodedCache, PreviewStore previewStore) {
        this(session, decodedCache, new ThumbnailPipeline(previewStore));
    }

    public ImageCore(BrowsingSession session, DecodedImageCache decodedCache, ThumbnailPipeline thumbnails) {
        this.session = session;
        this.decodedCache = decodedCache;
        this.previewStore = thumbnails.getStore();
        this.thumbnails = thumbnails;
    }

    /**
     * Open a folder: list its files, forget everything cached for the
     * previous folder and make earlier thumbnail runs stale.
     *
     * @param folder The folder
     * @return The files of the folder
     * @throws IOException If the folder cannot be listed
     */
    public FolderListing openFolder(Path folder) throws IOException {
        FolderListing listing = FolderListing.scan(folder);
        session.openFolder(folder);
        decodedCache.clear();
        previewStore.clear();
        toneMapper.reset();
        LOG.log(Level.INFO, "{0} files in {1}", new Object[]{listing.getActive().size(), folder.getFileName()});
        return listing;
    }

    /**
     * Decode a file, or return it from the cache, and make it the current
     * file of the session.
     *
     * @param path The file
     * @return The normalized image
     * @throws ImageFormatException If the file cannot be decoded
     */
    public DecodedImage decode(Path path) throws ImageFormatException {
        Optional<DecodedImage> cached = decodedCache.get(path);
        DecodedImage image;
        if (cached.isPresent()) {
            LOG.log(Level.FINE, "Decoded cache hit for {0}", path);
            image = cached.get();
        } else {
            image = ImageDecoder.decode(path);
            decodedCache.put(path, image);
        }
        session.setCurrentFile(path);
        return image;
    }

    public BufferedImage toneMap(DecodedImage image, ToneMapParameters parameters) throws ImageFormatException {
        return toneMapper.apply(image, parameters);
    }

    /**
     * Decode a file and tone-map it with the current parameters of the
     * session.
     *
     * @param path The file
     * @return The display image
     * @throws ImageFormatException If the file cannot be decoded or displayed
     */
    public BufferedImage render(Path path) throws ImageFormatException {
        return toneMap(decode(path), session.getParameters());
    }

    public Optional<PreviewEntry> getPreview(Path path) {
        return previewStore.get(path);
    }

    public ThumbnailRun startThumbnailRun(List<Path> paths) {
        return thumbnails.startRun(paths, session.getFolderToken());
    }

    public CompletableFuture<ThumbnailSummary> startThumbnailRun(List<Path> paths, Executor executor, Consumer<ThumbnailProgress> listener) {
        return thumbnails.runInBackground(paths, session.getFolderToken(), executor, listener);
    }

    /**
     * Forget everything cached for a file, to be called after the file has
     * been modified, moved or deleted.
     *
     * @param path The file
     */
    public void invalidate(Path path) {
        decodedCache.invalidate(path);
        previewStore.invalidate(path);
        if (path.equals(session.getCurrentFile())) {
            toneMapper.reset();
        }
    }

    public BrowsingSession getSession() {
        return session;
    }

    public DecodedImageCache getDecodedCache() {
        return decodedCache;
    }

    public PreviewStore getPreviewStore() {
        return previewStore;
    }

    public ThumbnailPipeline getThumbnailPipeline() {
        return thumbnails;
    }
}
