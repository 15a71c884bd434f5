package org.starcull.imageio.preview;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.starcull.imageio.BrowsingSession.FolderToken;
import org.starcull.imageio.DecodedImage;
import org.starcull.imageio.ImageDecoder;
import org.starcull.imageio.ImageFormatException;
import org.starcull.imageio.ImageFormatException.Reason;
import org.starcull.imageio.Timed;
import org.starcull.imageio.scale.Normalizer;
import org.starcull.imageio.scale.ToneMapParameters;
import org.starcull.imageio.scale.ToneMapper;

/**
 * Generates small grey scale previews using a fixed tone-map, independent of
 * the display parameters of the interactive path.
 *
 * @author tonyj
 */
public class ThumbnailPipeline {

    public static final ToneMapParameters PREVIEW_PARAMETERS = new ToneMapParameters(50, 1.2, 1.0, 1.0);
    static final int DEFAULT_MAX_WIDTH = 400;

    private final PreviewStore store;
    private final int maxWidth;

    public ThumbnailPipeline(PreviewStore store) {
        this(store, Integer.getInteger("org.starcull.imageio.previewMaxWidth", DEFAULT_MAX_WIDTH));
    }

    public ThumbnailPipeline(PreviewStore store, int maxWidth) {
        if (maxWidth < 1) {
            throw new IllegalArgumentException("Preview width must be at least 1: " + maxWidth);
        }
        this.store = store;
        this.maxWidth = maxWidth;
    }

    public PreviewStore getStore() {
        return store;
    }

    public int getMaxWidth() {
        return maxWidth;
    }

    /**
     * Create the preview for one file without publishing it.
     *
     * @param path The file
     * @return The preview
     * @throws ImageFormatException If the file cannot be decoded
     */
    public PreviewEntry generate(Path path) throws ImageFormatException {
        try {
            return Timed.execute(() -> {
                DecodedImage image = Normalizer.normalize(ImageDecoder.readRaw(path));
                BufferedImage grey = toGrey(image);
                return new PreviewEntry(path, downsample(grey), image.getWidth(), image.getHeight());
            }, "Preview of %s took %dms", path);
        } catch (ImageFormatException x) {
            throw x;
        } catch (IOException x) {
            throw new ImageFormatException(Reason.IO_ERROR, "Error creating preview of " + path, x);
        }
    }

    /**
     * Start a lazy run over the given files. Each call returns a new run.
     *
     * @param paths The files, in the order they should be processed
     * @param token The folder the files belong to
     * @return The run, nothing happens until it is iterated
     */
    public ThumbnailRun startRun(List<Path> paths, FolderToken token) {
        return new ThumbnailRun(this, paths, token);
    }

    /**
     * Drive a run to its end on the given executor.
     *
     * @param paths The files
     * @param token The folder the files belong to
     * @param executor Where the work is done
     * @param listener Receives every progress event, on the executor thread
     * @return The summary once the run has finished or was abandoned
     */
    public CompletableFuture<ThumbnailSummary> runInBackground(List<Path> paths, FolderToken token, Executor executor, Consumer<ThumbnailProgress> listener) {
        ThumbnailRun run = startRun(paths, token);
        return CompletableFuture.supplyAsync(() -> {
            run.forEachRemaining(listener);
            return run.getSummary();
        }, executor);
    }

    private BufferedImage toGrey(DecodedImage image) throws ImageFormatException {
        int n = image.getWidth() * image.getHeight();
        float[] grey = new float[n];
        if (image.getChannels() == 3) {
            float[] plane = new float[n];
            float[] weights = {0.299f, 0.587f, 0.114f};
            for (int c = 0; c < 3; c++) {
                image.copyChannel(c, plane);
                for (int i = 0; i < n; i++) {
                    grey[i] += weights[c] * plane[i];
                }
            }
        } else {
            image.copyChannel(0, grey);
        }
        ToneMapper.transform(grey, grey, PREVIEW_PARAMETERS);
        return ToneMapper.rasterize(grey, image.getWidth(), image.getHeight(), 1);
    }

    BufferedImage downsample(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        if (width <= maxWidth) {
            return source;
        }
        int newHeight = Math.max(1, (int) (height * (double) maxWidth / width));
        BufferedImage result = new BufferedImage(maxWidth, newHeight, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = result.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, maxWidth, newHeight, null);
        } finally {
            g.dispose();
        }
        return result;
    }
}
