package org.starcull.imageio.preview;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * A downsampled preview of one file. The image is never modified after the
 * entry is published.
 *
 * @author tonyj
 */
public final class PreviewEntry {

    private final Path path;
    private final BufferedImage image;
    private final int sourceWidth;
    private final int sourceHeight;

    public PreviewEntry(Path path, BufferedImage image, int sourceWidth, int sourceHeight) {
        this.path = path;
        this.image = image;
        this.sourceWidth = sourceWidth;
        this.sourceHeight = sourceHeight;
    }

    public Path getPath() {
        return path;
    }

    public BufferedImage getImage() {
        return image;
    }

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }

    public int getSourceWidth() {
        return sourceWidth;
    }

    public int getSourceHeight() {
        return sourceHeight;
    }

    @Override
    public String toString() {
        return "PreviewEntry{" + "path=" + path + ", " + getWidth() + "x" + getHeight() + " from " + sourceWidth + "x" + sourceHeight + '}';
    }
}
