package org.starcull.imageio;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.imageio.ImageIO;
import org.starcull.imageio.preview.ThumbnailProgress;
import org.starcull.imageio.preview.ThumbnailSummary;
import org.starcull.imageio.scale.ToneMapPreset;

/**
 * Renders a file, or every file of a folder, to PNG.
 * <p>
 * Usage: {@code Main <file-or-folder> [preset] [output-folder]}, where preset
 * is one of LINEAR, DEFAULT, MEDIUM, HIGH, MAXIMUM or PREVIEW (thumbnails
 * only).
 *
 * @author tonyj
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws IOException {
        if (args.length < 1) {
            System.err.println("Usage: Main <file-or-folder> [preset] [output-folder]");
            System.exit(1);
        }
        Path input = Paths.get(args[0]);
        String presetName = args.length > 1 ? args[1] : ToneMapPreset.DEFAULT.name();
        Path output = args.length > 2 ? Paths.get(args[2]) : Paths.get(".");
        Files.createDirectories(output);

        ImageCore core = new ImageCore();
        List<Path> files;
        if (Files.isDirectory(input)) {
            files = core.openFolder(input).getActivePaths();
        } else {
            core.openFolder(input.toAbsolutePath().getParent());
            files = List.of(input);
        }

        if ("PREVIEW".equalsIgnoreCase(presetName)) {
            writePreviews(core, files, output);
        } else {
            core.getSession().applyPreset(ToneMapPreset.forName(presetName));
            int failed = 0;
            for (Path file : files) {
                try {
                    BufferedImage image = Timed.execute(Level.INFO, () -> core.render(file), "Rendered %s in %dms", file.getFileName());
                    ImageIO.write(image, "png", output.resolve(pngName(file)).toFile());
                } catch (ImageFormatException x) {
                    LOG.log(Level.WARNING, "Skipping " + file, x);
                    failed++;
                }
            }
            LOG.log(Level.INFO, "Rendered {0}/{1} files", new Object[]{files.size() - failed, files.size()});
        }
    }

    private static void writePreviews(ImageCore core, List<Path> files, Path output) throws IOException {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            ThumbnailSummary summary = core.startThumbnailRun(files, executor, (progress) -> {
                LOG.log(Level.INFO, "{0}", progress);
                if (progress.getStatus() == ThumbnailProgress.Status.CREATED) {
                    BufferedImage preview = core.getPreview(progress.getPath()).orElseThrow().getImage();
                    try {
                        ImageIO.write(preview, "png", output.resolve(pngName(progress.getPath())).toFile());
                    } catch (IOException x) {
                        throw new CompletionException("Error writing preview for " + progress.getPath(), x);
                    }
                }
            }).join();
            LOG.log(Level.INFO, "{0}", summary);
        } catch (CompletionException x) {
            if (x.getCause() instanceof IOException) {
                throw (IOException) x.getCause();
            }
            throw x;
        } finally {
            executor.shutdown();
        }
    }

    static String pngName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot < 0 ? name : name.substring(0, dot)) + ".png";
    }
}
