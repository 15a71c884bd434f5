package org.starcull.imageio;

import java.io.IOException;

/**
 * Thrown when an exposure cannot be parsed, decoded or rendered. The
 * {@link Reason} identifies which stage of the pipeline rejected the file.
 *
 * @author tonyj
 */
public class ImageFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        MALFORMED_CONTAINER,
        NO_IMAGE_ELEMENT,
        INVALID_GEOMETRY,
        UNSUPPORTED_SAMPLE_FORMAT,
        UNSUPPORTED_LOCATION,
        DECOMPRESSION_FAILED,
        SIZE_MISMATCH,
        UNSUPPORTED_CHANNEL_LAYOUT,
        UNSUPPORTED_FILE_TYPE,
        IO_ERROR
    }

    private final Reason reason;

    public ImageFormatException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ImageFormatException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String getMessage() {
        return reason + ": " + super.getMessage();
    }
}
