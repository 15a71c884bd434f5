package org.starcull.imageio.scale;

import java.util.logging.Logger;
import org.starcull.imageio.DecodedImage;
import org.starcull.imageio.RawImage;

/**
 * Maps the raw samples of one file onto [0,1] using that file's own minimum
 * and maximum. Only finite samples take part in the min/max; NaN and
 * negative infinity end up as 0, positive infinity as 1. A flat image
 * (max == min) normalizes to all zeros.
 *
 * @author tonyj
 */
public class Normalizer {

    private static final Logger LOG = Logger.getLogger(Normalizer.class.getName());

    private Normalizer() {
    }

    public static DecodedImage normalize(RawImage raw) {
        float[] in = raw.getSamples();
        float min = Float.POSITIVE_INFINITY;
        float max = Float.NEGATIVE_INFINITY;
        for (float f : in) {
            if (Float.isNaN(f) || Float.isInfinite(f)) {
                continue;
            }
            if (f < min) {
                min = f;
            }
            if (f > max) {
                max = f;
            }
        }
        final float lo = min;
        final float hi = max;
        LOG.fine(() -> String.format("%s min=%g max=%g", raw, lo, hi));
        float[] out = new float[in.length];
        if (max > min) {
            double range = (double) max - min;
            for (int i = 0; i < in.length; i++) {
                float f = in[i];
                if (Float.isNaN(f)) {
                    out[i] = 0f;
                } else if (Float.isInfinite(f)) {
                    out[i] = f > 0 ? 1f : 0f;
                } else {
                    out[i] = (float) ((f - (double) min) / range);
                }
            }
        }
        return new DecodedImage(raw.getFormat(), raw.getWidth(), raw.getHeight(), raw.getChannels(), out);
    }
}
