package org.starcull.imageio.scale;

/**
 * Inverse hyperbolic sine stretch, which lifts faint values while compressing
 * bright ones. A stretch factor of zero (or less) leaves values unchanged.
 *
 * @author tonyj
 */
public class AsinhStretch {

    private AsinhStretch() {
    }

    public static double apply(double value, double factor) {
        if (factor <= 0) {
            return value;
        }
        return asinh(value * factor) / asinh(factor);
    }

    static double asinh(double x) {
        if (x < 0) {
            return -asinh(-x);
        }
        return Math.log(x + Math.sqrt(x * x + 1.0));
    }
}
