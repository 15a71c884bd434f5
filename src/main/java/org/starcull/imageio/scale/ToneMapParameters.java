package org.starcull.imageio.scale;

/**
 * Display parameters for the tone-map. Instances are immutable. Two sets of
 * parameters are considered the same when {@link #isCloseTo} holds, which is
 * how a redundant recompute is avoided after a slider moves back and forth.
 *
 * @author tonyj
 */
public final class ToneMapParameters {

    private static final double RELATIVE_TOLERANCE = 1e-5;
    private static final double ABSOLUTE_TOLERANCE = 1e-8;

    public static final ToneMapParameters IDENTITY = new ToneMapParameters(0, 1, 1, 1);

    private final double stretch;
    private final double gamma;
    private final double brightness;
    private final double contrast;

    /**
     * Create a parameter set.
     *
     * @param stretch The effective asinh stretch factor, 0 for none
     * @param gamma The gamma, 0 is treated as 1
     * @param brightness The brightness multiplier
     * @param contrast The contrast around mid grey
     */
    public ToneMapParameters(double stretch, double gamma, double brightness, double contrast) {
        if (!(stretch >= 0)) {
            throw new IllegalArgumentException("Stretch must be >= 0: " + stretch);
        }
        if (!(gamma >= 0) || !(brightness > 0) || !(contrast > 0)) {
            throw new IllegalArgumentException("Invalid gamma/brightness/contrast: " + gamma + "/" + brightness + "/" + contrast);
        }
        this.stretch = stretch;
        this.gamma = gamma == 0 ? 1 : gamma;
        this.brightness = brightness;
        this.contrast = contrast;
    }

    /**
     * Build parameters from the viewer controls, where the effective stretch
     * is the product of a base value and a multiplier.
     *
     * @param stretchBase The base stretch (0..100)
     * @param multiplier The stretch multiplier (0..10000)
     * @param gamma The gamma
     * @param brightness The brightness
     * @param contrast The contrast
     * @return The parameters
     */
    public static ToneMapParameters fromControls(double stretchBase, double multiplier, double gamma, double brightness, double contrast) {
        return new ToneMapParameters(stretchBase * multiplier, gamma, brightness, contrast);
    }

    public double getStretch() {
        return stretch;
    }

    public double getGamma() {
        return gamma;
    }

    public double getBrightness() {
        return brightness;
    }

    public double getContrast() {
        return contrast;
    }

    public ToneMapParameters withStretch(double newStretch) {
        return new ToneMapParameters(newStretch, gamma, brightness, contrast);
    }

    public ToneMapParameters withGamma(double newGamma) {
        return new ToneMapParameters(stretch, newGamma, brightness, contrast);
    }

    public ToneMapParameters withBrightness(double newBrightness) {
        return new ToneMapParameters(stretch, gamma, newBrightness, contrast);
    }

    public ToneMapParameters withContrast(double newContrast) {
        return new ToneMapParameters(stretch, gamma, brightness, newContrast);
    }

    /**
     * True if every component of this set is within tolerance of the
     * corresponding component of other, using
     * {@code |a-b| <= 1e-8 + 1e-5*|b|}.
     *
     * @param other The parameters to compare against, may be null
     * @return True if no recompute is needed
     */
    public boolean isCloseTo(ToneMapParameters other) {
        return other != null
                && close(stretch, other.stretch)
                && close(gamma, other.gamma)
                && close(brightness, other.brightness)
                && close(contrast, other.contrast);
    }

    private static boolean close(double a, double b) {
        return Math.abs(a - b) <= ABSOLUTE_TOLERANCE + RELATIVE_TOLERANCE * Math.abs(b);
    }

    @Override
    public String toString() {
        return "ToneMapParameters{" + "stretch=" + stretch + ", gamma=" + gamma + ", brightness=" + brightness + ", contrast=" + contrast + '}';
    }
}
