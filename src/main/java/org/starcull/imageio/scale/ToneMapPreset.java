package org.starcull.imageio.scale;

import java.util.Locale;
import java.util.Optional;

/**
 * Named tone-map settings, selectable with the keys 0 to 4.
 *
 * @author tonyj
 */
public enum ToneMapPreset {

    LINEAR('0', 0, 1, 1.0, 1.0, 1.0),
    DEFAULT('1', 10, 1000, 0.7, 1.0, 1.5),
    MEDIUM('2', 20, 2000, 1.0, 1.0, 1.2),
    HIGH('3', 50, 5000, 0.5, 1.1, 1.8),
    MAXIMUM('4', 100, 10000, 0.4, 1.2, 2.0);

    private final char key;
    private final double stretchBase;
    private final double multiplier;
    private final ToneMapParameters parameters;

    ToneMapPreset(char key, double stretchBase, double multiplier, double gamma, double brightness, double contrast) {
        this.key = key;
        this.stretchBase = stretchBase;
        this.multiplier = multiplier;
        this.parameters = ToneMapParameters.fromControls(stretchBase, multiplier, gamma, brightness, contrast);
    }

    public char getKey() {
        return key;
    }

    public double getStretchBase() {
        return stretchBase;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public ToneMapParameters getParameters() {
        return parameters;
    }

    public static Optional<ToneMapPreset> forKey(char key) {
        for (ToneMapPreset preset : values()) {
            if (preset.key == key) {
                return Optional.of(preset);
            }
        }
        return Optional.empty();
    }

    public static ToneMapPreset forName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException x) {
            throw new IllegalArgumentException("Unknown tone-map preset: " + name, x);
        }
    }
}
