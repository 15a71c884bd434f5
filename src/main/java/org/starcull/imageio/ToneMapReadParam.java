package org.starcull.imageio;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import javax.imageio.ImageReadParam;
import org.starcull.imageio.scale.ToneMapParameters;
import org.starcull.imageio.scale.ToneMapPreset;

/**
 * Read parameters for {@link AstroImageReader}: the tone-map to apply, either
 * one of the named presets or explicit parameters.
 *
 * @author tonyj
 */
public class ToneMapReadParam extends ImageReadParam {

    public static final ToneMapPreset DEFAULT_PRESET = ToneMapPreset.DEFAULT;

    private ToneMapPreset preset = DEFAULT_PRESET;
    private ToneMapParameters parameters = DEFAULT_PRESET.getParameters();

    public ToneMapParameters getParameters() {
        return parameters;
    }

    /**
     * Use explicit parameters. The preset name becomes null unless the
     * parameters are close to one of the presets.
     *
     * @param parameters The parameters
     */
    public void setParameters(ToneMapParameters parameters) {
        this.parameters = parameters;
        this.preset = null;
        for (ToneMapPreset p : ToneMapPreset.values()) {
            if (parameters.isCloseTo(p.getParameters())) {
                this.preset = p;
                break;
            }
        }
    }

    public void setPreset(ToneMapPreset preset) {
        this.preset = preset;
        this.parameters = preset.getParameters();
    }

    public void setPreset(String name) {
        setPreset(ToneMapPreset.forName(name));
    }

    public String getPresetName() {
        return preset == null ? null : preset.name();
    }

    public Set<String> getAvailablePresets() {
        Set<String> result = new LinkedHashSet<>();
        for (ToneMapPreset p : ToneMapPreset.values()) {
            result.add(p.name());
        }
        return Collections.unmodifiableSet(result);
    }
}
