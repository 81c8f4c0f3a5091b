package nl.nfi.cnfnorm.normalize;

import nl.nfi.cnfnorm.common.ini.IniConfig;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.normalize.stage.VariableAllocator;

import java.io.IOException;
import java.nio.file.Path;

// settings of a normalization run, e.g. loaded from:
//      [PIPELINE]
//      new_start_symbol = S0
//      helper_letters = ZYXWVUTSRQPONMLKJIHGFEDCBA
//      helper_fallback_prefix = D
//      reuse_cascades = true
//      [TRACE]
//      include_snapshots = false
public record NormalizerConfig(NonTerminal newStartSymbol,
                               String helperLetters,
                               String helperFallbackPrefix,
                               boolean reuseCascades,
                               boolean includeSnapshots) {

    private static final String PIPELINE = "PIPELINE";
    private static final String TRACE = "TRACE";

    private static final NormalizerConfig DEFAULTS = new NormalizerConfig(
            NonTerminal.of("S0"),
            VariableAllocator.DEFAULT_LETTERS,
            VariableAllocator.DEFAULT_FALLBACK_PREFIX,
            true,
            false
    );

    public static NormalizerConfig defaults() {
        return DEFAULTS;
    }

    public static NormalizerConfig loadFrom(final Path path) throws IOException {
        final IniConfig ini = IniConfig.loadFrom(path);

        final NormalizerConfig config = new NormalizerConfig(
                ini.hasKey(PIPELINE, "new_start_symbol")
                        ? NonTerminal.of(ini.getString(PIPELINE, "new_start_symbol"))
                        : DEFAULTS.newStartSymbol,
                ini.hasKey(PIPELINE, "helper_letters")
                        ? ini.getString(PIPELINE, "helper_letters")
                        : DEFAULTS.helperLetters,
                ini.hasKey(PIPELINE, "helper_fallback_prefix")
                        ? ini.getString(PIPELINE, "helper_fallback_prefix")
                        : DEFAULTS.helperFallbackPrefix,
                ini.hasKey(PIPELINE, "reuse_cascades")
                        ? ini.getBoolean(PIPELINE, "reuse_cascades")
                        : DEFAULTS.reuseCascades,
                ini.hasKey(TRACE, "include_snapshots")
                        ? ini.getBoolean(TRACE, "include_snapshots")
                        : DEFAULTS.includeSnapshots
        );
        // fail on bad helper settings now, not halfway through a run
        config.newAllocator();
        return config;
    }

    public VariableAllocator newAllocator() {
        return VariableAllocator.create(helperLetters, helperFallbackPrefix);
    }

    public NormalizerConfig withReuseCascades(final boolean reuseCascades) {
        return new NormalizerConfig(newStartSymbol, helperLetters, helperFallbackPrefix, reuseCascades, includeSnapshots);
    }

    public NormalizerConfig withIncludeSnapshots(final boolean includeSnapshots) {
        return new NormalizerConfig(newStartSymbol, helperLetters, helperFallbackPrefix, reuseCascades, includeSnapshots);
    }
}
