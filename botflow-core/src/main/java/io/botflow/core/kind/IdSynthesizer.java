package io.botflow.core.kind;

import java.util.Set;

/// Deterministic ids for synthesized menu options and button items.
///
/// The id of the entry at position `n` (1-based) is `<prefix>-<n>`; when that id is
/// already taken within the node, `-2`, `-3`, ... is appended until it is free.
public final class IdSynthesizer {

    public static final String OPTION_PREFIX = "menu";
    public static final String BUTTON_PREFIX = "btn";

    private IdSynthesizer() {}

    /// @param prefix id prefix
    /// @param ordinal 1-based position of the entry
    /// @param taken ids already used in the node
    /// @return an id not contained in `taken`
    public static String synthesize(String prefix, int ordinal, Set<String> taken) {
        String base = prefix + "-" + ordinal;
        if (!taken.contains(base)) {
            return base;
        }
        int suffix = 2;
        while (taken.contains(base + "-" + suffix)) {
            suffix++;
        }
        return base + "-" + suffix;
    }
}
