package io.botflow.core.flow;

/// One selectable entry of a menu node; each option owns the output handle
/// `out:menu:<id>`.
///
/// `id` and `label` may be null on freshly imported data; the normalizer fills them.
///
/// @param id option identifier, unique within its node once normalized
/// @param label text shown to the end user
/// @param value optional payload value reported when the option is picked
/// @param targetId node reached when the option is picked, or null when unbound
public record MenuOption(String id, String label, String value, String targetId) {

    public MenuOption withTargetId(String newTargetId) {
        return new MenuOption(id, label, value, newTargetId);
    }

    public MenuOption withId(String newId) {
        return new MenuOption(newId, label, value, targetId);
    }
}
