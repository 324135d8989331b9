package io.botflow.core.flow.action;

/// One quick-reply button; owns the handle `out:button:<id>` while visible.
///
/// @param id button identifier, unique within its node once normalized
/// @param label text on the button
/// @param value value reported when the button is pressed
/// @param targetId node reached when pressed, or null when unbound
public record ButtonItem(String id, String label, String value, String targetId) {

    public ButtonItem withTargetId(String newTargetId) {
        return new ButtonItem(id, label, value, newTargetId);
    }
}
