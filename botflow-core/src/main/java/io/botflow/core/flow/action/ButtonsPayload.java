package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;
import java.util.ArrayList;
import java.util.List;

/// Quick-reply buttons capped by a channel-specific maximum.
///
/// Items beyond `maxButtons` are overflow: they get no button handle of their own, and
/// the node exposes `out:button:more` instead, whose target is `moreTargetId`.
///
/// @param items all buttons in display order, never null once constructed
/// @param maxButtons visible button cap; values below 1 mean "unset" until normalized
/// @param moreTargetId target of the `more` handle, or null
public record ButtonsPayload(List<ButtonItem> items, int maxButtons, String moreTargetId)
        implements ActionPayload {

    public ButtonsPayload {
        items = items == null ? List.of() : copyWithoutNulls(items);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BUTTONS;
    }

    /// Returns the items that get their own handle.
    ///
    /// @return first `maxButtons` items, never null
    public List<ButtonItem> visibleItems() {
        if (maxButtons < 1 || items.size() <= maxButtons) {
            return items;
        }
        return items.subList(0, maxButtons);
    }

    /// Returns whether more items exist than can be shown as buttons.
    public boolean hasOverflow() {
        return maxButtons >= 1 && items.size() > maxButtons;
    }

    public ButtonsPayload withItems(List<ButtonItem> newItems) {
        return new ButtonsPayload(newItems, maxButtons, moreTargetId);
    }

    public ButtonsPayload withMoreTargetId(String newMoreTargetId) {
        return new ButtonsPayload(items, maxButtons, newMoreTargetId);
    }

    private static List<ButtonItem> copyWithoutNulls(List<ButtonItem> source) {
        List<ButtonItem> copy = new ArrayList<>(source.size());
        for (ButtonItem item : source) {
            if (item != null) {
                copy.add(item);
            }
        }
        return List.copyOf(copy);
    }
}
