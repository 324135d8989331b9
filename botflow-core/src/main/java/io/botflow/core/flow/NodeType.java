package io.botflow.core.flow;

import java.util.Optional;

/// Structural type of a flow node as written on the wire.
///
/// A `MENU` node carries menu options; an `ACTION` node carries an action payload
/// whose kind decides its output handles.
public enum NodeType {
    MENU("menu"),
    ACTION("action");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Resolves a wire name (`"menu"` / `"action"`), case-insensitive.
    ///
    /// @param value wire name, may be null
    /// @return matching type, or empty if unrecognized
    public static Optional<NodeType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (NodeType type : values()) {
            if (type.wireName.equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
