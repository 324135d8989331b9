package io.botflow.core.handle;

/// A handle id split into its category and, for option/button handles, the entry id.
///
/// @param type handle category, never null
/// @param token option or item id for {@link HandleType#MENU_OPTION} and
///     {@link HandleType#BUTTON}, null otherwise
public record ParsedHandle(HandleType type, String token) {

    public static ParsedHandle of(HandleType type) {
        return new ParsedHandle(type, null);
    }

    public boolean isOutput() {
        return type != HandleType.INPUT;
    }
}
