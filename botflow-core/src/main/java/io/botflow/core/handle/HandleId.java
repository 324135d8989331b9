package io.botflow.core.handle;

import java.util.Optional;

/// Wire grammar of handle ids.
///
/// ```
/// out:default
/// out:menu:<optionId>
/// out:button:<itemId>
/// out:button:more
/// out:answer
/// out:invalid
/// out:schedule:in
/// out:schedule:out
/// in
/// ```
///
/// These strings are stable and persisted by callers; never change them.
public final class HandleId {

    public static final String DEFAULT = "out:default";
    public static final String BUTTON_MORE = "out:button:more";
    public static final String ANSWER = "out:answer";
    public static final String INVALID = "out:invalid";
    public static final String SCHEDULE_IN = "out:schedule:in";
    public static final String SCHEDULE_OUT = "out:schedule:out";
    public static final String INPUT = "in";

    /// Item id reserved for the overflow handle; no button item may use it.
    public static final String RESERVED_MORE_TOKEN = "more";

    private static final String MENU_PREFIX = "out:menu:";
    private static final String BUTTON_PREFIX = "out:button:";

    private HandleId() {}

    public static String menuOption(String optionId) {
        return MENU_PREFIX + optionId;
    }

    public static String button(String itemId) {
        return BUTTON_PREFIX + itemId;
    }

    /// Parses a handle id.
    ///
    /// @param handleId handle id, may be null
    /// @return parsed handle, or empty if the id does not follow the grammar
    public static Optional<ParsedHandle> parse(String handleId) {
        if (handleId == null) {
            return Optional.empty();
        }
        switch (handleId) {
            case DEFAULT:
                return Optional.of(ParsedHandle.of(HandleType.DEFAULT));
            case BUTTON_MORE:
                return Optional.of(ParsedHandle.of(HandleType.BUTTON_MORE));
            case ANSWER:
                return Optional.of(ParsedHandle.of(HandleType.ANSWER));
            case INVALID:
                return Optional.of(ParsedHandle.of(HandleType.INVALID));
            case SCHEDULE_IN:
                return Optional.of(ParsedHandle.of(HandleType.SCHEDULE_IN));
            case SCHEDULE_OUT:
                return Optional.of(ParsedHandle.of(HandleType.SCHEDULE_OUT));
            case INPUT:
                return Optional.of(ParsedHandle.of(HandleType.INPUT));
            default:
                break;
        }
        if (handleId.startsWith(MENU_PREFIX) && handleId.length() > MENU_PREFIX.length()) {
            return Optional.of(
                    new ParsedHandle(
                            HandleType.MENU_OPTION, handleId.substring(MENU_PREFIX.length())));
        }
        if (handleId.startsWith(BUTTON_PREFIX) && handleId.length() > BUTTON_PREFIX.length()) {
            String token = handleId.substring(BUTTON_PREFIX.length());
            return Optional.of(new ParsedHandle(HandleType.BUTTON, token));
        }
        return Optional.empty();
    }
}
