package io.botflow.core.handle;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("HandleId")
class HandleIdTest {

    @Test
    void shouldParseFixedHandles() {
        assertThat(HandleId.parse("out:default")).contains(ParsedHandle.of(HandleType.DEFAULT));
        assertThat(HandleId.parse("out:button:more"))
                .contains(ParsedHandle.of(HandleType.BUTTON_MORE));
        assertThat(HandleId.parse("out:answer")).contains(ParsedHandle.of(HandleType.ANSWER));
        assertThat(HandleId.parse("out:invalid")).contains(ParsedHandle.of(HandleType.INVALID));
        assertThat(HandleId.parse("out:schedule:in"))
                .contains(ParsedHandle.of(HandleType.SCHEDULE_IN));
        assertThat(HandleId.parse("out:schedule:out"))
                .contains(ParsedHandle.of(HandleType.SCHEDULE_OUT));
        assertThat(HandleId.parse("in")).contains(ParsedHandle.of(HandleType.INPUT));
    }

    @Test
    void shouldParseTokenizedHandles() {
        assertThat(HandleId.parse("out:menu:menu-1"))
                .contains(new ParsedHandle(HandleType.MENU_OPTION, "menu-1"));
        assertThat(HandleId.parse("out:button:btn-2"))
                .contains(new ParsedHandle(HandleType.BUTTON, "btn-2"));
        assertThat(HandleId.parse(HandleId.menuOption("a:b")))
                .contains(new ParsedHandle(HandleType.MENU_OPTION, "a:b"));
    }

    @Test
    void shouldMarkOnlyInputAsNonOutput() {
        assertThat(ParsedHandle.of(HandleType.INPUT).isOutput()).isFalse();
        assertThat(ParsedHandle.of(HandleType.DEFAULT).isOutput()).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(
            strings = {
                "out:menu:", "out:button:", "out:", "default", "out:schedule", "OUT:DEFAULT"
            })
    void shouldRejectMalformedIds(String handleId) {
        assertThat(HandleId.parse(handleId)).isEmpty();
    }
}
