package io.botflow.core.handle;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HandleSpec")
class HandleSpecTest {

    @Test
    void shouldDescribeInputPortOnLeftEdge() {
        HandleSpec spec = HandleSpec.inputHandle();

        assertThat(spec.id()).isEqualTo(HandleId.INPUT);
        assertThat(spec.input()).isTrue();
        assertThat(spec.side()).isEqualTo(HandleSide.LEFT);
        assertThat(spec.order()).isZero();
    }

    @Test
    void shouldDescribeOutputPortOnRightEdge() {
        HandleSpec spec =
                HandleSpec.output(HandleId.ANSWER, "Answer", 0, HandleVariant.DEFAULT);

        assertThat(spec.input()).isFalse();
        assertThat(spec.side()).isEqualTo(HandleSide.RIGHT);
        assertThat(spec.label()).isEqualTo("Answer");
    }
}
