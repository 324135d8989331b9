package io.botflow.core.validation;

import static io.botflow.core.FlowFixtures.action;
import static io.botflow.core.FlowFixtures.flow;
import static io.botflow.core.FlowFixtures.menu;
import static io.botflow.core.FlowFixtures.message;
import static io.botflow.core.FlowFixtures.option;
import static org.assertj.core.api.Assertions.assertThat;

import io.botflow.core.flow.Flow;
import io.botflow.core.flow.action.AskPayload;
import io.botflow.core.flow.action.AskValidation;
import io.botflow.core.flow.action.AskVarType;
import io.botflow.core.flow.action.AttachmentPayload;
import io.botflow.core.flow.action.ButtonItem;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.MessagePayload;
import io.botflow.core.flow.action.SchedulerMode;
import io.botflow.core.flow.action.SchedulerPayload;
import io.botflow.core.flow.action.WebhookOutPayload;
import io.botflow.core.kind.NodeKindRegistry;
import io.botflow.core.schedule.CustomSchedule;
import io.botflow.core.schedule.ScheduleEvaluator;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FlowValidator")
class FlowValidatorTest {

    private final FlowValidator validator =
            new FlowValidator(new NodeKindRegistry(), new ScheduleEvaluator());

    @Test
    void shouldAcceptCompleteFlow() {
        Flow flow = flow("root", menu("root", option("menu-1", "1")), message("1", null));

        ValidationResult result = validator.validate(flow);

        assertThat(result.issues()).isEmpty();
        assertThat(result.isValid()).isTrue();
    }

    @Test
    void shouldReportMissingFlowIdAsErrorAndMissingNameAsWarning() {
        Flow flow =
                flow("root", menu("root", option("menu-1", "1")), message("1", null))
                        .toBuilder()
                        .id("")
                        .name("")
                        .build();

        ValidationResult result = validator.validate(flow);

        assertThat(result.errors())
                .extracting(ValidationIssue::code)
                .containsExactly("MISSING_FLOW_ID");
        assertThat(result.warnings())
                .extracting(ValidationIssue::code)
                .containsExactly("MISSING_FLOW_NAME");
        assertThat(result.isValid()).isFalse();
    }

    @Nested
    @DisplayName("structure")
    class Structure {

        @Test
        void shouldReportDanglingTargetsOfRawFlow() {
            Flow flow = flow("root", menu("root", option("menu-1", "1")), message("1", "ghost"));

            ValidationResult result = validator.validate(flow);

            assertThat(result.hasCode("INVALID_TARGET")).isTrue();
            assertThat(result.hasCode("INVALID_CHILD")).isTrue();
            assertThat(result.errors()).allMatch(issue -> "1".equals(issue.nodeId()));
        }

        @Test
        void shouldWarnAboutUnreachableNodes() {
            Flow flow =
                    flow(
                            "root",
                            menu("root", option("menu-1", "1")),
                            message("1", null),
                            message("island", null));

            ValidationResult result = validator.validate(flow);

            assertThat(result.warnings())
                    .singleElement()
                    .satisfies(
                            issue -> {
                                assertThat(issue.code()).isEqualTo("ORPHANED_NODE");
                                assertThat(issue.nodeId()).isEqualTo("island");
                            });
            assertThat(result.isValid()).isTrue();
        }

        @Test
        void shouldDescribeLoopByNodeLabels() {
            // Given
            Flow flow =
                    flow(
                            "root",
                            menu("root", option("menu-1", "1")),
                            message("1", "2"),
                            message("2", "1"));

            // When
            ValidationResult result = validator.validate(flow);

            // Then
            assertThat(result.issues())
                    .filteredOn(issue -> issue.code().equals("INFINITE_LOOP"))
                    .singleElement()
                    .satisfies(
                            issue -> {
                                assertThat(issue.nodeId()).isEqualTo("1");
                                assertThat(issue.message())
                                        .isEqualTo("Loop detected: Node 1 → Node 2 → Node 1");
                                assertThat(issue.level()).isEqualTo(ValidationLevel.WARNING);
                            });
        }

        @Test
        void shouldFollowHandleTargetsWhenChildrenAreNotDerived() {
            // Given
            AskPayload ask =
                    new AskPayload(
                            "Age?",
                            "age",
                            AskVarType.NUMBER,
                            AskValidation.NONE,
                            "Again?",
                            "1",
                            "q");
            Flow flow =
                    flow(
                            "root",
                            menu("root", option("menu-1", "q")),
                            action("q", ask, null),
                            message("1", null));

            // When
            ValidationResult result = validator.validate(flow);

            // Then
            assertThat(result.hasCode("ORPHANED_NODE")).isFalse();
            assertThat(result.issues())
                    .filteredOn(issue -> issue.code().equals("INFINITE_LOOP"))
                    .singleElement()
                    .extracting(ValidationIssue::message)
                    .isEqualTo("Loop detected: Node q → Node q");
        }

        @Test
        void shouldValidateVeryLongChainWithoutOverflowingStack() {
            // Given
            int length = 50_000;
            Flow.Builder builder =
                    flow("root", menu("root", option("menu-1", "1"))).toBuilder();
            for (int i = 1; i <= length; i++) {
                builder.node(message(String.valueOf(i), i < length ? String.valueOf(i + 1) : null));
            }
            Flow flow = builder.build();

            // When
            ValidationResult result = validator.validate(flow);

            // Then
            assertThat(result.issues()).isEmpty();
        }

        @Test
        void shouldFindLoopAtEndOfVeryLongChain() {
            // Given
            int length = 50_000;
            Flow.Builder builder =
                    flow("root", menu("root", option("menu-1", "1"))).toBuilder();
            for (int i = 1; i <= length; i++) {
                builder.node(message(String.valueOf(i), i < length ? String.valueOf(i + 1) : "1"));
            }

            // When
            ValidationResult result = validator.validate(builder.build());

            // Then
            assertThat(result.issues())
                    .filteredOn(issue -> issue.code().equals("INFINITE_LOOP"))
                    .singleElement()
                    .extracting(ValidationIssue::nodeId)
                    .isEqualTo("1");
        }
    }

    @Nested
    @DisplayName("content")
    class Content {

        @Test
        void shouldFlagEmptyMessageAndMissingLabel() {
            Flow flow =
                    flow(
                            "root",
                            menu("root", option("menu-1", "1")),
                            action("1", new MessagePayload(" "), null)
                                    .toBuilder()
                                    .label("")
                                    .build());

            ValidationResult result = validator.validate(flow);

            assertThat(result.hasCode("EMPTY_MESSAGE")).isTrue();
            assertThat(result.hasCode("MISSING_NODE_LABEL")).isTrue();
        }

        @Test
        void shouldFlagButtonOverflowAndEmptyLabels() {
            ButtonsPayload payload =
                    new ButtonsPayload(
                            List.of(
                                    new ButtonItem("btn-1", "Yes", "Y", null),
                                    new ButtonItem("btn-2", "", "N", null)),
                            1,
                            null);
            Flow flow =
                    flow("root", menu("root", option("menu-1", "b")), action("b", payload, null));

            ValidationResult result = validator.validate(flow);

            assertThat(result.warnings())
                    .extracting(ValidationIssue::code)
                    .containsExactly("TOO_MANY_BUTTONS");
            assertThat(result.errors())
                    .extracting(ValidationIssue::code)
                    .containsExactly("EMPTY_BUTTON_LABEL");
        }

        @Test
        void shouldFlagIncompleteQuestion() {
            AskPayload ask =
                    new AskPayload(
                            "",
                            " ",
                            AskVarType.TEXT,
                            new AskValidation.Regex("(unclosed"),
                            "Again?",
                            null,
                            null);
            Flow flow = flow("root", menu("root", option("menu-1", "q")), action("q", ask, null));

            ValidationResult result = validator.validate(flow);

            assertThat(result.errors())
                    .extracting(ValidationIssue::code)
                    .containsExactly("EMPTY_QUESTION", "MISSING_VARIABLE_NAME", "INVALID_REGEX");
        }

        @Test
        void shouldCheckAttachmentAndWebhookUrls() {
            Flow flow =
                    flow(
                            "root",
                            menu("root", option("menu-1", "a"), option("menu-2", "w")),
                            action("a", new AttachmentPayload("image", "", "file"), null),
                            action(
                                    "w",
                                    new WebhookOutPayload("POST", "not a url", List.of(), ""),
                                    null));

            ValidationResult result = validator.validate(flow);

            assertThat(result.errors())
                    .extracting(ValidationIssue::code)
                    .containsExactly("MISSING_ATTACHMENT_URL", "INVALID_WEBHOOK_URL");
        }

        @Test
        void shouldReportEachScheduleProblemUnlessExternal() {
            CustomSchedule broken = new CustomSchedule("Mars/Olympus", List.of(), List.of());
            Flow custom =
                    flow(
                            "root",
                            menu("root", option("menu-1", "s")),
                            action(
                                    "s",
                                    new SchedulerPayload(SchedulerMode.CUSTOM, broken, null, null),
                                    null));
            Flow external =
                    flow(
                            "root",
                            menu("root", option("menu-1", "s")),
                            action(
                                    "s",
                                    new SchedulerPayload(SchedulerMode.EXTERNAL, null, null, null),
                                    null));

            assertThat(validator.validate(custom).errors())
                    .extracting(ValidationIssue::message)
                    .containsExactly(
                            "Unknown timezone: Mars/Olympus", "Add at least one time window");
            assertThat(validator.validate(external).issues()).isEmpty();
        }
    }
}
