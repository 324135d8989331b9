package io.botflow.core.handle;

import io.botflow.core.flow.FlowDraft;
import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.MenuOption;
import io.botflow.core.flow.action.AskPayload;
import io.botflow.core.flow.action.ButtonItem;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.SchedulerPayload;
import io.botflow.core.kind.NodeKindRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Binds or unbinds one output handle of one node.
///
/// This is the only place that writes kind-specific target fields from a handle id. A
/// successful assignment replaces the source node in the draft with a copy whose target
/// field and `children` are updated; a rejected one leaves the draft untouched.
///
/// ### Rejections
/// An assignment returns `false` when:
/// - the source node does not exist in the draft;
/// - the handle id is malformed, is the input handle, or does not belong to the node's
///   kind (e.g. `out:answer` on a menu);
/// - the option/item token names no existing option/item of the node;
/// - a non-null target does not exist in the draft;
/// - the handle already points at the requested target.
///
/// Button handles accept every item, including overflow items, and `out:button:more`
/// can be bound even while the node has no overflow.
///
/// @implNote Stateless and thread-safe; the draft itself is not.
public class HandleAssignment {

    private static final Logger logger = Logger.getLogger(HandleAssignment.class.getName());

    private final NodeKindRegistry registry;

    public HandleAssignment(NodeKindRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// Applies one handle assignment to a draft.
    ///
    /// @param draft working copy to update, not null
    /// @param sourceId node owning the handle
    /// @param handleId handle id in wire grammar
    /// @param targetId new target, or null to unbind
    /// @return true if the draft was changed
    public boolean assign(FlowDraft draft, String sourceId, String handleId, String targetId) {
        FlowNode source = draft.node(sourceId);
        if (source == null) {
            return reject("unknown source node " + sourceId);
        }
        Optional<ParsedHandle> parsed = HandleId.parse(handleId);
        if (parsed.isEmpty() || !parsed.get().isOutput()) {
            return reject("unrecognized output handle " + handleId);
        }
        if (targetId != null && !draft.contains(targetId)) {
            return reject("target " + targetId + " does not exist");
        }

        Optional<FlowNode> updated = apply(source, parsed.get(), targetId);
        if (updated.isEmpty()) {
            return reject(
                    "handle " + handleId + " rejected on " + sourceId + " -> " + targetId);
        }
        draft.put(registry.withDerivedChildren(updated.get()));
        return true;
    }

    private Optional<FlowNode> apply(FlowNode node, ParsedHandle handle, String targetId) {
        switch (node.getKind().handleShape()) {
            case OPTIONS:
                return handle.type() == HandleType.MENU_OPTION
                        ? assignMenuOption(node, handle.token(), targetId)
                        : Optional.empty();
            case BUTTONS:
                return assignButton(node, handle, targetId);
            case ASK:
                return assignAsk(node, handle.type(), targetId);
            case SCHEDULER:
                return assignScheduler(node, handle.type(), targetId);
            default:
                if (handle.type() != HandleType.DEFAULT
                        || Objects.equals(node.firstChild(), targetId)) {
                    return Optional.empty();
                }
                return Optional.of(
                        node.toBuilder()
                                .children(targetId == null ? List.of() : List.of(targetId))
                                .build());
        }
    }

    private Optional<FlowNode> assignMenuOption(FlowNode node, String optionId, String targetId) {
        List<MenuOption> options = new ArrayList<>(node.getMenuOptions());
        for (int i = 0; i < options.size(); i++) {
            MenuOption option = options.get(i);
            if (option.id() != null && option.id().equals(optionId)) {
                if (Objects.equals(option.targetId(), targetId)) {
                    return Optional.empty();
                }
                options.set(i, option.withTargetId(targetId));
                return Optional.of(node.toBuilder().menuOptions(options).build());
            }
        }
        return Optional.empty();
    }

    private Optional<FlowNode> assignButton(FlowNode node, ParsedHandle handle, String targetId) {
        ButtonsPayload buttons = (ButtonsPayload) node.getAction();
        if (handle.type() == HandleType.BUTTON_MORE) {
            if (Objects.equals(buttons.moreTargetId(), targetId)) {
                return Optional.empty();
            }
            return Optional.of(
                    node.toBuilder().action(buttons.withMoreTargetId(targetId)).build());
        }
        if (handle.type() != HandleType.BUTTON) {
            return Optional.empty();
        }
        List<ButtonItem> items = new ArrayList<>(buttons.items());
        for (int i = 0; i < items.size(); i++) {
            ButtonItem item = items.get(i);
            if (item.id() != null && item.id().equals(handle.token())) {
                if (Objects.equals(item.targetId(), targetId)) {
                    return Optional.empty();
                }
                items.set(i, item.withTargetId(targetId));
                return Optional.of(node.toBuilder().action(buttons.withItems(items)).build());
            }
        }
        return Optional.empty();
    }

    private Optional<FlowNode> assignAsk(FlowNode node, HandleType type, String targetId) {
        AskPayload ask = (AskPayload) node.getAction();
        AskPayload next;
        if (type == HandleType.ANSWER && !Objects.equals(ask.answerTargetId(), targetId)) {
            next = ask.withAnswerTargetId(targetId);
        } else if (type == HandleType.INVALID
                && !Objects.equals(ask.invalidTargetId(), targetId)) {
            next = ask.withInvalidTargetId(targetId);
        } else {
            return Optional.empty();
        }
        return Optional.of(node.toBuilder().action(next).build());
    }

    private Optional<FlowNode> assignScheduler(FlowNode node, HandleType type, String targetId) {
        SchedulerPayload scheduler = (SchedulerPayload) node.getAction();
        SchedulerPayload next;
        if (type == HandleType.SCHEDULE_IN
                && !Objects.equals(scheduler.inWindowTargetId(), targetId)) {
            next = scheduler.withInWindowTargetId(targetId);
        } else if (type == HandleType.SCHEDULE_OUT
                && !Objects.equals(scheduler.outOfWindowTargetId(), targetId)) {
            next = scheduler.withOutOfWindowTargetId(targetId);
        } else {
            return Optional.empty();
        }
        return Optional.of(node.toBuilder().action(next).build());
    }

    private static boolean reject(String reason) {
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Handle assignment rejected: " + reason);
        }
        return false;
    }
}
