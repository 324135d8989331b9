package io.botflow.core.kind;

import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.MenuOption;
import io.botflow.core.flow.action.ActionPayload;
import io.botflow.core.flow.action.AskPayload;
import io.botflow.core.flow.action.ButtonItem;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.SchedulerPayload;
import io.botflow.core.handle.HandleId;
import io.botflow.core.handle.HandleSpec;
import io.botflow.core.handle.HandleVariant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/// Per-kind description of node ports, targets and templates.
///
/// All methods are pure functions of the node passed in. They expect a normalized node
/// but never fail on a raw one.
///
/// ### Handle order
/// Output handles are listed in a fixed order that callers may rely on:
///
/// | Kind | Order |
/// |---|---|
/// | menu | options in list order |
/// | buttons | visible items in list order, then `more` when items overflow |
/// | ask | `answer`, `invalid` |
/// | scheduler | `in`, `out` |
/// | any other | `default` |
///
/// ### Handles vs. target slots
/// {@link #getHandleAssignments(FlowNode)} reports the *visible* handles only. A buttons
/// node can additionally hold targets on overflow items and on `more` while it has no
/// overflow; {@link #getTargetSlots(FlowNode)} reports those as well, and
/// {@link #outgoingTargets(FlowNode)} derives `children` from all of them.
///
/// @implNote Immutable and thread-safe.
///
/// @see HandleId for the handle wire grammar
public class NodeKindRegistry {

    private final PayloadDefaults defaults;
    private final NodeTemplates templates;

    public NodeKindRegistry() {
        this(new PayloadDefaults());
    }

    public NodeKindRegistry(PayloadDefaults defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        this.templates = new NodeTemplates(defaults);
    }

    public PayloadDefaults getDefaults() {
        return defaults;
    }

    /// Returns the node's output handles in rendering order.
    ///
    /// @param node the node, not null
    /// @return ordered handle specs, never null
    public List<HandleSpec> getOutputHandleSpecs(FlowNode node) {
        List<HandleSpec> specs = new ArrayList<>();
        switch (node.getKind().handleShape()) {
            case OPTIONS:
                for (MenuOption option : node.getMenuOptions()) {
                    specs.add(
                            output(HandleId.menuOption(option.id()), option.label(), specs.size()));
                }
                break;
            case BUTTONS:
                ButtonsPayload buttons = (ButtonsPayload) node.getAction();
                for (ButtonItem item : buttons.visibleItems()) {
                    specs.add(output(HandleId.button(item.id()), item.label(), specs.size()));
                }
                if (buttons.hasOverflow()) {
                    specs.add(
                            HandleSpec.output(
                                    HandleId.BUTTON_MORE,
                                    "List",
                                    specs.size(),
                                    HandleVariant.MORE));
                }
                break;
            case ASK:
                specs.add(HandleSpec.output(HandleId.ANSWER, "Answer", 0, HandleVariant.ANSWER));
                specs.add(
                        HandleSpec.output(
                                HandleId.INVALID, "On invalid", 1, HandleVariant.INVALID));
                break;
            case SCHEDULER:
                specs.add(output(HandleId.SCHEDULE_IN, "In hours", 0));
                specs.add(output(HandleId.SCHEDULE_OUT, "Out of hours", 1));
                break;
            default:
                specs.add(output(HandleId.DEFAULT, "Next", 0));
                break;
        }
        return Collections.unmodifiableList(specs);
    }

    /// Returns the input handle followed by the output handles.
    public List<HandleSpec> getHandleSpecs(FlowNode node) {
        List<HandleSpec> specs = new ArrayList<>();
        specs.add(HandleSpec.inputHandle());
        specs.addAll(getOutputHandleSpecs(node));
        return Collections.unmodifiableList(specs);
    }

    /// Returns the current target of every visible output handle.
    ///
    /// @param node the node, not null
    /// @return handle id to target id (null when unbound), in handle order, never null
    public Map<String, String> getHandleAssignments(FlowNode node) {
        Map<String, String> assignments = new LinkedHashMap<>();
        if (node.getKind().handleShape() == HandleShape.BUTTONS) {
            ButtonsPayload buttons = (ButtonsPayload) node.getAction();
            for (ButtonItem item : buttons.visibleItems()) {
                assignments.put(HandleId.button(item.id()), item.targetId());
            }
            if (buttons.hasOverflow()) {
                assignments.put(HandleId.BUTTON_MORE, buttons.moreTargetId());
            }
            return Collections.unmodifiableMap(assignments);
        }
        return getTargetSlots(node);
    }

    /// Returns every target slot of the node, including those without a visible handle.
    ///
    /// For buttons this is every item (visible or overflow) followed by `more`.
    ///
    /// @param node the node, not null
    /// @return handle id to target id (null when unbound), in handle order, never null
    public Map<String, String> getTargetSlots(FlowNode node) {
        Map<String, String> slots = new LinkedHashMap<>();
        switch (node.getKind().handleShape()) {
            case OPTIONS:
                for (MenuOption option : node.getMenuOptions()) {
                    slots.put(HandleId.menuOption(option.id()), option.targetId());
                }
                break;
            case BUTTONS:
                ButtonsPayload buttons = (ButtonsPayload) node.getAction();
                for (ButtonItem item : buttons.items()) {
                    slots.put(HandleId.button(item.id()), item.targetId());
                }
                slots.put(HandleId.BUTTON_MORE, buttons.moreTargetId());
                break;
            case ASK:
                AskPayload ask = (AskPayload) node.getAction();
                slots.put(HandleId.ANSWER, ask.answerTargetId());
                slots.put(HandleId.INVALID, ask.invalidTargetId());
                break;
            case SCHEDULER:
                SchedulerPayload scheduler = (SchedulerPayload) node.getAction();
                slots.put(HandleId.SCHEDULE_IN, scheduler.inWindowTargetId());
                slots.put(HandleId.SCHEDULE_OUT, scheduler.outOfWindowTargetId());
                break;
            default:
                slots.put(HandleId.DEFAULT, node.firstChild());
                break;
        }
        return Collections.unmodifiableMap(slots);
    }

    /// Derives the children list: the ordered, de-duplicated, non-null targets of every
    /// target slot.
    ///
    /// @param node the node, not null
    /// @return child ids, never null
    public List<String> outgoingTargets(FlowNode node) {
        Set<String> targets = new LinkedHashSet<>();
        for (String target : getTargetSlots(node).values()) {
            if (target != null) {
                targets.add(target);
            }
        }
        return List.copyOf(targets);
    }

    /// Returns the node with `children` recomputed from its target slots.
    ///
    /// @param node the node, not null
    /// @return the same instance when `children` was already consistent
    public FlowNode withDerivedChildren(FlowNode node) {
        List<String> derived = outgoingTargets(node);
        if (derived.equals(node.getChildren())) {
            return node;
        }
        return node.toBuilder().children(derived).build();
    }

    /// Rewrites every bound target slot through `mapping`, then recomputes `children`.
    ///
    /// The mapping receives each non-null target and returns its replacement, or null to
    /// unbind the slot. Unbound slots are left alone.
    ///
    /// @param node the node, not null
    /// @param mapping target rewrite, not null
    /// @return the same instance when nothing changed
    public FlowNode retarget(FlowNode node, UnaryOperator<String> mapping) {
        UnaryOperator<String> remap = target -> target == null ? null : mapping.apply(target);
        FlowNode.Builder builder = node.toBuilder();
        ActionPayload action = node.getAction();
        switch (node.getKind().handleShape()) {
            case OPTIONS:
                List<MenuOption> options = new ArrayList<>();
                for (MenuOption option : node.getMenuOptions()) {
                    options.add(option.withTargetId(remap.apply(option.targetId())));
                }
                builder.menuOptions(options);
                break;
            case BUTTONS:
                ButtonsPayload buttons = (ButtonsPayload) action;
                List<ButtonItem> items = new ArrayList<>();
                for (ButtonItem item : buttons.items()) {
                    items.add(item.withTargetId(remap.apply(item.targetId())));
                }
                builder.action(
                        new ButtonsPayload(
                                items, buttons.maxButtons(), remap.apply(buttons.moreTargetId())));
                break;
            case ASK:
                AskPayload ask = (AskPayload) action;
                builder.action(
                        ask.withAnswerTargetId(remap.apply(ask.answerTargetId()))
                                .withInvalidTargetId(remap.apply(ask.invalidTargetId())));
                break;
            case SCHEDULER:
                SchedulerPayload scheduler = (SchedulerPayload) action;
                builder.action(
                        scheduler
                                .withInWindowTargetId(remap.apply(scheduler.inWindowTargetId()))
                                .withOutOfWindowTargetId(
                                        remap.apply(scheduler.outOfWindowTargetId())));
                break;
            default:
                String next = remap.apply(node.firstChild());
                builder.children(next == null ? List.of() : List.of(next));
                break;
        }
        FlowNode rewritten = withDerivedChildren(builder.build());
        return rewritten.equals(node) ? node : rewritten;
    }

    /// Returns a copy of the node with every target slot unbound and no children.
    public FlowNode stripTargets(FlowNode node) {
        return retarget(node, target -> null);
    }

    /// Creates a fully populated node of the given kind with no outgoing targets.
    ///
    /// @param id id of the new node, not null
    /// @param kind kind to create, must be {@link NodeKind#isCreatable() creatable}
    /// @return new node, never null
    /// @throws IllegalArgumentException if the kind has no template
    public FlowNode createNode(String id, NodeKind kind) {
        return templates.create(id, kind);
    }

    /// Returns the default payload of an action kind.
    ///
    /// @throws IllegalArgumentException for {@link NodeKind#MENU} and {@link NodeKind#OPAQUE}
    public ActionPayload defaultPayload(NodeKind kind) {
        return templates.payloadFor(kind);
    }

    private static HandleSpec output(String id, String label, int order) {
        return HandleSpec.output(id, label, order, HandleVariant.DEFAULT);
    }
}
