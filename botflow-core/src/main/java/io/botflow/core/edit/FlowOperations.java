package io.botflow.core.edit;

import io.botflow.core.flow.Flow;
import io.botflow.core.flow.FlowDraft;
import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.MenuOption;
import io.botflow.core.flow.NodeType;
import io.botflow.core.flow.action.AskPayload;
import io.botflow.core.flow.action.ButtonItem;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.SchedulerPayload;
import io.botflow.core.handle.HandleAssignment;
import io.botflow.core.handle.HandleId;
import io.botflow.core.kind.HandleShape;
import io.botflow.core.kind.IdSynthesizer;
import io.botflow.core.kind.NodeKind;
import io.botflow.core.kind.NodeKindRegistry;
import io.botflow.core.normalize.FlowNormalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/// Structural edits of a flow.
///
/// Every operation normalizes its input, assembles the change on a {@link FlowDraft},
/// and normalizes the committed result. A rejected operation discards the draft and
/// returns the caller's flow instance unchanged, so `result == input` means "nothing
/// happened". Operations never throw for bad ids or handles.
///
/// ### Node ids
/// New nodes are named by {@link NodeIdAllocator#nextChildId(FlowDraft, String)}.
///
/// ### Deleting shared nodes
/// A node may be the target of several handles, possibly on several nodes. Deleting it
/// rewrites *every* such handle: each points at the first of the deleted node's children
/// (other than the referrer itself), or is unbound when there is none. The first
/// referrer in map order additionally adopts the remaining children, next to the slot the
/// deleted node occupied.
///
/// @implNote Stateless and thread-safe.
///
/// @see FreeHandleSearch for the auto-binding order
public class FlowOperations {

    private static final Logger logger = Logger.getLogger(FlowOperations.class.getName());

    private final NodeKindRegistry registry;
    private final FlowNormalizer normalizer;
    private final HandleAssignment assignment;
    private final FreeHandleSearch freeHandles = new FreeHandleSearch();

    public FlowOperations(
            NodeKindRegistry registry, FlowNormalizer normalizer, HandleAssignment assignment) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.assignment = Objects.requireNonNull(assignment, "assignment must not be null");
    }

    /// Creates a node of `kind` and binds it to the parent's first free handle.
    ///
    /// @param flow current flow
    /// @param parentId node receiving the child
    /// @param kind kind of the new node
    /// @return new flow and created id, or the input flow when the parent is unknown or has
    ///     no free handle
    public EditResult addChildTo(Flow flow, String parentId, NodeKind kind) {
        Flow base = normalizer.normalize(flow);
        if (!kind.isCreatable() || !base.containsNode(parentId)) {
            return rejected(flow, "addChildTo " + parentId + ": unknown parent or kind " + kind);
        }
        FlowDraft draft = FlowDraft.of(base);
        String childId = NodeIdAllocator.nextChildId(draft, parentId);
        draft.put(registry.createNode(childId, kind));
        if (!bindToFreeHandle(draft, parentId, childId)) {
            return rejected(flow, "addChildTo " + parentId + ": no free handle");
        }
        return EditResult.created(normalizer.normalize(draft.commit()), childId);
    }

    /// Creates a node of `kind` and binds it to one named handle of the source node,
    /// replacing any previous target of that handle.
    ///
    /// @return new flow and created id, or the input flow with no id when the handle
    ///     assignment is rejected
    public EditResult createForHandle(Flow flow, String sourceId, String handleId, NodeKind kind) {
        Flow base = normalizer.normalize(flow);
        if (!kind.isCreatable() || !base.containsNode(sourceId)) {
            return rejected(flow, "createForHandle " + sourceId + ": unknown source or kind");
        }
        FlowDraft draft = FlowDraft.of(base);
        String childId = NodeIdAllocator.nextChildId(draft, sourceId);
        draft.put(registry.createNode(childId, kind));
        if (!assignment.assign(draft, sourceId, handleId, childId)) {
            return rejected(flow, "createForHandle " + sourceId + ": handle " + handleId);
        }
        return EditResult.created(normalizer.normalize(draft.commit()), childId);
    }

    /// Binds (or, with a null target, unbinds) one handle.
    ///
    /// @return the new flow, or the input flow when the assignment is rejected
    public Flow connect(Flow flow, String sourceId, String handleId, String targetId) {
        Flow base = normalizer.normalize(flow);
        FlowDraft draft = FlowDraft.of(base);
        if (!assignment.assign(draft, sourceId, handleId, targetId)) {
            return flow;
        }
        return normalizer.normalize(draft.commit());
    }

    /// Deletes a node and reconnects its children to the nodes that pointed at it.
    ///
    /// The root and unknown ids are ignored. Children of the deleted node are kept; one
    /// not adopted by any referrer simply becomes unreachable.
    ///
    /// @return the new flow, or the input flow when nothing was deleted
    public Flow deleteNode(Flow flow, String nodeId) {
        Flow base = normalizer.normalize(flow);
        if (nodeId == null || nodeId.equals(base.getRootId()) || !base.containsNode(nodeId)) {
            return flow;
        }
        FlowNode deleted = base.getNode(nodeId);
        List<String> orphans = new ArrayList<>(deleted.getChildren());
        orphans.remove(nodeId);

        FlowDraft draft = FlowDraft.of(base);
        draft.remove(nodeId);
        boolean primary = true;
        for (FlowNode referrer : base.getNodes().values()) {
            if (referrer.getId().equals(nodeId) || !targets(referrer, nodeId)) {
                continue;
            }
            List<String> candidates = new ArrayList<>(orphans);
            candidates.remove(referrer.getId());
            FlowNode rewritten =
                    primary
                            ? adopt(referrer, nodeId, candidates, draft)
                            : replaceTarget(referrer, nodeId, first(candidates));
            draft.put(rewritten);
            primary = false;
        }
        return normalizer.normalize(draft.commit());
    }

    /// Copies a node without any of its outgoing targets and binds the copy to the first
    /// free handle of the original's parent (its first referrer in map order).
    ///
    /// @return new flow and the copy's id, or the input flow when the node has no parent
    ///     or the parent has no free handle
    public EditResult duplicateNode(Flow flow, String nodeId) {
        Flow base = normalizer.normalize(flow);
        FlowNode source = base.getNode(nodeId);
        if (source == null) {
            return rejected(flow, "duplicateNode: unknown node " + nodeId);
        }
        Optional<FlowNode> parent = firstReferrer(base, nodeId);
        if (parent.isEmpty()) {
            return rejected(flow, "duplicateNode " + nodeId + ": node has no parent");
        }
        String parentId = parent.get().getId();
        FlowDraft draft = FlowDraft.of(base);
        String copyId = NodeIdAllocator.nextChildId(draft, parentId);
        draft.put(registry.stripTargets(source).toBuilder().id(copyId).build());
        if (!bindToFreeHandle(draft, parentId, copyId)) {
            return rejected(flow, "duplicateNode " + nodeId + ": parent has no free handle");
        }
        return EditResult.created(normalizer.normalize(draft.commit()), copyId);
    }

    /// Splices a new message node onto the edge `parent -> child`: every handle of the
    /// parent that targeted the child now targets the new node, whose default handle
    /// targets the child.
    ///
    /// @return new flow and the inserted node's id, or the input flow when no such edge
    ///     exists
    public EditResult insertBetween(Flow flow, String parentId, String childId) {
        Flow base = normalizer.normalize(flow);
        FlowNode parent = base.getNode(parentId);
        if (parent == null || childId == null || !targets(parent, childId)) {
            return rejected(flow, "insertBetween: no edge " + parentId + " -> " + childId);
        }
        FlowDraft draft = FlowDraft.of(base);
        String insertedId = NodeIdAllocator.nextChildId(draft, parentId);
        draft.put(registry.createNode(insertedId, NodeKind.MESSAGE));
        if (!assignment.assign(draft, insertedId, HandleId.DEFAULT, childId)) {
            return rejected(flow, "insertBetween: could not link " + insertedId);
        }
        draft.put(replaceTarget(parent, childId, insertedId));
        return EditResult.created(normalizer.normalize(draft.commit()), insertedId);
    }

    /// Unbinds every handle of the parent that targets the child. No node is deleted.
    ///
    /// @return the new flow, or the input flow when no such edge exists
    public Flow deleteEdge(Flow flow, String parentId, String childId) {
        Flow base = normalizer.normalize(flow);
        FlowNode parent = base.getNode(parentId);
        if (parent == null || childId == null || !targets(parent, childId)) {
            return flow;
        }
        FlowDraft draft = FlowDraft.of(base);
        draft.put(replaceTarget(parent, childId, null));
        return normalizer.normalize(draft.commit());
    }

    /// Moves the overflow items of a buttons node into a new menu node.
    ///
    /// The menu gets one option per overflow item, carrying the item's label, value and
    /// target. The buttons node keeps its first `maxButtons` items and its `more` handle
    /// is rebound to the menu, replacing any previous `more` target.
    ///
    /// @return new flow and the menu's id, or the input flow when the node is not a
    ///     buttons node or has no overflow
    public EditResult convertButtonsOverflowToList(Flow flow, String nodeId) {
        Flow base = normalizer.normalize(flow);
        FlowNode node = base.getNode(nodeId);
        if (node == null || node.getKind() != NodeKind.BUTTONS) {
            return rejected(flow, "convertButtonsOverflowToList: " + nodeId + " is not buttons");
        }
        ButtonsPayload buttons = (ButtonsPayload) node.getAction();
        if (!buttons.hasOverflow()) {
            return EditResult.unchanged(flow);
        }
        List<ButtonItem> overflow =
                buttons.items().subList(buttons.maxButtons(), buttons.items().size());

        FlowDraft draft = FlowDraft.of(base);
        String listId = NodeIdAllocator.nextChildId(draft, nodeId);
        Set<String> taken = new HashSet<>();
        List<MenuOption> options = new ArrayList<>();
        for (ButtonItem item : overflow) {
            int ordinal = options.size() + 1;
            String optionId = IdSynthesizer.synthesize(IdSynthesizer.OPTION_PREFIX, ordinal, taken);
            taken.add(optionId);
            options.add(new MenuOption(optionId, item.label(), item.value(), item.targetId()));
        }
        FlowNode list =
                FlowNode.builder()
                        .id(listId)
                        .label(node.getLabel() + " · List")
                        .type(NodeType.MENU)
                        .menuOptions(options)
                        .build();
        draft.put(registry.withDerivedChildren(list));

        ButtonsPayload trimmed =
                new ButtonsPayload(buttons.visibleItems(), buttons.maxButtons(), listId);
        draft.put(registry.withDerivedChildren(node.toBuilder().action(trimmed).build()));
        return EditResult.created(normalizer.normalize(draft.commit()), listId);
    }

    /// Applies a direct field edit to one node, then normalizes.
    ///
    /// @param edit function returning the edited node; it must keep the node's id
    /// @return the new flow, or the input flow when the node is unknown, the edit changes
    ///     the id, or the edit changes nothing
    public Flow editNode(Flow flow, String nodeId, UnaryOperator<FlowNode> edit) {
        Flow base = normalizer.normalize(flow);
        FlowNode node = base.getNode(nodeId);
        if (node == null) {
            return flow;
        }
        FlowNode edited = edit.apply(node);
        if (edited == null || !nodeId.equals(edited.getId())) {
            logger.fine("editNode " + nodeId + ": edit must return a node with the same id");
            return flow;
        }
        FlowDraft draft = FlowDraft.of(base);
        draft.put(edited);
        Flow result = normalizer.normalize(draft.commit());
        return result.equals(flow) ? flow : result;
    }

    private boolean bindToFreeHandle(FlowDraft draft, String parentId, String childId) {
        Optional<FreeHandleSearch.FreeHandle> free = freeHandles.find(draft.node(parentId));
        if (free.isEmpty()) {
            return false;
        }
        draft.put(free.get().node());
        return assignment.assign(draft, parentId, free.get().handleId(), childId);
    }

    private boolean targets(FlowNode node, String targetId) {
        return registry.getTargetSlots(node).containsValue(targetId);
    }

    private Optional<FlowNode> firstReferrer(Flow flow, String nodeId) {
        for (FlowNode node : flow.getNodes().values()) {
            if (!node.getId().equals(nodeId) && targets(node, nodeId)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    private FlowNode replaceTarget(FlowNode node, String oldTarget, String newTarget) {
        return registry.retarget(node, target -> target.equals(oldTarget) ? newTarget : target);
    }

    /// Rewrites the slots of the primary referrer and hands it the remaining orphans.
    private FlowNode adopt(
            FlowNode referrer, String deletedId, List<String> candidates, FlowDraft draft) {
        String replacement = first(candidates);
        List<String> extras = new ArrayList<>();
        for (int i = 1; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            if (!targets(referrer, candidate)) {
                extras.add(candidate);
            }
        }
        HandleShape shape = referrer.getKind().handleShape();
        FlowNode rewritten;
        switch (shape) {
            case OPTIONS:
                rewritten = adoptIntoMenu(referrer, deletedId, replacement, extras, draft);
                break;
            case BUTTONS:
                rewritten = adoptIntoButtons(referrer, deletedId, replacement, extras, draft);
                break;
            case ASK:
            case SCHEDULER:
                rewritten = adoptIntoFixedSlots(referrer, deletedId, replacement, extras);
                break;
            default:
                rewritten = replaceTarget(referrer, deletedId, replacement);
                break;
        }
        return registry.withDerivedChildren(rewritten);
    }

    private FlowNode adoptIntoMenu(
            FlowNode menu,
            String deletedId,
            String replacement,
            List<String> extras,
            FlowDraft draft) {
        Set<String> taken = new HashSet<>();
        menu.getMenuOptions().forEach(option -> taken.add(option.id()));
        List<MenuOption> options = new ArrayList<>();
        boolean inserted = false;
        for (MenuOption option : menu.getMenuOptions()) {
            if (!deletedId.equals(option.targetId())) {
                options.add(option);
                continue;
            }
            options.add(option.withTargetId(replacement));
            if (!inserted) {
                for (String extra : extras) {
                    String id =
                            IdSynthesizer.synthesize(
                                    IdSynthesizer.OPTION_PREFIX, options.size() + 1, taken);
                    taken.add(id);
                    options.add(new MenuOption(id, labelOf(draft, extra), null, extra));
                }
                inserted = true;
            }
        }
        return menu.toBuilder().menuOptions(options).build();
    }

    private FlowNode adoptIntoButtons(
            FlowNode node,
            String deletedId,
            String replacement,
            List<String> extras,
            FlowDraft draft) {
        ButtonsPayload buttons = (ButtonsPayload) node.getAction();
        Set<String> taken = new HashSet<>();
        buttons.items().forEach(item -> taken.add(item.id()));
        taken.add(HandleId.RESERVED_MORE_TOKEN);
        List<ButtonItem> items = new ArrayList<>();
        boolean inserted = false;
        for (ButtonItem item : buttons.items()) {
            if (!deletedId.equals(item.targetId())) {
                items.add(item);
                continue;
            }
            items.add(item.withTargetId(replacement));
            if (!inserted) {
                appendItems(items, extras, taken, draft);
                inserted = true;
            }
        }
        String more = buttons.moreTargetId();
        if (deletedId.equals(more)) {
            more = replacement;
            if (!inserted) {
                appendItems(items, extras, taken, draft);
            }
        }
        return node.toBuilder()
                .action(new ButtonsPayload(items, buttons.maxButtons(), more))
                .build();
    }

    private static void appendItems(
            List<ButtonItem> items, List<String> extras, Set<String> taken, FlowDraft draft) {
        for (String extra : extras) {
            int ordinal = items.size() + 1;
            String id = IdSynthesizer.synthesize(IdSynthesizer.BUTTON_PREFIX, ordinal, taken);
            taken.add(id);
            items.add(new ButtonItem(id, labelOf(draft, extra), "BTN_" + ordinal, extra));
        }
    }

    private FlowNode adoptIntoFixedSlots(
            FlowNode node, String deletedId, String replacement, List<String> extras) {
        List<String> pending = new ArrayList<>(extras);
        FlowNode rewritten = replaceTarget(node, deletedId, replacement);
        if (rewritten.getAction() instanceof AskPayload ask) {
            if (ask.answerTargetId() == null && !pending.isEmpty()) {
                ask = ask.withAnswerTargetId(pending.remove(0));
            }
            if (ask.invalidTargetId() == null && !pending.isEmpty()) {
                ask = ask.withInvalidTargetId(pending.remove(0));
            }
            return rewritten.toBuilder().action(ask).build();
        }
        if (rewritten.getAction() instanceof SchedulerPayload scheduler) {
            if (scheduler.inWindowTargetId() == null && !pending.isEmpty()) {
                scheduler = scheduler.withInWindowTargetId(pending.remove(0));
            }
            if (scheduler.outOfWindowTargetId() == null && !pending.isEmpty()) {
                scheduler = scheduler.withOutOfWindowTargetId(pending.remove(0));
            }
            return rewritten.toBuilder().action(scheduler).build();
        }
        return rewritten;
    }

    private static String labelOf(FlowDraft draft, String nodeId) {
        FlowNode node = draft.node(nodeId);
        return node != null && !node.getLabel().isBlank() ? node.getLabel() : nodeId;
    }

    private static String first(List<String> candidates) {
        return candidates.isEmpty() ? null : candidates.get(0);
    }

    private static EditResult rejected(Flow flow, String reason) {
        logger.fine("Operation rejected: " + reason);
        return EditResult.unchanged(flow);
    }
}
