package io.botflow.core.edit;

import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.MenuOption;
import io.botflow.core.flow.action.AskPayload;
import io.botflow.core.flow.action.ButtonItem;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.SchedulerPayload;
import io.botflow.core.handle.HandleId;
import io.botflow.core.kind.IdSynthesizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Finds the first unbound output handle of a node, in a fixed order per kind.
///
/// | Kind | Search order |
/// |---|---|
/// | menu | first option without target, else a newly appended option |
/// | buttons | first item without target, else a newly appended item while fewer than `maxButtons`, else `more` if unbound |
/// | ask | `answer`, then `invalid` |
/// | scheduler | `in`, then `out` |
/// | any other | `default` if the node has no child |
///
/// When a new option or item is needed, the returned node already contains it; the
/// caller stores that node before assigning the handle.
public final class FreeHandleSearch {

    /// A free handle and the node it lives on.
    ///
    /// @param node the node, possibly extended with a new option or item
    /// @param handleId id of the free handle
    public record FreeHandle(FlowNode node, String handleId) {}

    /// @param node normalized node to search
    /// @return the first free handle, or empty when every handle is bound
    public Optional<FreeHandle> find(FlowNode node) {
        switch (node.getKind().handleShape()) {
            case OPTIONS:
                return Optional.of(findMenuOption(node));
            case BUTTONS:
                return findButton(node);
            case ASK:
                AskPayload ask = (AskPayload) node.getAction();
                if (ask.answerTargetId() == null) {
                    return Optional.of(new FreeHandle(node, HandleId.ANSWER));
                }
                if (ask.invalidTargetId() == null) {
                    return Optional.of(new FreeHandle(node, HandleId.INVALID));
                }
                return Optional.empty();
            case SCHEDULER:
                SchedulerPayload scheduler = (SchedulerPayload) node.getAction();
                if (scheduler.inWindowTargetId() == null) {
                    return Optional.of(new FreeHandle(node, HandleId.SCHEDULE_IN));
                }
                if (scheduler.outOfWindowTargetId() == null) {
                    return Optional.of(new FreeHandle(node, HandleId.SCHEDULE_OUT));
                }
                return Optional.empty();
            default:
                return node.firstChild() == null
                        ? Optional.of(new FreeHandle(node, HandleId.DEFAULT))
                        : Optional.empty();
        }
    }

    private FreeHandle findMenuOption(FlowNode node) {
        List<MenuOption> options = node.getMenuOptions();
        for (MenuOption option : options) {
            if (option.targetId() == null) {
                return new FreeHandle(node, HandleId.menuOption(option.id()));
            }
        }
        Set<String> taken = new HashSet<>();
        options.forEach(option -> taken.add(option.id()));
        int ordinal = options.size() + 1;
        MenuOption added =
                new MenuOption(
                        IdSynthesizer.synthesize(IdSynthesizer.OPTION_PREFIX, ordinal, taken),
                        "Option " + ordinal,
                        null,
                        null);
        List<MenuOption> extended = new ArrayList<>(options);
        extended.add(added);
        return new FreeHandle(
                node.toBuilder().menuOptions(extended).build(), HandleId.menuOption(added.id()));
    }

    private Optional<FreeHandle> findButton(FlowNode node) {
        ButtonsPayload buttons = (ButtonsPayload) node.getAction();
        for (ButtonItem item : buttons.items()) {
            if (item.targetId() == null) {
                return Optional.of(new FreeHandle(node, HandleId.button(item.id())));
            }
        }
        if (buttons.items().size() < buttons.maxButtons()) {
            Set<String> taken = new HashSet<>();
            buttons.items().forEach(item -> taken.add(item.id()));
            taken.add(HandleId.RESERVED_MORE_TOKEN);
            int ordinal = buttons.items().size() + 1;
            ButtonItem added =
                    new ButtonItem(
                            IdSynthesizer.synthesize(IdSynthesizer.BUTTON_PREFIX, ordinal, taken),
                            "Button " + ordinal,
                            "BTN_" + ordinal,
                            null);
            List<ButtonItem> extended = new ArrayList<>(buttons.items());
            extended.add(added);
            FlowNode grown = node.toBuilder().action(buttons.withItems(extended)).build();
            return Optional.of(new FreeHandle(grown, HandleId.button(added.id())));
        }
        if (buttons.moreTargetId() == null) {
            return Optional.of(new FreeHandle(node, HandleId.BUTTON_MORE));
        }
        return Optional.empty();
    }
}
