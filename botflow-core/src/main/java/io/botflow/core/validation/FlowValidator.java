package io.botflow.core.validation;

import io.botflow.core.flow.Flow;
import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.MenuOption;
import io.botflow.core.flow.action.ActionPayload;
import io.botflow.core.flow.action.AskPayload;
import io.botflow.core.flow.action.AskValidation;
import io.botflow.core.flow.action.AttachmentPayload;
import io.botflow.core.flow.action.ButtonItem;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.MessagePayload;
import io.botflow.core.flow.action.SchedulerMode;
import io.botflow.core.flow.action.SchedulerPayload;
import io.botflow.core.flow.action.WebhookOutPayload;
import io.botflow.core.kind.NodeKindRegistry;
import io.botflow.core.schedule.ScheduleEvaluator;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Pre-publish checks of a flow's content and reachability.
///
/// Unlike the normalizer, which silently repairs structure, the validator reports content
/// that would misbehave at runtime: empty messages, unusable URLs, invalid schedules,
/// unreachable nodes and loops. It never throws and never modifies the flow.
///
/// ### Codes
/// | Code | Level |
/// |---|---|
/// | `MISSING_FLOW_ID`, `INVALID_TARGET`, `INVALID_CHILD`, `EMPTY_MESSAGE`, `EMPTY_BUTTON_LABEL`, `MISSING_ATTACHMENT_URL`, `INVALID_ATTACHMENT_URL`, `EMPTY_QUESTION`, `MISSING_VARIABLE_NAME`, `INVALID_REGEX`, `MISSING_WEBHOOK_URL`, `INVALID_WEBHOOK_URL`, `INVALID_SCHEDULE` | error |
/// | `MISSING_FLOW_NAME`, `MISSING_NODE_LABEL`, `EMPTY_MENU_OPTION_LABEL`, `TOO_MANY_BUTTONS`, `ORPHANED_NODE`, `INFINITE_LOOP` | warning |
///
/// @implNote Stateless and thread-safe.
public class FlowValidator {

    private final NodeKindRegistry registry;
    private final ScheduleEvaluator scheduleEvaluator;

    public FlowValidator(NodeKindRegistry registry, ScheduleEvaluator scheduleEvaluator) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.scheduleEvaluator =
                Objects.requireNonNull(scheduleEvaluator, "scheduleEvaluator must not be null");
    }

    /// Validates a flow.
    ///
    /// @param flow flow to check, not null
    /// @return all issues found, never null
    public ValidationResult validate(Flow flow) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (flow.getId().isBlank()) {
            issues.add(error(null, "MISSING_FLOW_ID", "Flow has no id", "Assign a unique id"));
        }
        if (flow.getName().isBlank()) {
            issues.add(
                    warning(null, "MISSING_FLOW_NAME", "Flow has no name", "Give the flow a name"));
        }
        for (FlowNode node : flow.getNodes().values()) {
            validateNode(flow, node, issues);
        }
        validateReachability(flow, issues);
        validateLoops(flow, issues);
        return new ValidationResult(issues);
    }

    private void validateNode(Flow flow, FlowNode node, List<ValidationIssue> issues) {
        String id = node.getId();
        if (node.getLabel().isBlank()) {
            issues.add(
                    warning(
                            id,
                            "MISSING_NODE_LABEL",
                            "Node \"" + id + "\" has no label",
                            "Give the node a descriptive label"));
        }

        int index = 0;
        for (MenuOption option : node.getMenuOptions()) {
            index++;
            if (option.label() == null || option.label().isBlank()) {
                issues.add(
                        warning(
                                id,
                                "EMPTY_MENU_OPTION_LABEL",
                                "Option " + index + " of \"" + node.getLabel() + "\" has no label",
                                "Label the option"));
            }
        }

        for (Map.Entry<String, String> slot : registry.getTargetSlots(node).entrySet()) {
            String target = slot.getValue();
            if (target != null && !flow.containsNode(target)) {
                issues.add(
                        error(
                                id,
                                "INVALID_TARGET",
                                "Handle " + slot.getKey() + " points at missing node " + target,
                                "Connect the handle to an existing node"));
            }
        }
        for (String child : node.getChildren()) {
            if (!flow.containsNode(child)) {
                issues.add(
                        error(
                                id,
                                "INVALID_CHILD",
                                "Node \"" + node.getLabel() + "\" has missing child " + child,
                                "Remove the connection"));
            }
        }

        ActionPayload action = node.getAction();
        if (action instanceof MessagePayload message) {
            if (message.text() == null || message.text().isBlank()) {
                issues.add(
                        error(
                                id,
                                "EMPTY_MESSAGE",
                                "Message \"" + node.getLabel() + "\" is empty",
                                "Write the text to send"));
            }
        } else if (action instanceof ButtonsPayload buttons) {
            validateButtons(node, buttons, issues);
        } else if (action instanceof AttachmentPayload attachment) {
            validateUrl(
                    node,
                    attachment.url(),
                    "MISSING_ATTACHMENT_URL",
                    "INVALID_ATTACHMENT_URL",
                    issues);
        } else if (action instanceof AskPayload ask) {
            validateAsk(node, ask, issues);
        } else if (action instanceof WebhookOutPayload webhook) {
            validateUrl(node, webhook.url(), "MISSING_WEBHOOK_URL", "INVALID_WEBHOOK_URL", issues);
        } else if (action instanceof SchedulerPayload scheduler
                && scheduler.mode() != SchedulerMode.EXTERNAL) {
            for (String problem : scheduleEvaluator.validateCustomSchedule(scheduler.custom())) {
                issues.add(error(id, "INVALID_SCHEDULE", problem, "Fix the business hours"));
            }
        }
    }

    private void validateButtons(
            FlowNode node, ButtonsPayload buttons, List<ValidationIssue> issues) {
        if (buttons.hasOverflow()) {
            issues.add(
                    warning(
                            node.getId(),
                            "TOO_MANY_BUTTONS",
                            "Node \""
                                    + node.getLabel()
                                    + "\" has "
                                    + buttons.items().size()
                                    + " buttons but shows at most "
                                    + buttons.maxButtons(),
                            "Convert the overflow into a list"));
        }
        int index = 0;
        for (ButtonItem item : buttons.items()) {
            index++;
            if (item.label() == null || item.label().isBlank()) {
                issues.add(
                        error(
                                node.getId(),
                                "EMPTY_BUTTON_LABEL",
                                "Button " + index + " of \"" + node.getLabel() + "\" has no label",
                                "Label the button"));
            }
        }
    }

    private void validateAsk(FlowNode node, AskPayload ask, List<ValidationIssue> issues) {
        if (ask.questionText() == null || ask.questionText().isBlank()) {
            issues.add(
                    error(
                            node.getId(),
                            "EMPTY_QUESTION",
                            "Question \"" + node.getLabel() + "\" has no text",
                            "Write the question"));
        }
        if (ask.varName() == null || ask.varName().isBlank()) {
            issues.add(
                    error(
                            node.getId(),
                            "MISSING_VARIABLE_NAME",
                            "Question \"" + node.getLabel() + "\" stores its answer nowhere",
                            "Name the answer variable"));
        }
        if (ask.validation() instanceof AskValidation.Regex regex) {
            try {
                Pattern.compile(regex.pattern());
            } catch (PatternSyntaxException e) {
                issues.add(
                        error(
                                node.getId(),
                                "INVALID_REGEX",
                                "Validation pattern of \""
                                        + node.getLabel()
                                        + "\" does not compile: "
                                        + e.getDescription(),
                                "Fix the regular expression"));
            }
        }
    }

    private void validateUrl(
            FlowNode node,
            String url,
            String missingCode,
            String invalidCode,
            List<ValidationIssue> issues) {
        if (url == null || url.isBlank()) {
            issues.add(
                    error(
                            node.getId(),
                            missingCode,
                            "Node \"" + node.getLabel() + "\" has no URL",
                            "Configure a URL"));
            return;
        }
        if (!isAbsoluteUrl(url.trim())) {
            issues.add(
                    error(
                            node.getId(),
                            invalidCode,
                            "URL of \"" + node.getLabel() + "\" is not valid: " + url,
                            "Use an absolute URL such as https://example.com/path"));
        }
    }

    private void validateReachability(Flow flow, List<ValidationIssue> issues) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(flow.getRootId());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            FlowNode node = flow.getNode(current);
            if (node != null) {
                queue.addAll(registry.outgoingTargets(node));
            }
        }
        for (FlowNode node : flow.getNodes().values()) {
            if (!visited.contains(node.getId())) {
                issues.add(
                        warning(
                                node.getId(),
                                "ORPHANED_NODE",
                                "Node \""
                                        + node.getLabel()
                                        + "\" ("
                                        + node.getId()
                                        + ") is not reachable from the root",
                                "Connect the node or delete it"));
            }
        }
    }

    private void validateLoops(Flow flow, List<ValidationIssue> issues) {
        List<String> cycle = findCycle(flow);
        if (cycle.isEmpty()) {
            return;
        }
        List<String> labels = new ArrayList<>();
        for (String id : cycle) {
            FlowNode node = flow.getNode(id);
            labels.add(node != null && !node.getLabel().isBlank() ? node.getLabel() : id);
        }
        issues.add(
                warning(
                        cycle.get(0),
                        "INFINITE_LOOP",
                        "Loop detected: " + String.join(" → ", labels),
                        "Add an end node or break the loop if it is not intended"));
    }

    /// Depth-first search from the root over handle targets. Returns the first cycle met,
    /// starting and ending with the same id, or an empty list.
    private List<String> findCycle(Flow flow) {
        Set<String> done = new HashSet<>();
        LinkedHashSet<String> path = new LinkedHashSet<>();
        Deque<PathFrame> stack = new ArrayDeque<>();
        FlowNode root = flow.getNode(flow.getRootId());
        if (root == null) {
            return List.of();
        }
        path.add(root.getId());
        stack.push(new PathFrame(root.getId(), registry.outgoingTargets(root).iterator()));
        while (!stack.isEmpty()) {
            PathFrame frame = stack.peek();
            if (!frame.targets().hasNext()) {
                stack.pop();
                path.remove(frame.nodeId());
                done.add(frame.nodeId());
                continue;
            }
            String target = frame.targets().next();
            if (path.contains(target)) {
                return cycleEndingAt(path, target);
            }
            FlowNode next = flow.getNode(target);
            if (next == null || done.contains(target)) {
                continue;
            }
            path.add(target);
            stack.push(new PathFrame(target, registry.outgoingTargets(next).iterator()));
        }
        return List.of();
    }

    private static List<String> cycleEndingAt(Set<String> path, String nodeId) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String id : path) {
            inCycle = inCycle || id.equals(nodeId);
            if (inCycle) {
                cycle.add(id);
            }
        }
        cycle.add(nodeId);
        return cycle;
    }

    private record PathFrame(String nodeId, Iterator<String> targets) {}

    private static boolean isAbsoluteUrl(String url) {
        try {
            URI uri = new URI(url);
            return uri.isAbsolute() && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static ValidationIssue error(String nodeId, String code, String message, String fix) {
        return new ValidationIssue(ValidationLevel.ERROR, nodeId, code, message, fix);
    }

    private static ValidationIssue warning(
            String nodeId, String code, String message, String fix) {
        return new ValidationIssue(ValidationLevel.WARNING, nodeId, code, message, fix);
    }
}
