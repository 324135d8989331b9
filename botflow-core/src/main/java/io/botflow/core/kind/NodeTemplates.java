package io.botflow.core.kind;

import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.MenuOption;
import io.botflow.core.flow.NodeType;
import io.botflow.core.flow.action.ActionPayload;
import io.botflow.core.flow.action.AskPayload;
import io.botflow.core.flow.action.AskValidation;
import io.botflow.core.flow.action.AskVarType;
import io.botflow.core.flow.action.AttachmentPayload;
import io.botflow.core.flow.action.ButtonItem;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.EndPayload;
import io.botflow.core.flow.action.HandoffPayload;
import io.botflow.core.flow.action.KnowledgeSearchPayload;
import io.botflow.core.flow.action.MessagePayload;
import io.botflow.core.flow.action.SchedulerMode;
import io.botflow.core.flow.action.SchedulerPayload;
import io.botflow.core.flow.action.ToolPayload;
import io.botflow.core.flow.action.TransferPayload;
import io.botflow.core.flow.action.WebhookHeader;
import io.botflow.core.flow.action.WebhookInPayload;
import io.botflow.core.flow.action.WebhookOutPayload;
import io.botflow.core.schedule.CustomSchedule;
import java.util.List;
import java.util.Map;

/// Starting content of freshly created nodes.
final class NodeTemplates {

    private final PayloadDefaults defaults;

    NodeTemplates(PayloadDefaults defaults) {
        this.defaults = defaults;
    }

    FlowNode create(String id, NodeKind kind) {
        if (kind == NodeKind.MENU) {
            return FlowNode.builder()
                    .id(id)
                    .label("New submenu")
                    .type(NodeType.MENU)
                    .menuOptions(
                            List.of(
                                    new MenuOption(
                                            IdSynthesizer.OPTION_PREFIX + "-1",
                                            "Option 1",
                                            null,
                                            null)))
                    .build();
        }
        return FlowNode.builder()
                .id(id)
                .label("Action · " + kind.wireName())
                .type(NodeType.ACTION)
                .action(payloadFor(kind))
                .build();
    }

    ActionPayload payloadFor(NodeKind kind) {
        switch (kind) {
            case MESSAGE:
                return new MessagePayload("Message");
            case BUTTONS:
                return new ButtonsPayload(
                        List.of(
                                new ButtonItem(
                                        IdSynthesizer.BUTTON_PREFIX + "-1", "Yes", "YES", null),
                                new ButtonItem(
                                        IdSynthesizer.BUTTON_PREFIX + "-2", "No", "NO", null)),
                        defaults.getDefaultButtonLimit(),
                        null);
            case ATTACHMENT:
                return new AttachmentPayload("image", "", "file");
            case WEBHOOK_OUT:
                return new WebhookOutPayload(
                        "POST",
                        "https://api.example.com/webhook",
                        List.of(new WebhookHeader("Content-Type", "application/json")),
                        "{\n  \"user\": \"{{user.id}}\"\n}");
            case WEBHOOK_IN:
                return new WebhookInPayload("/hooks/inbound", "", "");
            case TRANSFER:
                return new TransferPayload("open_channel", "sales");
            case HANDOFF:
                return new HandoffPayload("agents", "hand over to a human");
            case IA_RAG:
                return new KnowledgeSearchPayload("Search the knowledge base...");
            case TOOL:
                return new ToolPayload("my-tool", Map.of());
            case ASK:
                return new AskPayload(
                        PayloadDefaults.DEFAULT_QUESTION,
                        PayloadDefaults.DEFAULT_VAR_NAME,
                        AskVarType.TEXT,
                        AskValidation.NONE,
                        PayloadDefaults.DEFAULT_RETRY_MESSAGE,
                        null,
                        null);
            case SCHEDULER:
                return new SchedulerPayload(
                        SchedulerMode.CUSTOM,
                        CustomSchedule.defaultSchedule(defaults.getDefaultTimezone()),
                        null,
                        null);
            case END:
                return new EndPayload();
            default:
                throw new IllegalArgumentException("No template for node kind " + kind);
        }
    }
}
