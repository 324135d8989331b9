package io.botflow.serialization;

import static io.botflow.serialization.JsonFields.elements;
import static io.botflow.serialization.JsonFields.strings;
import static io.botflow.serialization.JsonFields.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.MenuOption;
import io.botflow.core.flow.NodeType;
import io.botflow.core.flow.action.ActionPayload;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Deserializes a `FlowNode`, repairing what can be inferred.
///
/// ### Repairs
/// - missing `id`: the caller's fallback id (the node's key in the flow map)
/// - missing or unknown `type`: `action` when an `action` object is present, else `menu`
/// - non-object menu options and non-string children: skipped
///
/// Option ids, labels and payload defaults are left to the normalizer.
///
/// @implNote Package-private. Registered by {@link BotflowJacksonModule}.
/// @see NodeSerializer for the inverse operation
class NodeDeserializer extends StdDeserializer<FlowNode> {

    @Serial private static final long serialVersionUID = 7781525032196011432L;

    NodeDeserializer() {
        super(FlowNode.class);
    }

    /// Reads a standalone node. Without a map key to fall back on, `id` is required.
    ///
    /// @throws IOException if the node has no `id`
    @Override
    public FlowNode deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (textOrNull(root, "id") == null) {
            throw JsonMappingException.from(p, "Flow node without id");
        }
        return readNode(mapper, root, null);
    }

    /// Reads one node object.
    ///
    /// @param mapper mapper for nested payloads, not null
    /// @param root the node object, not null
    /// @param fallbackId id used when the object has none, may be null
    /// @return the node, never null
    static FlowNode readNode(ObjectMapper mapper, JsonNode root, String fallbackId) {
        String id = textOrNull(root, "id");
        if (id == null || id.isBlank()) {
            id = fallbackId;
        }

        JsonNode actionNode = root.get("action");
        ActionPayload action =
                actionNode != null && actionNode.isObject()
                        ? ActionDeserializer.readAction(mapper, actionNode)
                        : null;
        NodeType type =
                NodeType.fromWireName(textOrNull(root, "type"))
                        .orElse(action != null ? NodeType.ACTION : NodeType.MENU);

        List<MenuOption> options = new ArrayList<>();
        for (JsonNode option : elements(root, "menuOptions")) {
            if (option.isObject()) {
                options.add(
                        new MenuOption(
                                textOrNull(option, "id"),
                                textOrNull(option, "label"),
                                textOrNull(option, "value"),
                                textOrNull(option, "targetId")));
            }
        }

        return FlowNode.builder()
                .id(id)
                .label(textOrNull(root, "label"))
                .type(type)
                .description(textOrNull(root, "description"))
                .children(strings(root, "children"))
                .action(action)
                .menuOptions(options)
                .build();
    }
}
