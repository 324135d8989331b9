package io.botflow.serialization;

import static io.botflow.serialization.JsonFields.intOr;
import static io.botflow.serialization.JsonFields.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.botflow.core.flow.Flow;
import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.NodeType;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/// Deserializes a `Flow` leniently. A structurally incomplete document is repaired,
/// never rejected.
///
/// ### Repairs
/// - node whose `id` differs from its key: the key wins
/// - non-object node entries: skipped with a warning
/// - missing or unknown `rootId`: the first node becomes root
/// - no usable nodes at all: a single menu node `root` is synthesized
/// - missing `version`: 1; missing `id` / `name`: empty
///
/// The result is not normalized; handle/children consistency is the normalizer's job.
///
/// @implNote Package-private. Registered by {@link BotflowJacksonModule}.
/// @see FlowGraphSerializer for the inverse operation
class FlowGraphDeserializer extends StdDeserializer<Flow> {

    @Serial private static final long serialVersionUID = 2305118796530724181L;

    private static final Logger logger = Logger.getLogger(FlowGraphDeserializer.class.getName());

    static final String SYNTHESIZED_ROOT_ID = "root";
    static final String SYNTHESIZED_ROOT_LABEL = "Main menu";

    FlowGraphDeserializer() {
        super(Flow.class);
    }

    @Override
    public Flow deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return readFlow(mapper, mapper.readTree(p));
    }

    /// Reads a flow object.
    ///
    /// @param mapper mapper for nested payloads, not null
    /// @param root the flow object, not null
    /// @return the flow, never null
    static Flow readFlow(ObjectMapper mapper, JsonNode root) {
        Map<String, FlowNode> nodes = new LinkedHashMap<>();
        JsonNode nodesNode = root.get("nodes");
        if (nodesNode != null && nodesNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = nodesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                String key = entry.getKey();
                if (!entry.getValue().isObject()) {
                    logger.warning("Skipping node '" + key + "': not a JSON object");
                    continue;
                }
                FlowNode node = NodeDeserializer.readNode(mapper, entry.getValue(), key);
                if (!key.equals(node.getId())) {
                    logger.warning(
                            "Node key '" + key + "' does not match id '" + node.getId() + "'");
                    node = node.toBuilder().id(key).build();
                }
                nodes.put(key, node);
            }
        } else if (nodesNode != null && !nodesNode.isNull()) {
            logger.warning("Ignoring 'nodes': not a JSON object");
        }

        if (nodes.isEmpty()) {
            logger.warning("Flow has no nodes, synthesizing root menu");
            nodes.put(
                    SYNTHESIZED_ROOT_ID,
                    FlowNode.builder()
                            .id(SYNTHESIZED_ROOT_ID)
                            .label(SYNTHESIZED_ROOT_LABEL)
                            .type(NodeType.MENU)
                            .build());
        }

        String rootId = textOrNull(root, "rootId");
        if (rootId == null || !nodes.containsKey(rootId)) {
            String fallback = nodes.keySet().iterator().next();
            logger.warning("Root '" + rootId + "' not found, using '" + fallback + "'");
            rootId = fallback;
        }

        String id = textOrNull(root, "id");
        return Flow.builder()
                .version(intOr(root, "version", 1))
                .id(id != null ? id : "")
                .name(textOrNull(root, "name"))
                .rootId(rootId)
                .nodes(nodes)
                .build();
    }
}
