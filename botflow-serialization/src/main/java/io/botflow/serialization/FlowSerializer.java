package io.botflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.botflow.core.flow.Flow;
import io.botflow.core.flow.FlowDocument;
import io.botflow.core.flow.NodePosition;
import io.botflow.core.normalize.FlowNormalizer;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/// Utility class for reading and writing flows and flow documents as JSON.
///
/// ### Usage
/// {@snippet :
/// // Export
/// String json = FlowSerializer.toJson(document);
///
/// // Import: lenient parse, then normalize
/// FlowDocument restored = FlowSerializer.importDocument(json, env.getNormalizer());
/// }
///
/// ### Document shape
/// `{"flow": {...}, "positions": {"<nodeId>": {"x": 0.0, "y": 0.0}}}`. Import also
/// accepts a bare flow object, which yields a document without positions.
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see BotflowJacksonModule for the registered type handlers
public final class FlowSerializer {

    private static final Logger logger = Logger.getLogger(FlowSerializer.class.getName());

    private FlowSerializer() {}

    /// Serializes a flow to pretty-printed JSON.
    ///
    /// @param flow the flow to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Flow flow) {
        try {
            return createMapper().writeValueAsString(flow);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize flow: " + e.getMessage(), e);
        }
    }

    /// Serializes a document (flow plus positions) to pretty-printed JSON.
    ///
    /// @param document the document to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(FlowDocument document) {
        try {
            return createMapper().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize flow document: " + e.getMessage(), e);
        }
    }

    /// Deserializes a flow without normalizing it.
    ///
    /// Structural gaps (missing ids, root, node types) are repaired; payload defaults and
    /// children are left as found.
    ///
    /// @param json JSON string, not null
    /// @return deserialized flow, never null
    /// @throws IllegalArgumentException if the input is not a JSON object
    public static Flow fromJson(String json) {
        ObjectMapper mapper = createMapper();
        return FlowGraphDeserializer.readFlow(mapper, readObject(mapper, json));
    }

    /// Imports a document: lenient parse, normalization, and pruning of positions that
    /// belong to no node.
    ///
    /// @param json document or bare flow JSON, not null
    /// @param normalizer normalizer applied to the parsed flow, not null
    /// @return canonical document, never null
    /// @throws IllegalArgumentException if the input is not a JSON object
    public static FlowDocument importDocument(String json, FlowNormalizer normalizer) {
        ObjectMapper mapper = createMapper();
        JsonNode root = readObject(mapper, json);

        JsonNode flowNode = root.get("flow");
        boolean wrapped = flowNode != null && flowNode.isObject();
        Flow flow =
                normalizer.normalize(
                        FlowGraphDeserializer.readFlow(mapper, wrapped ? flowNode : root));
        Map<String, NodePosition> positions =
                wrapped ? readPositions(root.get("positions")) : Map.of();

        return new FlowDocument(flow, positions).withFlow(flow);
    }

    /// Creates an ObjectMapper configured for flow serialization.
    ///
    /// Registers:
    /// - `BotflowJacksonModule` for the flow type hierarchy
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - pretty-printed output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new BotflowJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private static JsonNode readObject(ObjectMapper mapper, String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse flow JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Flow JSON must be an object");
        }
        return root;
    }

    private static Map<String, NodePosition> readPositions(JsonNode positions) {
        Map<String, NodePosition> result = new LinkedHashMap<>();
        if (positions == null || !positions.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = positions.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode x = entry.getValue().get("x");
            JsonNode y = entry.getValue().get("y");
            if (x == null || y == null || !x.isNumber() || !y.isNumber()) {
                logger.warning("Skipping malformed position of node '" + entry.getKey() + "'");
                continue;
            }
            result.put(entry.getKey(), new NodePosition(x.asDouble(), y.asDouble()));
        }
        return result;
    }
}
