package io.botflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.botflow.core.flow.Flow;
import io.botflow.core.flow.FlowNode;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a `Flow` as `{"version", "id", "name", "rootId", "nodes": {id: node}}`.
///
/// Nodes are written in the flow's iteration order.
///
/// @implNote Package-private. Registered by {@link BotflowJacksonModule}.
/// @see FlowGraphDeserializer for the inverse operation
class FlowGraphSerializer extends StdSerializer<Flow> {

    @Serial private static final long serialVersionUID = -6120939412580442861L;

    FlowGraphSerializer() {
        super(Flow.class);
    }

    @Override
    public void serialize(Flow flow, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("version", flow.getVersion());
        gen.writeStringField("id", flow.getId());
        gen.writeStringField("name", flow.getName());
        gen.writeStringField("rootId", flow.getRootId());
        gen.writeObjectFieldStart("nodes");
        for (Map.Entry<String, FlowNode> entry : flow.getNodes().entrySet()) {
            provider.defaultSerializeField(entry.getKey(), entry.getValue(), gen);
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }
}
