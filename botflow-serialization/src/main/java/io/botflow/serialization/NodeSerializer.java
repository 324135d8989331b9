package io.botflow.serialization;

import static io.botflow.serialization.JsonFields.writeIfNotNull;
import static io.botflow.serialization.JsonFields.writeNullable;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.MenuOption;
import io.botflow.core.flow.NodeType;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `FlowNode` as
/// `{"id", "label", "type", "description"?, "children", "action"?, "menuOptions"?}`.
///
/// `menuOptions` is written for menu nodes (and for any node that still carries options);
/// `action` is written whenever a payload is present.
///
/// @implNote Package-private. Registered by {@link BotflowJacksonModule}.
/// @see NodeDeserializer for the inverse operation
class NodeSerializer extends StdSerializer<FlowNode> {

    @Serial private static final long serialVersionUID = 5286032619284817714L;

    NodeSerializer() {
        super(FlowNode.class);
    }

    @Override
    public void serialize(FlowNode node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.getId());
        gen.writeStringField("label", node.getLabel());
        gen.writeStringField("type", node.getType().wireName());
        writeIfNotNull(gen, "description", node.getDescription());

        gen.writeArrayFieldStart("children");
        for (String child : node.getChildren()) {
            gen.writeString(child);
        }
        gen.writeEndArray();

        if (node.getAction() != null) {
            provider.defaultSerializeField("action", node.getAction(), gen);
        }
        if (node.getType() == NodeType.MENU || !node.getMenuOptions().isEmpty()) {
            gen.writeArrayFieldStart("menuOptions");
            for (MenuOption option : node.getMenuOptions()) {
                gen.writeStartObject();
                writeNullable(gen, "id", option.id());
                writeNullable(gen, "label", option.label());
                writeIfNotNull(gen, "value", option.value());
                writeNullable(gen, "targetId", option.targetId());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }
}
