package io.botflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.botflow.core.flow.Flow;
import io.botflow.core.flow.FlowNode;
import io.botflow.core.flow.action.ActionPayload;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the flow wire format in one place.
///
/// **Custom serializer/deserializer pairs**, no reflection over the model:
/// - `Flow`: `FlowGraphSerializer` / `FlowGraphDeserializer`
/// - `FlowNode`: `NodeSerializer` / `NodeDeserializer`, discriminator `"type"`
/// - `ActionPayload`: `ActionSerializer` / `ActionDeserializer`, discriminator `"kind"`,
///   fields under `"data"`
///
/// `FlowDocument` and `NodePosition` are records and bind through Jackson's record support.
///
/// @see FlowSerializer for the convenience factory API
public class BotflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4518803411722939503L;

    public BotflowJacksonModule() {
        super("BotflowJacksonModule");

        addSerializer(Flow.class, new FlowGraphSerializer());
        addDeserializer(Flow.class, new FlowGraphDeserializer());

        addSerializer(FlowNode.class, new NodeSerializer());
        addDeserializer(FlowNode.class, new NodeDeserializer());

        addSerializer(ActionPayload.class, new ActionSerializer());
        addDeserializer(ActionPayload.class, new ActionDeserializer());
    }
}
