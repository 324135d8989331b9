package io.botflow.serialization;

import static io.botflow.serialization.JsonFields.writeIfNotNull;
import static io.botflow.serialization.JsonFields.writeNullable;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.botflow.core.flow.action.ActionPayload;
import io.botflow.core.flow.action.AskPayload;
import io.botflow.core.flow.action.AskValidation;
import io.botflow.core.flow.action.AttachmentPayload;
import io.botflow.core.flow.action.ButtonItem;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.EndPayload;
import io.botflow.core.flow.action.HandoffPayload;
import io.botflow.core.flow.action.KnowledgeSearchPayload;
import io.botflow.core.flow.action.MessagePayload;
import io.botflow.core.flow.action.OpaquePayload;
import io.botflow.core.flow.action.SchedulerPayload;
import io.botflow.core.flow.action.ToolPayload;
import io.botflow.core.flow.action.TransferPayload;
import io.botflow.core.flow.action.WebhookHeader;
import io.botflow.core.flow.action.WebhookInPayload;
import io.botflow.core.flow.action.WebhookOutPayload;
import io.botflow.core.schedule.CustomSchedule;
import io.botflow.core.schedule.DateException;
import io.botflow.core.schedule.TimeWindow;
import java.io.IOException;
import java.io.Serial;
import java.time.DayOfWeek;

/// Serializes the `ActionPayload` sealed hierarchy as `{"kind": ..., "data": {...}}`.
///
/// ```
/// kind           │ data fields
/// ───────────────┼──────────────────────────────────────────────────────────────────
/// message        │ text
/// buttons        │ items[{id,label,value,targetId}], maxButtons, moreTargetId
/// attachment     │ attType, url, name
/// webhook_out    │ method, url, headers[{k,v}], body
/// webhook_in     │ path, secret, sample
/// transfer       │ target, destination
/// handoff        │ queue, note
/// ia_rag         │ prompt
/// tool           │ name, args
/// ask            │ questionText, varName, varType, validation, retryMessage,
///                │ answerTargetId, invalidTargetId
/// scheduler      │ mode, custom{timezone,windows,exceptions}, inWindowTargetId,
///                │ outOfWindowTargetId
/// end            │ (empty object)
/// ```
///
/// An {@link OpaquePayload} is written back under its original kind with its raw data.
///
/// @implNote Package-private. Registered by {@link BotflowJacksonModule}.
/// @see ActionDeserializer for the inverse operation
class ActionSerializer extends StdSerializer<ActionPayload> {

    @Serial private static final long serialVersionUID = 3046181527410364470L;

    ActionSerializer() {
        super(ActionPayload.class);
    }

    @Override
    public void serialize(ActionPayload action, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        if (action instanceof OpaquePayload opaque) {
            gen.writeStringField("kind", opaque.kindName());
            provider.defaultSerializeField("data", opaque.data(), gen);
            gen.writeEndObject();
            return;
        }

        gen.writeStringField("kind", action.kind().wireName());
        gen.writeObjectFieldStart("data");
        if (action instanceof MessagePayload p) {
            writeNullable(gen, "text", p.text());
        } else if (action instanceof ButtonsPayload p) {
            writeButtons(p, gen);
        } else if (action instanceof AttachmentPayload p) {
            writeNullable(gen, "attType", p.attachmentType());
            writeNullable(gen, "url", p.url());
            writeNullable(gen, "name", p.name());
        } else if (action instanceof WebhookOutPayload p) {
            writeWebhookOut(p, gen);
        } else if (action instanceof WebhookInPayload p) {
            writeNullable(gen, "path", p.path());
            writeNullable(gen, "secret", p.secret());
            writeNullable(gen, "sample", p.sample());
        } else if (action instanceof TransferPayload p) {
            writeNullable(gen, "target", p.target());
            writeNullable(gen, "destination", p.destination());
        } else if (action instanceof HandoffPayload p) {
            writeNullable(gen, "queue", p.queue());
            writeNullable(gen, "note", p.note());
        } else if (action instanceof KnowledgeSearchPayload p) {
            writeNullable(gen, "prompt", p.prompt());
        } else if (action instanceof ToolPayload p) {
            writeNullable(gen, "name", p.name());
            provider.defaultSerializeField("args", p.args(), gen);
        } else if (action instanceof AskPayload p) {
            writeAsk(p, gen);
        } else if (action instanceof SchedulerPayload p) {
            writeScheduler(p, gen);
        } else if (!(action instanceof EndPayload)) {
            throw new IOException("Unknown action payload: " + action.getClass().getSimpleName());
        }
        gen.writeEndObject();

        gen.writeEndObject();
    }

    private void writeButtons(ButtonsPayload p, JsonGenerator gen) throws IOException {
        gen.writeArrayFieldStart("items");
        for (ButtonItem item : p.items()) {
            gen.writeStartObject();
            writeNullable(gen, "id", item.id());
            writeNullable(gen, "label", item.label());
            writeNullable(gen, "value", item.value());
            writeNullable(gen, "targetId", item.targetId());
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeNumberField("maxButtons", p.maxButtons());
        writeNullable(gen, "moreTargetId", p.moreTargetId());
    }

    private void writeWebhookOut(WebhookOutPayload p, JsonGenerator gen) throws IOException {
        writeNullable(gen, "method", p.method());
        writeNullable(gen, "url", p.url());
        gen.writeArrayFieldStart("headers");
        for (WebhookHeader header : p.headers()) {
            gen.writeStartObject();
            writeNullable(gen, "k", header.name());
            writeNullable(gen, "v", header.value());
            gen.writeEndObject();
        }
        gen.writeEndArray();
        writeNullable(gen, "body", p.body());
    }

    private void writeAsk(AskPayload p, JsonGenerator gen) throws IOException {
        writeNullable(gen, "questionText", p.questionText());
        writeNullable(gen, "varName", p.varName());
        if (p.varType() != null) {
            gen.writeStringField("varType", p.varType().wireName());
        }
        if (p.validation() != null) {
            writeValidation(p.validation(), gen);
        }
        writeIfNotNull(gen, "retryMessage", p.retryMessage());
        writeNullable(gen, "answerTargetId", p.answerTargetId());
        writeNullable(gen, "invalidTargetId", p.invalidTargetId());
    }

    private void writeValidation(AskValidation validation, JsonGenerator gen) throws IOException {
        gen.writeObjectFieldStart("validation");
        gen.writeStringField("type", validation.type());
        if (validation instanceof AskValidation.Regex regex) {
            gen.writeStringField("pattern", regex.pattern());
        } else if (validation instanceof AskValidation.Options options) {
            gen.writeArrayFieldStart("options");
            for (String option : options.options()) {
                gen.writeString(option);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }

    private void writeScheduler(SchedulerPayload p, JsonGenerator gen) throws IOException {
        if (p.mode() != null) {
            gen.writeStringField("mode", p.mode().wireName());
        }
        if (p.custom() != null) {
            writeSchedule(p.custom(), gen);
        }
        writeNullable(gen, "inWindowTargetId", p.inWindowTargetId());
        writeNullable(gen, "outOfWindowTargetId", p.outOfWindowTargetId());
    }

    private void writeSchedule(CustomSchedule schedule, JsonGenerator gen) throws IOException {
        gen.writeObjectFieldStart("custom");
        writeNullable(gen, "timezone", schedule.timezone());

        gen.writeArrayFieldStart("windows");
        for (TimeWindow window : schedule.windows()) {
            gen.writeStartObject();
            if (window.weekdays() != null) {
                gen.writeArrayFieldStart("weekdays");
                for (DayOfWeek day : window.weekdays()) {
                    gen.writeNumber(day.getValue());
                }
                gen.writeEndArray();
            }
            writeNullable(gen, "start", window.start());
            writeNullable(gen, "end", window.end());
            if (window.overnight()) {
                gen.writeBooleanField("overnight", true);
            }
            gen.writeEndObject();
        }
        gen.writeEndArray();

        if (!schedule.exceptions().isEmpty()) {
            gen.writeArrayFieldStart("exceptions");
            for (DateException exception : schedule.exceptions()) {
                gen.writeStartObject();
                writeNullable(gen, "date", exception.date());
                if (exception.closed()) {
                    gen.writeBooleanField("closed", true);
                }
                writeIfNotNull(gen, "start", exception.start());
                writeIfNotNull(gen, "end", exception.end());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }
}
