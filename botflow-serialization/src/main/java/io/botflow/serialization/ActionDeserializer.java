package io.botflow.serialization;

import static io.botflow.serialization.JsonFields.booleanOr;
import static io.botflow.serialization.JsonFields.elements;
import static io.botflow.serialization.JsonFields.intOr;
import static io.botflow.serialization.JsonFields.strings;
import static io.botflow.serialization.JsonFields.textOrNull;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
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
import io.botflow.core.flow.action.OpaquePayload;
import io.botflow.core.flow.action.SchedulerMode;
import io.botflow.core.flow.action.SchedulerPayload;
import io.botflow.core.flow.action.ToolPayload;
import io.botflow.core.flow.action.TransferPayload;
import io.botflow.core.flow.action.WebhookHeader;
import io.botflow.core.flow.action.WebhookInPayload;
import io.botflow.core.flow.action.WebhookOutPayload;
import io.botflow.core.kind.NodeKind;
import io.botflow.core.schedule.CustomSchedule;
import io.botflow.core.schedule.DateException;
import io.botflow.core.schedule.TimeWindow;
import java.io.IOException;
import java.io.Serial;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Deserializes `{"kind": ..., "data": {...}}` into the matching `ActionPayload` record.
///
/// Reading is lenient: missing or mistyped fields become null (or zero) and are completed
/// later by the normalizer. An action without `kind` is read as a message. A kind this
/// library does not model is kept as an {@link OpaquePayload} with its raw data, so a
/// load/save cycle preserves it.
///
/// Weekdays use ISO numbering, 1 (Monday) through 7 (Sunday); other numbers are dropped.
///
/// @implNote Package-private. Registered by {@link BotflowJacksonModule}.
/// @see ActionSerializer for the inverse operation
class ActionDeserializer extends StdDeserializer<ActionPayload> {

    @Serial private static final long serialVersionUID = -1772304638916520557L;

    private static final Logger logger = Logger.getLogger(ActionDeserializer.class.getName());

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    ActionDeserializer() {
        super(ActionPayload.class);
    }

    @Override
    public ActionPayload deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return readAction(mapper, mapper.readTree(p));
    }

    /// Reads one action object.
    ///
    /// @param mapper mapper used to convert free-form maps, not null
    /// @param root the action object, not null
    /// @return the payload, never null
    static ActionPayload readAction(ObjectMapper mapper, JsonNode root) {
        String kindName = textOrNull(root, "kind");
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            data = JsonNodeFactory.instance.objectNode();
        }
        if (kindName == null || kindName.isBlank()) {
            kindName = NodeKind.MESSAGE.wireName();
        }

        Optional<NodeKind> kind = NodeKind.fromWireName(kindName);
        if (kind.isEmpty() || !kind.get().isAction()) {
            logger.fine("Keeping unknown action kind '" + kindName + "' as opaque payload");
            return new OpaquePayload(kindName, mapper.convertValue(data, OBJECT_MAP));
        }

        switch (kind.get()) {
            case MESSAGE:
                return new MessagePayload(textOrNull(data, "text"));
            case BUTTONS:
                return readButtons(data);
            case ATTACHMENT:
                return new AttachmentPayload(
                        textOrNull(data, "attType"),
                        textOrNull(data, "url"),
                        textOrNull(data, "name"));
            case WEBHOOK_OUT:
                return readWebhookOut(data);
            case WEBHOOK_IN:
                return new WebhookInPayload(
                        textOrNull(data, "path"),
                        textOrNull(data, "secret"),
                        textOrNull(data, "sample"));
            case TRANSFER:
                return new TransferPayload(
                        textOrNull(data, "target"), textOrNull(data, "destination"));
            case HANDOFF:
                return new HandoffPayload(textOrNull(data, "queue"), textOrNull(data, "note"));
            case IA_RAG:
                return new KnowledgeSearchPayload(textOrNull(data, "prompt"));
            case TOOL:
                JsonNode args = data.get("args");
                return new ToolPayload(
                        textOrNull(data, "name"),
                        args != null && args.isObject()
                                ? mapper.convertValue(args, OBJECT_MAP)
                                : Map.of());
            case ASK:
                return readAsk(data);
            case SCHEDULER:
                return readScheduler(data);
            case END:
                return new EndPayload();
            default:
                return new OpaquePayload(kindName, mapper.convertValue(data, OBJECT_MAP));
        }
    }

    private static ButtonsPayload readButtons(JsonNode data) {
        List<ButtonItem> items = new ArrayList<>();
        for (JsonNode item : elements(data, "items")) {
            if (item.isObject()) {
                items.add(
                        new ButtonItem(
                                textOrNull(item, "id"),
                                textOrNull(item, "label"),
                                textOrNull(item, "value"),
                                textOrNull(item, "targetId")));
            }
        }
        return new ButtonsPayload(
                items, intOr(data, "maxButtons", 0), textOrNull(data, "moreTargetId"));
    }

    private static WebhookOutPayload readWebhookOut(JsonNode data) {
        List<WebhookHeader> headers = new ArrayList<>();
        for (JsonNode header : elements(data, "headers")) {
            if (header.isObject()) {
                headers.add(new WebhookHeader(textOrNull(header, "k"), textOrNull(header, "v")));
            }
        }
        return new WebhookOutPayload(
                textOrNull(data, "method"),
                textOrNull(data, "url"),
                headers,
                textOrNull(data, "body"));
    }

    private static AskPayload readAsk(JsonNode data) {
        String varType = textOrNull(data, "varType");
        return new AskPayload(
                textOrNull(data, "questionText"),
                textOrNull(data, "varName"),
                varType == null ? null : AskVarType.fromWireName(varType),
                readValidation(data.get("validation")),
                textOrNull(data, "retryMessage"),
                textOrNull(data, "answerTargetId"),
                textOrNull(data, "invalidTargetId"));
    }

    private static AskValidation readValidation(JsonNode validation) {
        if (validation == null || !validation.isObject()) {
            return null;
        }
        String type = textOrNull(validation, "type");
        if ("regex".equals(type)) {
            return new AskValidation.Regex(textOrNull(validation, "pattern"));
        }
        if ("options".equals(type)) {
            return new AskValidation.Options(strings(validation, "options"));
        }
        return AskValidation.NONE;
    }

    private static SchedulerPayload readScheduler(JsonNode data) {
        String mode = textOrNull(data, "mode");
        JsonNode custom = data.get("custom");
        return new SchedulerPayload(
                mode == null ? null : SchedulerMode.fromWireName(mode),
                custom != null && custom.isObject() ? readSchedule(custom) : null,
                textOrNull(data, "inWindowTargetId"),
                textOrNull(data, "outOfWindowTargetId"));
    }

    private static CustomSchedule readSchedule(JsonNode custom) {
        List<TimeWindow> windows = new ArrayList<>();
        for (JsonNode window : elements(custom, "windows")) {
            if (window.isObject()) {
                windows.add(
                        new TimeWindow(
                                readWeekdays(window.get("weekdays")),
                                textOrNull(window, "start"),
                                textOrNull(window, "end"),
                                booleanOr(window, "overnight", false)));
            }
        }
        List<DateException> exceptions = new ArrayList<>();
        for (JsonNode exception : elements(custom, "exceptions")) {
            if (exception.isObject()) {
                exceptions.add(
                        new DateException(
                                textOrNull(exception, "date"),
                                booleanOr(exception, "closed", false),
                                textOrNull(exception, "start"),
                                textOrNull(exception, "end")));
            }
        }
        return new CustomSchedule(textOrNull(custom, "timezone"), windows, exceptions);
    }

    private static Set<DayOfWeek> readWeekdays(JsonNode weekdays) {
        if (weekdays == null || !weekdays.isArray()) {
            return null;
        }
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (JsonNode day : weekdays) {
            if (day.canConvertToInt()) {
                int value = day.asInt();
                if (value >= 1 && value <= 7) {
                    days.add(DayOfWeek.of(value));
                }
            }
        }
        return days;
    }
}
