package io.botflow.core.kind;

import io.botflow.core.flow.MenuOption;
import io.botflow.core.flow.action.ActionPayload;
import io.botflow.core.flow.action.AskPayload;
import io.botflow.core.flow.action.AskValidation;
import io.botflow.core.flow.action.AskVarType;
import io.botflow.core.flow.action.AttachmentPayload;
import io.botflow.core.flow.action.ButtonItem;
import io.botflow.core.flow.action.ButtonsPayload;
import io.botflow.core.flow.action.HandoffPayload;
import io.botflow.core.flow.action.KnowledgeSearchPayload;
import io.botflow.core.flow.action.MessagePayload;
import io.botflow.core.flow.action.SchedulerMode;
import io.botflow.core.flow.action.SchedulerPayload;
import io.botflow.core.flow.action.ToolPayload;
import io.botflow.core.flow.action.TransferPayload;
import io.botflow.core.flow.action.WebhookInPayload;
import io.botflow.core.flow.action.WebhookOutPayload;
import io.botflow.core.handle.HandleId;
import io.botflow.core.schedule.CustomSchedule;
import io.botflow.core.schedule.DateException;
import io.botflow.core.schedule.TimeWindow;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Fills missing payload fields with their defaults.
///
/// Every `complete*` method returns its argument unchanged (same instance) when nothing
/// was missing, and is idempotent: completing an already completed value is a no-op.
/// Targets are never touched here.
///
/// @implNote Immutable and thread-safe.
public final class PayloadDefaults {

    public static final String DEFAULT_TIMEZONE = "America/Lima";
    public static final String DEFAULT_QUESTION = "What is your answer?";
    public static final String DEFAULT_VAR_NAME = "answer";
    public static final String DEFAULT_RETRY_MESSAGE = "Sorry, could you try again?";

    private final String defaultTimezone;
    private final int defaultButtonLimit;

    public PayloadDefaults() {
        this(DEFAULT_TIMEZONE, ChannelButtonLimit.defaultLimit());
    }

    /// @param defaultTimezone zone for schedules that declare none, not null
    /// @param defaultButtonLimit cap for buttons nodes that declare none, at least 1
    public PayloadDefaults(String defaultTimezone, int defaultButtonLimit) {
        this.defaultTimezone = Objects.requireNonNull(defaultTimezone, "defaultTimezone required");
        if (defaultButtonLimit < 1) {
            throw new IllegalArgumentException(
                    "Default button limit must be at least 1: " + defaultButtonLimit);
        }
        this.defaultButtonLimit = defaultButtonLimit;
    }

    public String getDefaultTimezone() {
        return defaultTimezone;
    }

    public int getDefaultButtonLimit() {
        return defaultButtonLimit;
    }

    /// Completes the menu options of a menu node.
    ///
    /// An empty list receives one default option. Entries without a usable id (missing,
    /// blank or already used by an earlier entry) get a synthesized one; other ids are
    /// preserved. Missing labels become `Option <n>`.
    ///
    /// @param options current options, not null
    /// @return completed options, the same list when unchanged
    public List<MenuOption> completeOptions(List<MenuOption> options) {
        if (options.isEmpty()) {
            return List.of(
                    new MenuOption(IdSynthesizer.OPTION_PREFIX + "-1", "Option 1", null, null));
        }
        Set<String> kept = keptIds(options.stream().map(MenuOption::id).toList(), null);
        Set<String> taken = new HashSet<>(kept);
        Set<String> seen = new HashSet<>();
        List<MenuOption> completed = new ArrayList<>(options.size());
        for (int i = 0; i < options.size(); i++) {
            MenuOption option = options.get(i);
            String id = option.id();
            if (!isUsableId(id, null) || !seen.add(id)) {
                id = IdSynthesizer.synthesize(IdSynthesizer.OPTION_PREFIX, i + 1, taken);
                taken.add(id);
            }
            String label = option.label() != null ? option.label() : "Option " + (i + 1);
            completed.add(new MenuOption(id, label, option.value(), option.targetId()));
        }
        return completed.equals(options) ? options : List.copyOf(completed);
    }

    /// Completes the items of a buttons node; like {@link #completeOptions(List)} but with
    /// `btn-<n>` ids, `Button <n>` labels and `BTN_<n>` values. The id `more` is reserved
    /// for the overflow handle and is always re-synthesized.
    ///
    /// @param items current items, not null
    /// @return completed items, the same list when unchanged
    public List<ButtonItem> completeItems(List<ButtonItem> items) {
        if (items.isEmpty()) {
            return List.of(defaultItem(1));
        }
        Set<String> kept =
                keptIds(items.stream().map(ButtonItem::id).toList(), HandleId.RESERVED_MORE_TOKEN);
        Set<String> taken = new HashSet<>(kept);
        taken.add(HandleId.RESERVED_MORE_TOKEN);
        Set<String> seen = new HashSet<>();
        List<ButtonItem> completed = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            ButtonItem item = items.get(i);
            String id = item.id();
            if (!isUsableId(id, HandleId.RESERVED_MORE_TOKEN) || !seen.add(id)) {
                id = IdSynthesizer.synthesize(IdSynthesizer.BUTTON_PREFIX, i + 1, taken);
                taken.add(id);
            }
            String label = item.label() != null ? item.label() : "Button " + (i + 1);
            String value = item.value() != null ? item.value() : "BTN_" + (i + 1);
            completed.add(new ButtonItem(id, label, value, item.targetId()));
        }
        return completed.equals(items) ? items : List.copyOf(completed);
    }

    /// Completes an action payload of any kind.
    ///
    /// @param payload payload to complete, not null
    /// @return completed payload, the same instance when nothing was missing
    public ActionPayload complete(ActionPayload payload) {
        ActionPayload completed;
        if (payload instanceof ButtonsPayload buttons) {
            completed = completeButtons(buttons);
        } else if (payload instanceof AskPayload ask) {
            completed = completeAsk(ask);
        } else if (payload instanceof SchedulerPayload scheduler) {
            completed = completeScheduler(scheduler);
        } else if (payload instanceof MessagePayload message) {
            completed = new MessagePayload(orEmpty(message.text()));
        } else if (payload instanceof AttachmentPayload attachment) {
            completed =
                    new AttachmentPayload(
                            orDefault(attachment.attachmentType(), "image"),
                            orEmpty(attachment.url()),
                            orDefault(attachment.name(), "file"));
        } else if (payload instanceof WebhookOutPayload webhook) {
            completed =
                    new WebhookOutPayload(
                            orDefault(webhook.method(), "POST"),
                            orEmpty(webhook.url()),
                            webhook.headers(),
                            orEmpty(webhook.body()));
        } else if (payload instanceof WebhookInPayload webhook) {
            completed =
                    new WebhookInPayload(
                            orEmpty(webhook.path()),
                            orEmpty(webhook.secret()),
                            orEmpty(webhook.sample()));
        } else if (payload instanceof TransferPayload transfer) {
            completed =
                    new TransferPayload(
                            orEmpty(transfer.target()), orEmpty(transfer.destination()));
        } else if (payload instanceof HandoffPayload handoff) {
            completed = new HandoffPayload(orEmpty(handoff.queue()), orEmpty(handoff.note()));
        } else if (payload instanceof KnowledgeSearchPayload search) {
            completed = new KnowledgeSearchPayload(orEmpty(search.prompt()));
        } else if (payload instanceof ToolPayload tool) {
            completed = new ToolPayload(orEmpty(tool.name()), tool.args());
        } else {
            // end and opaque payloads carry nothing to default
            completed = payload;
        }
        return completed.equals(payload) ? payload : completed;
    }

    /// Completes a custom schedule: default timezone, at least one window, window
    /// weekdays and times, and only exceptions that name a date.
    ///
    /// @param schedule schedule to complete, may be null
    /// @return completed schedule, the same instance when nothing was missing
    public CustomSchedule completeSchedule(CustomSchedule schedule) {
        if (schedule == null) {
            return CustomSchedule.defaultSchedule(defaultTimezone);
        }
        String timezone =
                schedule.timezone() == null || schedule.timezone().isBlank()
                        ? defaultTimezone
                        : schedule.timezone();
        List<TimeWindow> windows = new ArrayList<>();
        for (TimeWindow window : schedule.windows()) {
            windows.add(completeWindow(window));
        }
        if (windows.isEmpty()) {
            windows.add(TimeWindow.defaultWindow());
        }
        List<DateException> exceptions = new ArrayList<>();
        for (DateException exception : schedule.exceptions()) {
            if (exception.date() != null && !exception.date().isBlank()) {
                exceptions.add(exception);
            }
        }
        CustomSchedule completed = new CustomSchedule(timezone, windows, exceptions);
        return completed.equals(schedule) ? schedule : completed;
    }

    private ButtonsPayload completeButtons(ButtonsPayload buttons) {
        int maxButtons = buttons.maxButtons() < 1 ? defaultButtonLimit : buttons.maxButtons();
        return new ButtonsPayload(
                completeItems(buttons.items()), maxButtons, buttons.moreTargetId());
    }

    private AskPayload completeAsk(AskPayload ask) {
        return new AskPayload(
                ask.questionText() != null ? ask.questionText() : DEFAULT_QUESTION,
                orDefault(ask.varName(), DEFAULT_VAR_NAME),
                ask.varType() != null ? ask.varType() : AskVarType.TEXT,
                ask.validation() != null ? ask.validation() : AskValidation.NONE,
                orDefault(ask.retryMessage(), DEFAULT_RETRY_MESSAGE),
                ask.answerTargetId(),
                ask.invalidTargetId());
    }

    private SchedulerPayload completeScheduler(SchedulerPayload scheduler) {
        return new SchedulerPayload(
                scheduler.mode() != null ? scheduler.mode() : SchedulerMode.CUSTOM,
                completeSchedule(scheduler.custom()),
                scheduler.inWindowTargetId(),
                scheduler.outOfWindowTargetId());
    }

    private static TimeWindow completeWindow(TimeWindow window) {
        Set<DayOfWeek> weekdays =
                window.weekdays() != null
                        ? window.weekdays()
                        : EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
        return new TimeWindow(
                weekdays,
                orDefault(window.start(), TimeWindow.DEFAULT_START),
                orDefault(window.end(), TimeWindow.DEFAULT_END),
                window.overnight());
    }

    ButtonItem defaultItem(int ordinal) {
        return new ButtonItem(
                IdSynthesizer.BUTTON_PREFIX + "-" + ordinal,
                "Button " + ordinal,
                "BTN_" + ordinal,
                null);
    }

    private static Set<String> keptIds(List<String> ids, String reserved) {
        Set<String> kept = new HashSet<>();
        for (String id : ids) {
            if (isUsableId(id, reserved)) {
                kept.add(id);
            }
        }
        return kept;
    }

    private static boolean isUsableId(String id, String reserved) {
        return id != null && !id.isBlank() && !id.equals(reserved);
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
