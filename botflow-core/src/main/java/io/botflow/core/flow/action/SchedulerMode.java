package io.botflow.core.flow.action;

/// Where a scheduler node takes its business hours from.
public enum SchedulerMode {
    /// Hours come from the node's own {@link io.botflow.core.schedule.CustomSchedule}.
    CUSTOM("custom"),
    /// Hours are resolved by an external system at runtime; the custom schedule is kept
    /// only as a fallback.
    EXTERNAL("external");

    private final String wireName;

    SchedulerMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Resolves a wire name. `"bitrix"` is accepted as a legacy alias of `"external"`;
    /// anything else maps to {@link #CUSTOM}.
    public static SchedulerMode fromWireName(String value) {
        if ("external".equals(value) || "bitrix".equals(value)) {
            return EXTERNAL;
        }
        return CUSTOM;
    }
}
