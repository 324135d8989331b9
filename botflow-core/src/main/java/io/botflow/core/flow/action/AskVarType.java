package io.botflow.core.flow.action;

/// Type of the variable an ask node stores the user's answer in.
public enum AskVarType {
    TEXT("text"),
    NUMBER("number"),
    OPTION("option");

    private final String wireName;

    AskVarType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /// Resolves a wire name, falling back to {@link #TEXT} for anything unrecognized.
    public static AskVarType fromWireName(String value) {
        for (AskVarType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        return TEXT;
    }
}
