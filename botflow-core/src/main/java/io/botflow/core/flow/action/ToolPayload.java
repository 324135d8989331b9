package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Invokes a named tool with static arguments.
public record ToolPayload(String name, Map<String, Object> args) implements ActionPayload {

    public ToolPayload {
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TOOL;
    }
}
