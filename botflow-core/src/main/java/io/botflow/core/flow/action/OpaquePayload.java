package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Payload of an action kind this library does not model (for example a kind added by a
/// newer editor). The raw data is carried through untouched so that a load/save cycle
/// does not lose it; the node behaves as a single-handle kind.
///
/// @param kindName the kind string exactly as found in the document
/// @param data raw payload fields
public record OpaquePayload(String kindName, Map<String, Object> data) implements ActionPayload {

    public OpaquePayload {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPAQUE;
    }
}
