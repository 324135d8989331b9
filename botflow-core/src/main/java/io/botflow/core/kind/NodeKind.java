package io.botflow.core.kind;

import java.util.Optional;

/// Every kind a node can have, with its wire name and handle shape.
///
/// `MENU` is the kind of all menu nodes; the other kinds belong to action nodes and are
/// written as the action's `kind` field. {@link #OPAQUE} stands for any action kind this
/// library does not model; it has no wire name of its own.
public enum NodeKind {
    MENU("menu", HandleShape.OPTIONS),
    MESSAGE("message", HandleShape.SINGLE),
    BUTTONS("buttons", HandleShape.BUTTONS),
    ATTACHMENT("attachment", HandleShape.SINGLE),
    WEBHOOK_OUT("webhook_out", HandleShape.SINGLE),
    WEBHOOK_IN("webhook_in", HandleShape.SINGLE),
    TRANSFER("transfer", HandleShape.SINGLE),
    HANDOFF("handoff", HandleShape.SINGLE),
    IA_RAG("ia_rag", HandleShape.SINGLE),
    TOOL("tool", HandleShape.SINGLE),
    ASK("ask", HandleShape.ASK),
    SCHEDULER("scheduler", HandleShape.SCHEDULER),
    END("end", HandleShape.SINGLE),
    OPAQUE(null, HandleShape.SINGLE);

    private final String wireName;
    private final HandleShape handleShape;

    NodeKind(String wireName, HandleShape handleShape) {
        this.wireName = wireName;
        this.handleShape = handleShape;
    }

    /// Returns the wire name.
    ///
    /// @return wire name, or null for {@link #OPAQUE}
    public String wireName() {
        return wireName;
    }

    public HandleShape handleShape() {
        return handleShape;
    }

    public boolean isAction() {
        return this != MENU;
    }

    /// Returns whether new nodes of this kind can be created from a template.
    public boolean isCreatable() {
        return this != OPAQUE;
    }

    /// Resolves an action or node kind by wire name.
    ///
    /// @param value wire name, may be null
    /// @return matching kind, or empty when unknown (never {@link #OPAQUE})
    public static Optional<NodeKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (NodeKind kind : values()) {
            if (kind.wireName != null && kind.wireName.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
