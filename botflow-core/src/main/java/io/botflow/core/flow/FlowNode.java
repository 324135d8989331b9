package io.botflow.core.flow;

import io.botflow.core.flow.action.ActionPayload;
import io.botflow.core.kind.NodeKind;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/// One vertex of a {@link Flow}.
///
/// A node is either a `MENU` carrying {@link MenuOption}s or an `ACTION` carrying an
/// {@link ActionPayload}. `children` is derived data: the de-duplicated, ordered union of
/// every target the node's output handles point at. It is recomputed by the normalizer and
/// by handle assignment and should never be edited independently of the handle fields,
/// except for single-handle kinds whose only target *is* `children[0]`.
///
/// ### Equality
/// Value-based over every field. The normalizer relies on this to return the very same
/// node instance when no repair was needed.
///
/// @implNote Immutable and thread-safe after construction. All lists are unmodifiable copies.
///
/// @see NodeKind for the kind-specific handle shape
public final class FlowNode {

    private final String id;
    private final String label;
    private final NodeType type;
    private final String description;
    private final List<String> children;
    private final ActionPayload action;
    private final List<MenuOption> menuOptions;

    private FlowNode(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Node ID required");
        this.label = builder.label != null ? builder.label : "";
        this.type = Objects.requireNonNull(builder.type, "Node type required");
        this.description = builder.description;
        this.children = List.copyOf(new LinkedHashSet<>(builder.children));
        this.action = builder.action;
        this.menuOptions = List.copyOf(builder.menuOptions);
    }

    /// Creates a new node builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder pre-populated with this node's fields.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .label(label)
                .type(type)
                .description(description)
                .children(children)
                .action(action)
                .menuOptions(menuOptions);
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public NodeType getType() {
        return type;
    }

    /// Returns the optional free-text description shown in the editor.
    ///
    /// @return description, or null if not set
    public String getDescription() {
        return description;
    }

    /// Returns the derived child list.
    ///
    /// @return unmodifiable, duplicate-free list of target ids, never null
    public List<String> getChildren() {
        return children;
    }

    /// Returns the action payload.
    ///
    /// @return payload, or null for menu nodes (and for action nodes not yet normalized)
    public ActionPayload getAction() {
        return action;
    }

    /// Returns the menu options.
    ///
    /// @return unmodifiable list, empty for action nodes, never null
    public List<MenuOption> getMenuOptions() {
        return menuOptions;
    }

    /// Returns the kind that decides this node's handle shape.
    ///
    /// Menu nodes are always {@link NodeKind#MENU}. Action nodes take the kind of their
    /// payload; an action node without payload behaves as {@link NodeKind#MESSAGE}.
    ///
    /// @return node kind, never null
    public NodeKind getKind() {
        if (type == NodeType.MENU) {
            return NodeKind.MENU;
        }
        return action != null ? action.kind() : NodeKind.MESSAGE;
    }

    /// Returns the first child, which is the target of the `out:default` handle for
    /// single-handle kinds.
    ///
    /// @return first child id, or null if the node has no children
    public String firstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    /// Builder for constructing immutable FlowNode instances.
    ///
    /// Required fields: `id`, `type`.
    public static final class Builder {
        private String id;
        private String label;
        private NodeType type;
        private String description;
        private List<String> children = new ArrayList<>();
        private ActionPayload action;
        private List<MenuOption> menuOptions = new ArrayList<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder type(NodeType type) {
            this.type = type;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /// Sets the child list. Null entries are dropped and duplicates collapse on build.
        ///
        /// @param children child ids, may be null for none
        /// @return this builder for chaining
        public Builder children(List<String> children) {
            this.children = new ArrayList<>();
            if (children != null) {
                for (String child : children) {
                    if (child != null) {
                        this.children.add(child);
                    }
                }
            }
            return this;
        }

        public Builder action(ActionPayload action) {
            this.action = action;
            return this;
        }

        /// Sets the menu options. Null entries are dropped.
        ///
        /// @param menuOptions options, may be null for none
        /// @return this builder for chaining
        public Builder menuOptions(List<MenuOption> menuOptions) {
            this.menuOptions = new ArrayList<>();
            if (menuOptions != null) {
                for (MenuOption option : menuOptions) {
                    if (option != null) {
                        this.menuOptions.add(option);
                    }
                }
            }
            return this;
        }

        /// Builds the immutable node.
        ///
        /// @return new FlowNode instance, never null
        /// @throws NullPointerException if `id` or `type` is null
        public FlowNode build() {
            return new FlowNode(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlowNode node)) return false;
        return id.equals(node.id)
                && label.equals(node.label)
                && type == node.type
                && Objects.equals(description, node.description)
                && children.equals(node.children)
                && Objects.equals(action, node.action)
                && menuOptions.equals(node.menuOptions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, type, description, children, action, menuOptions);
    }

    @Override
    public String toString() {
        return "FlowNode{id='" + id + "', type=" + type + ", kind=" + getKind() + "}";
    }
}
