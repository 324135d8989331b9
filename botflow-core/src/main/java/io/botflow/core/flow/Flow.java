package io.botflow.core.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable flow document: the whole conversational graph.
///
/// A flow is a pure value. Every editing operation takes the current flow and returns
/// either the very same instance (nothing changed) or a new one, so callers can detect a
/// no-op with a reference comparison.
///
/// ### Structure
/// - **version**: flat schema version tag
/// - **id / name**: document identity and display name
/// - **rootId**: entry node, always present in `nodes` and never deletable
/// - **nodes**: node map in insertion order; iteration order is significant for
///   deterministic parent lookup during structural edits
///
/// ### Validation
/// The builder verifies that `rootId` exists in `nodes`. Handle/children consistency is
/// the normalizer's job and is not checked here.
///
/// @implNote Immutable and thread-safe after construction. The node map is an
/// unmodifiable insertion-ordered copy.
///
/// @see FlowNode for the vertex model
/// @see io.botflow.core.normalize.FlowNormalizer for invariant repair
public final class Flow {

    private final int version;
    private final String id;
    private final String name;
    private final String rootId;
    private final Map<String, FlowNode> nodes;

    private Flow(Builder builder) {
        this.version = builder.version;
        this.id = Objects.requireNonNull(builder.id, "Flow ID required");
        this.name = builder.name != null ? builder.name : "";
        this.rootId = Objects.requireNonNull(builder.rootId, "Root node required");
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));

        if (!nodes.containsKey(rootId)) {
            throw new IllegalStateException("Root node '" + rootId + "' not found in flow nodes");
        }
        for (Map.Entry<String, FlowNode> entry : nodes.entrySet()) {
            if (!entry.getKey().equals(entry.getValue().getId())) {
                throw new IllegalStateException(
                        "Node key '"
                                + entry.getKey()
                                + "' does not match node id '"
                                + entry.getValue().getId()
                                + "'");
            }
        }
    }

    /// Returns the flat schema version tag.
    ///
    /// @return version, 1 for documents without an explicit version
    public int getVersion() {
        return version;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /// Returns the entry node id.
    ///
    /// @return root node id, always a key of {@link #getNodes()}
    public String getRootId() {
        return rootId;
    }

    /// Returns all nodes by id.
    ///
    /// @return unmodifiable, insertion-ordered map, never null
    public Map<String, FlowNode> getNodes() {
        return nodes;
    }

    /// Looks up a node by id.
    ///
    /// @param nodeId node id, may be null
    /// @return the node, or null if absent
    public FlowNode getNode(String nodeId) {
        return nodeId == null ? null : nodes.get(nodeId);
    }

    public boolean containsNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    public FlowNode getRoot() {
        return nodes.get(rootId);
    }

    /// Creates a new flow builder.
    ///
    /// @return new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder pre-populated with this flow's fields.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder().version(version).id(id).name(name).rootId(rootId).nodes(nodes);
    }

    /// Builder for constructing immutable Flow instances.
    ///
    /// Required fields: `id`, `rootId`. The root must exist in the node map.
    ///
    /// @see #build() for validation rules
    public static final class Builder {
        private int version = 1;
        private String id;
        private String name;
        private String rootId;
        private Map<String, FlowNode> nodes = new LinkedHashMap<>();

        private Builder() {}

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder rootId(String rootId) {
            this.rootId = rootId;
            return this;
        }

        /// Replaces the node map. Iteration order of the given map is preserved.
        ///
        /// @param nodes map of node id to node, not null
        /// @return this builder for chaining
        public Builder nodes(Map<String, FlowNode> nodes) {
            this.nodes = new LinkedHashMap<>(nodes);
            return this;
        }

        /// Adds or replaces one node, keyed by its id.
        ///
        /// @param node the node, not null
        /// @return this builder for chaining
        public Builder node(FlowNode node) {
            this.nodes.put(node.getId(), node);
            return this;
        }

        /// Builds the immutable flow.
        ///
        /// @return new Flow instance, never null
        /// @throws NullPointerException if id or rootId is null
        /// @throws IllegalStateException if rootId is not in nodes, or a key differs from its
        ///     node's id
        public Flow build() {
            return new Flow(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Flow flow)) return false;
        return version == flow.version
                && id.equals(flow.id)
                && name.equals(flow.name)
                && rootId.equals(flow.rootId)
                && nodes.equals(flow.nodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, id, name, rootId, nodes);
    }

    @Override
    public String toString() {
        return "Flow{id='" + id + "', version=" + version + ", nodes=" + nodes.size() + "}";
    }
}
