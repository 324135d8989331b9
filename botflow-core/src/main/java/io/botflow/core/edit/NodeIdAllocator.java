package io.botflow.core.edit;

import io.botflow.core.flow.FlowDraft;
import io.botflow.core.flow.FlowNode;

/// Hierarchical ids for new nodes.
///
/// A new child of the root is named `<n>`, a new child of any other node `<parent>.<n>`,
/// where `n` is one more than the largest numeric tail (the part after the last `.`)
/// among the parent's current children. Ids already present in the draft are skipped.
public final class NodeIdAllocator {

    private NodeIdAllocator() {}

    /// @param draft draft the id must be free in, not null
    /// @param parentId node the new node will hang from
    /// @return an id not present in the draft
    public static String nextChildId(FlowDraft draft, String parentId) {
        int max = 0;
        FlowNode parent = draft.node(parentId);
        if (parent != null) {
            for (String sibling : parent.getChildren()) {
                String tail = sibling.substring(sibling.lastIndexOf('.') + 1);
                if (tail.matches("\\d{1,9}")) {
                    max = Math.max(max, Integer.parseInt(tail));
                }
            }
        }
        int next = max + 1;
        String candidate = idFor(draft, parentId, next);
        while (draft.contains(candidate)) {
            next++;
            candidate = idFor(draft, parentId, next);
        }
        return candidate;
    }

    private static String idFor(FlowDraft draft, String parentId, int ordinal) {
        return parentId.equals(draft.getRootId())
                ? String.valueOf(ordinal)
                : parentId + "." + ordinal;
    }
}
