package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;

/// Kind-specific data carried by an action node.
///
/// Each action kind has exactly one payload record, so a payload is validated once, at the
/// deserialization boundary, and read sites never need ad hoc defaults.
///
/// ### Kinds with their own handles
/// - {@link ButtonsPayload} - one handle per visible button plus `more`
/// - {@link AskPayload} - `answer` and `invalid`
/// - {@link SchedulerPayload} - in / out of business hours
///
/// Every other payload exposes the single `out:default` handle, whose target is stored
/// as the node's first child.
///
/// @see NodeKind for the wire names
public sealed interface ActionPayload
        permits MessagePayload,
                ButtonsPayload,
                AskPayload,
                SchedulerPayload,
                AttachmentPayload,
                WebhookOutPayload,
                WebhookInPayload,
                TransferPayload,
                HandoffPayload,
                KnowledgeSearchPayload,
                ToolPayload,
                EndPayload,
                OpaquePayload {

    /// Returns the action kind this payload belongs to.
    ///
    /// @return node kind, never null
    NodeKind kind();
}
