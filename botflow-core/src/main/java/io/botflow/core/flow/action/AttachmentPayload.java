package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;

/// File sent to the user.
///
/// @param attachmentType media type family (`image`, `video`, `document`, ...)
/// @param url public location of the file
/// @param name file name shown to the user
public record AttachmentPayload(String attachmentType, String url, String name)
        implements ActionPayload {

    @Override
    public NodeKind kind() {
        return NodeKind.ATTACHMENT;
    }
}
