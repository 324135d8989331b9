package io.botflow.core.flow.action;

import io.botflow.core.kind.NodeKind;
import java.util.ArrayList;
import java.util.List;

/// Outgoing HTTP call made when the node is reached.
///
/// `body` may contain `{{variable}}` placeholders resolved by the runtime.
public record WebhookOutPayload(
        String method, String url, List<WebhookHeader> headers, String body)
        implements ActionPayload {

    public WebhookOutPayload {
        List<WebhookHeader> copy = new ArrayList<>();
        if (headers != null) {
            for (WebhookHeader header : headers) {
                if (header != null) {
                    copy.add(header);
                }
            }
        }
        headers = List.copyOf(copy);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WEBHOOK_OUT;
    }
}
