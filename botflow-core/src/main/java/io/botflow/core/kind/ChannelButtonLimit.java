package io.botflow.core.kind;

import java.util.Arrays;
import java.util.Optional;

/// Maximum number of quick-reply buttons each messaging channel renders.
///
/// The default cap of a buttons node is the strictest of these, so that a flow renders on
/// every channel without truncation.
public enum ChannelButtonLimit {
    WHATSAPP("whatsapp", 3),
    FACEBOOK("facebook", 3),
    TELEGRAM("telegram", 100),
    WEB("web", 5);

    private final String channel;
    private final int maxButtons;

    ChannelButtonLimit(String channel, int maxButtons) {
        this.channel = channel;
        this.maxButtons = maxButtons;
    }

    public String channel() {
        return channel;
    }

    public int maxButtons() {
        return maxButtons;
    }

    /// Returns the smallest limit across all channels.
    public static int defaultLimit() {
        return Arrays.stream(values()).mapToInt(ChannelButtonLimit::maxButtons).min().orElse(3);
    }

    public static Optional<ChannelButtonLimit> forChannel(String channel) {
        return Arrays.stream(values()).filter(limit -> limit.channel.equals(channel)).findFirst();
    }
}
