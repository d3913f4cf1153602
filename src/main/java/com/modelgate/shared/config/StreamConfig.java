package com.modelgate.shared.config;

public record StreamConfig(
    String command,
    String channelPrefix,
    int compactionThreshold
) {
    public static StreamConfig defaults() {
        return new StreamConfig("llm_stream_text", "llm-stream-", 1024);
    }

    public String channelFor(String requestId) {
        return channelPrefix + requestId;
    }
}
