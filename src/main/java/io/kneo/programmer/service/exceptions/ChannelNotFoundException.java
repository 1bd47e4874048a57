package io.kneo.programmer.service.exceptions;

import lombok.Getter;

@Getter
public class ChannelNotFoundException extends RuntimeException {
    private final String channelId;

    public ChannelNotFoundException(String channelId) {
        super("Channel not configured: " + channelId);
        this.channelId = channelId;
    }
}
