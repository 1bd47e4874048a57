package io.kneo.programmer.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

public class ChannelActivityLogger {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelActivityLogger.class);
    private static final String CHANNEL_KEY = "channel";
    private static final String ACTION_KEY = "action";

    private ChannelActivityLogger() {
    }

    public static void logActivity(String channelId, String action, String message, Object... args) {
        try {
            MDC.put(CHANNEL_KEY, channelId);
            MDC.put(ACTION_KEY, action);

            String formattedMessage = String.format(message, args);

            LOGGER.info("CHANNEL_ACTIVITY - {} - {} - {}", channelId, action, formattedMessage);
        } finally {
            MDC.remove(CHANNEL_KEY);
            MDC.remove(ACTION_KEY);
        }
    }

    public static void logFailure(String channelId, String action, String message, Object... args) {
        try {
            MDC.put(CHANNEL_KEY, channelId);
            MDC.put(ACTION_KEY, action);

            String formattedMessage = String.format(message, args);

            LOGGER.warn("CHANNEL_ACTIVITY - {} - {} - {}", channelId, action, formattedMessage);
        } finally {
            MDC.remove(CHANNEL_KEY);
            MDC.remove(ACTION_KEY);
        }
    }
}
