package com.assistrelay.channels;

import java.util.Optional;

public interface ChatPlatform {

    /** Text of the newest message in the thread, empty when the thread has none. */
    Optional<String> lastMessage(String channelId, String threadTs);

    /** Posts into the thread and returns the text as the platform stored it. */
    String postMessage(String channelId, String threadTs, String text);
}
