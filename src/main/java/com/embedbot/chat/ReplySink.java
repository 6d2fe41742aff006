package com.embedbot.chat;

/**
 * Delivers replies to a chat session. Implementations must accept calls from worker threads.
 */
@FunctionalInterface
public interface ReplySink {
    void send(long chatId, ChatReply reply);
}
