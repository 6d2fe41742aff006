package com.embedbot.chat;

/**
 * One inbound message of a chat session: either text or a document.
 */
public record ChatEvent(long chatId, String username, String displayName, String text, Document document) {

    public static ChatEvent text(long chatId, String username, String displayName, String text) {
        return new ChatEvent(chatId, username, displayName, text, null);
    }

    public static ChatEvent document(long chatId, String username, String displayName, String fileName,
            byte[] content) {
        return new ChatEvent(chatId, username, displayName, null, new Document(fileName, content));
    }

    public boolean isDocument() {
        return document != null;
    }

    public record Document(String fileName, byte[] content) {
    }
}
