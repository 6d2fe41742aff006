package com.embedbot.chat;

public record ChatReply(String text, Attachment attachment) {

    public static ChatReply text(String text) {
        return new ChatReply(text, null);
    }

    public static ChatReply attachment(String caption, String fileName, byte[] content) {
        return new ChatReply(caption, new Attachment(fileName, content));
    }

    public boolean hasAttachment() {
        return attachment != null;
    }

    public record Attachment(String fileName, byte[] content) {
    }
}
