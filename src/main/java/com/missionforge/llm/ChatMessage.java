package com.missionforge.llm;

/**
 * One chat turn. role is "user" or "assistant".
 */
public class ChatMessage {

    public static final String USER      = "user";
    public static final String ASSISTANT = "assistant";

    private final String role;
    private final String content;

    public ChatMessage(String role, String content) {
        this.role    = role;
        this.content = content != null ? content : "";
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content);
    }

    public String getRole()    { return role; }
    public String getContent() { return content; }

    @Override
    public String toString() {
        return role + "(" + content.length() + " chars)";
    }
}
