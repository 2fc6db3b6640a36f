package com.missionforge.llm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conversation: message history of one role within one session.
 *
 * The framing messages given at construction survive reset(); everything
 * appended afterwards is dropped by it.
 */
public class Conversation {

    private final List<ChatMessage> messages = new ArrayList<>();
    private final int               initialLength;

    public Conversation(List<ChatMessage> framing) {
        this.messages.addAll(framing);
        this.initialLength = framing.size();
    }

    public static Conversation empty() {
        return new Conversation(List.of());
    }

    /** Add context the next answers should take into account. */
    public void addContext(String user) {
        messages.add(ChatMessage.user(user));
    }

    public void addTurn(String user, String assistant) {
        messages.add(ChatMessage.user(user));
        messages.add(ChatMessage.assistant(assistant));
    }

    public void reset() {
        messages.subList(initialLength, messages.size()).clear();
    }

    public List<ChatMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public int getInitialLength() {
        return initialLength;
    }

    public int size() {
        return messages.size();
    }
}
