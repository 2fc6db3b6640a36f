package com.missionforge.llm;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationTest {

    @Test
    void testResetKeepsFraming() {
        Conversation conversation = new Conversation(List.of(
                ChatMessage.user("schema A"),
                ChatMessage.user("context file")));

        conversation.addContext("task names");
        conversation.addTurn("plan it", "```xml\n<Mission/>\n```");
        assertEquals(5, conversation.size());

        conversation.reset();

        assertEquals(2, conversation.size());
        assertEquals(2, conversation.getInitialLength());
        assertEquals("schema A", conversation.getMessages().get(0).getContent());
    }

    @Test
    void testTurnRoles() {
        Conversation conversation = Conversation.empty();

        conversation.addTurn("question", "answer");

        assertEquals(ChatMessage.USER, conversation.getMessages().get(0).getRole());
        assertEquals(ChatMessage.ASSISTANT, conversation.getMessages().get(1).getRole());
        assertThrows(UnsupportedOperationException.class,
                () -> conversation.getMessages().add(ChatMessage.user("x")));
    }
}
