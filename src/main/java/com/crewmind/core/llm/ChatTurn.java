package com.crewmind.core.llm;

/**
 * One message of an agent transcript.
 */
public record ChatTurn(Role role, String content) {

    public enum Role { USER, ASSISTANT }

    public static ChatTurn user(String content) {
        return new ChatTurn(Role.USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(Role.ASSISTANT, content);
    }
}
