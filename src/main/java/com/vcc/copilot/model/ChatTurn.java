package com.vcc.copilot.model;

/**
 * One conversation turn sent to the language model.
 */
public record ChatTurn(String role, String content) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public static ChatTurn system(String content) {
        return new ChatTurn(SYSTEM, content);
    }

    public boolean isUser() {
        return USER.equals(role);
    }
}
