package com.di.tablenova.ai.provider;

import lombok.Value;

@Value
public class PromptMessage {

    public enum Role { SYSTEM, USER, ASSISTANT }

    Role role;
    String content;

    public static PromptMessage system(String content) {
        return new PromptMessage(Role.SYSTEM, content);
    }

    public static PromptMessage user(String content) {
        return new PromptMessage(Role.USER, content);
    }
}
