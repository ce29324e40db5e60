package com.dev.queuebot.service;

import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class LuaLongStringEnvelope {

    private static final String PREFIX = "return ";

    public String wrap(String payload) {
        int level = 0;
        while ((payload + close(level)).indexOf(close(level)) != payload.length()) {
            level++;
        }
        return PREFIX + open(level) + payload + close(level);
    }

    /**
     * @return the payload, or empty when {@code value} is not wrapped
     */
    public Optional<String> strip(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.strip();
        if (!trimmed.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String rest = trimmed.substring(PREFIX.length()).stripLeading();
        if (rest.isEmpty() || rest.charAt(0) != '[') {
            return Optional.empty();
        }
        int level = 0;
        while (1 + level < rest.length() && rest.charAt(1 + level) == '=') {
            level++;
        }
        String open = open(level);
        String close = close(level);
        if (!rest.startsWith(open) || !rest.endsWith(close) || rest.length() < open.length() + close.length()) {
            return Optional.empty();
        }
        return Optional.of(rest.substring(open.length(), rest.length() - close.length()));
    }

    private String open(int level) {
        return "[" + "=".repeat(level) + "[";
    }

    private String close(int level) {
        return "]" + "=".repeat(level) + "]";
    }
}
