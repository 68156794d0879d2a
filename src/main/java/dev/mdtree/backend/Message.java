package dev.mdtree.backend;

import java.util.Objects;

/**
 * One chat message sent to a text generator.
 */
public record Message(String role, String content) {

    public Message {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
    }

    public static Message user(String content) {
        return new Message("user", content);
    }
}
