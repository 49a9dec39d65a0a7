package me.golemcore.toolloop.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only message sequence of one tool loop invocation.
 *
 * <p>
 * Owned by a single invocation and never shared while the loop runs; callers
 * only ever see {@link #snapshot()} copies.
 */
public final class Conversation {

    private final List<Message> messages = new ArrayList<>();

    public Conversation(List<Message> systemMessages, List<Message> inputMessages) {
        if (systemMessages != null) {
            systemMessages.forEach(this::append);
        }
        if (inputMessages != null) {
            inputMessages.forEach(this::append);
        }
    }

    public void append(Message message) {
        messages.add(Objects.requireNonNull(message, "message"));
    }

    public List<Message> snapshot() {
        return List.copyOf(messages);
    }

    public Message last() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    public int size() {
        return messages.size();
    }
}
