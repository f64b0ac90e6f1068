package com.imperium.riskguide.model.transcript;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 只追加的对话记录。实例不可变：{@link #append} 返回新实例，原实例不受影响，
 * 各阶段拿到的都是只读视图。
 */
public final class Transcript {

    private static final Transcript EMPTY = new Transcript(List.of());

    private final List<TranscriptMessage> messages;

    private Transcript(List<TranscriptMessage> messages) {
        this.messages = messages;
    }

    public static Transcript empty() {
        return EMPTY;
    }

    public Transcript append(TranscriptMessage message) {
        List<TranscriptMessage> next = new ArrayList<>(messages.size() + 1);
        next.addAll(messages);
        next.add(message);
        return new Transcript(Collections.unmodifiableList(next));
    }

    public List<TranscriptMessage> messages() {
        return messages;
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public Optional<TranscriptMessage> last() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    /**
     * 从后往前找最近一条用户消息。
     */
    public Optional<TranscriptMessage> lastUserMessage() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            TranscriptMessage m = messages.get(i);
            if (m.isUser()) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Transcript{size=" + messages.size() + "}";
    }
}
