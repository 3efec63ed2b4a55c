package com.insightplatform.engine.dto;

/**
 * @param note optional, at most {@link #MAX_NOTE_LENGTH} characters
 */
public record FeedbackRequestDTO(FeedbackKind kind, String note) {

    public static final int MAX_NOTE_LENGTH = 2000;
}
