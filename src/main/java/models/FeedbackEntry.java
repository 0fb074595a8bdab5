package models;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Feedback lăsat de un supervizor. Nu se mai modifică după adăugare.
 */
@Getter
@AllArgsConstructor
public class FeedbackEntry {
    private final String text;
    private final int score;
    private final String reviewer;
    private final Instant createdAt;
}
