package com.gt.flashcard.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A reviewable flashcard and its scheduling state.
 * <p>
 * The unit of {@code interval} depends on {@code state}: minutes while {@link CardState#Learning} or
 * {@link CardState#Relearning}, days while {@link CardState#Review}. Use {@link #intervalDuration()} rather than
 * reading the raw magnitude when a time span is needed.
 * <p>
 * {@code lastReviewedAt} is null for cards that have never been graded.
 */
public record Card(String id,
                   String front,
                   String back,
                   CardState state,
                   int currentStep,
                   double interval,
                   double ease,
                   int lapses,
                   int reviewCount,
                   Instant nextReviewDate,
                   Instant createdAt,
                   Instant lastReviewedAt) {

    public static final double DEFAULT_EASE = 2.5;
    public static final double MINIMUM_EASE = 1.3;

    public static Card newCard(String id, String front, String back, Instant now) {
        return new Card(id, front, back, CardState.New, 0, 0, DEFAULT_EASE, 0, 0, now, now, null);
    }

    public boolean isDue(Instant now) {
        return !nextReviewDate.isAfter(now);
    }

    public Duration intervalDuration() {
        if (state.getIntervalUnit() == null) {
            return Duration.ZERO;
        }

        return Duration.ofSeconds(Math.round(interval * state.getIntervalUnit().getDuration().getSeconds()));
    }

    public Card withText(String newFront, String newBack) {
        return new Card(id, newFront, newBack, state, currentStep, interval, ease, lapses, reviewCount, nextReviewDate, createdAt, lastReviewedAt);
    }
}
