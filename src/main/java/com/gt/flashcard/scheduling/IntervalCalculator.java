package com.gt.flashcard.scheduling;

import com.gt.flashcard.model.Card;
import com.gt.flashcard.model.CardState;
import com.gt.flashcard.model.Grade;
import com.gt.flashcard.model.LearningConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Computes the next scheduling state of a card for a grade. Cards that are {@link CardState#New} or
 * {@link CardState#Learning} climb the minute-denominated learning step ladder; cards in {@link CardState#Review}
 * or {@link CardState#Relearning} follow an SM-2 style ease/interval update in days, with an "again" answer
 * dropping them onto the relearning ladder.
 * <p>
 * All methods are side-effect free.
 */
public final class IntervalCalculator {

    static final double EASY_EASE_BONUS = 0.15;
    static final double MAXIMUM_LEARNING_EASE = 5.0;
    static final double HARD_EASE_PENALTY = 0.15;
    static final double LAPSE_EASE_PENALTY = 0.2;
    static final double HARD_INTERVAL_MULTIPLIER = 1.2;
    static final double EASY_INTERVAL_MULTIPLIER = 1.3;
    static final double MINIMUM_REVIEW_INTERVAL_DAYS = 1;
    static final double MAXIMUM_REVIEW_INTERVAL_DAYS = 36500;

    private IntervalCalculator() { }

    public static Card calculate(Card card, Grade grade, LearningConfig config, Instant now) {
        Card scheduled = switch (card.state()) {
            case New, Learning -> calculateLearning(card, grade, config, now);
            case Review, Relearning -> calculateReview(card, grade, config, now);
        };

        return new Card(scheduled.id(), scheduled.front(), scheduled.back(), scheduled.state(), scheduled.currentStep(),
                scheduled.interval(), scheduled.ease(), scheduled.lapses(), card.reviewCount() + 1,
                scheduled.nextReviewDate(), scheduled.createdAt(), now);
    }

    private static Card calculateLearning(Card card, Grade grade, LearningConfig config, Instant now) {
        List<Integer> learningSteps = config.learningSteps();

        switch (grade) {
            case Again:
                return withSchedule(card, CardState.Learning, 0, learningSteps.get(0), card.ease(), card.lapses(),
                        afterMinutes(now, learningSteps.get(0)));
            case Hard: {
                int step = Math.min(Math.max(0, card.currentStep()), learningSteps.size() - 1);
                return withSchedule(card, CardState.Learning, step, learningSteps.get(step), card.ease(), card.lapses(),
                        afterMinutes(now, learningSteps.get(step)));
            }
            case Good: {
                int nextStep = Math.max(0, card.currentStep()) + 1;
                if (nextStep >= learningSteps.size()) {
                    return withSchedule(card, CardState.Review, 0, config.graduatingInterval(), card.ease(), card.lapses(),
                            afterDays(now, config.graduatingInterval()));
                }
                return withSchedule(card, CardState.Learning, nextStep, learningSteps.get(nextStep), card.ease(), card.lapses(),
                        afterMinutes(now, learningSteps.get(nextStep)));
            }
            case Easy:
            default:
                return withSchedule(card, CardState.Review, 0, config.easyInterval(),
                        Math.min(card.ease() + EASY_EASE_BONUS, MAXIMUM_LEARNING_EASE), card.lapses(),
                        afterDays(now, config.easyInterval()));
        }
    }

    private static Card calculateReview(Card card, Grade grade, LearningConfig config, Instant now) {
        if (grade == Grade.Again) {
            int firstRelearningStep = config.relearningSteps().get(0);

            return withSchedule(card, CardState.Relearning, 0, firstRelearningStep,
                    Math.max(Card.MINIMUM_EASE, card.ease() - LAPSE_EASE_PENALTY), card.lapses() + 1,
                    afterMinutes(now, firstRelearningStep));
        }

        // A relearning card is graded on its current interval magnitude, as every non-again answer returns it to review
        Sm2Result sm2Result = calculateSm2Review(card.interval(), card.ease(), grade);

        return withSchedule(card, CardState.Review, 0, sm2Result.interval(), sm2Result.ease(), card.lapses(),
                afterDays(now, sm2Result.interval()));
    }

    /**
     * SM-2 interval update for a passing answer. The returned interval is kept between one day and
     * {@link #MAXIMUM_REVIEW_INTERVAL_DAYS}. An "again" grade
     * leaves both values untouched; lapses are handled by {@link #calculate}.
     */
    public static Sm2Result calculateSm2Review(double intervalDays, double ease, Grade grade) {
        double newInterval = intervalDays;
        double newEase = ease;

        switch (grade) {
            case Hard:
                newInterval = Math.max(MINIMUM_REVIEW_INTERVAL_DAYS, intervalDays * HARD_INTERVAL_MULTIPLIER);
                newEase = Math.max(Card.MINIMUM_EASE, ease - HARD_EASE_PENALTY);
                break;
            case Good:
                newInterval = intervalDays * ease;
                break;
            case Easy:
                newInterval = intervalDays * ease * EASY_INTERVAL_MULTIPLIER;
                newEase = ease + EASY_EASE_BONUS;
                break;
            default:
                break;
        }

        return new Sm2Result(Math.min(MAXIMUM_REVIEW_INTERVAL_DAYS, Math.max(MINIMUM_REVIEW_INTERVAL_DAYS, newInterval)), newEase);
    }

    static Instant afterMinutes(Instant now, double minutes) {
        return now.plus(Duration.ofMinutes((long) minutes));
    }

    // Fractional days are truncated to whole days when placing the due date; the interval keeps its fraction.
    static Instant afterDays(Instant now, double days) {
        return now.plus(Duration.ofDays((long) Math.min(days, MAXIMUM_REVIEW_INTERVAL_DAYS)));
    }

    private static Card withSchedule(Card card, CardState state, int step, double interval, double ease, int lapses, Instant nextReviewDate) {
        return new Card(card.id(), card.front(), card.back(), state, step, interval, ease, lapses, card.reviewCount(),
                nextReviewDate, card.createdAt(), card.lastReviewedAt());
    }

    public record Sm2Result(double interval, double ease) { }
}
