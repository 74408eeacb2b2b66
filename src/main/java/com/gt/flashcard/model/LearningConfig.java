package com.gt.flashcard.model;

import java.util.Collections;
import java.util.List;

/**
 * Step ladders are in minutes, graduating and easy intervals in days.
 */
public record LearningConfig(List<Integer> learningSteps,
                             List<Integer> relearningSteps,
                             int graduatingInterval,
                             int easyInterval,
                             int newCardsPerDay) {

    public static final LearningConfig DEFAULT = new LearningConfig(List.of(1, 10, 30), List.of(10), 1, 4, 20);

    public LearningConfig {
        learningSteps = learningSteps == null ? List.of() : Collections.unmodifiableList(learningSteps);
        relearningSteps = relearningSteps == null ? List.of() : Collections.unmodifiableList(relearningSteps);
    }
}
