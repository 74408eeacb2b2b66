package com.gt.flashcard.scheduling;

import com.gt.flashcard.model.CardState;

import java.util.Set;

public enum CardStateTransitions {
    New(Set.of(CardState.Learning, CardState.Review)),
    Learning(Set.of(CardState.Learning, CardState.Review)),
    Review(Set.of(CardState.Review, CardState.Relearning)),
    Relearning(Set.of(CardState.Relearning, CardState.Review));

    private final Set<CardState> allowedTransitions;

    CardStateTransitions(Set<CardState> allowedTransitions) {
        this.allowedTransitions = allowedTransitions;
    }

    public boolean canTransitionTo(CardState targetState) {
        if (targetState == null) {
            return false;
        }
        return allowedTransitions.contains(targetState);
    }

    public static boolean isValidTransition(CardState from, CardState to) {
        if (from == null || to == null) {
            return false;
        }
        return CardStateTransitions.valueOf(from.name()).canTransitionTo(to);
    }
}
