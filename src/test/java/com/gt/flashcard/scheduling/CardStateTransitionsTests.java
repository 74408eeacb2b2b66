package com.gt.flashcard.scheduling;

import com.gt.flashcard.model.CardState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CardStateTransitionsTests {

    @Test
    public void testAllowedTransitions() {
        assertTrue(CardStateTransitions.isValidTransition(CardState.New, CardState.Learning));
        assertTrue(CardStateTransitions.isValidTransition(CardState.New, CardState.Review));
        assertTrue(CardStateTransitions.isValidTransition(CardState.Learning, CardState.Learning));
        assertTrue(CardStateTransitions.isValidTransition(CardState.Learning, CardState.Review));
        assertTrue(CardStateTransitions.isValidTransition(CardState.Review, CardState.Review));
        assertTrue(CardStateTransitions.isValidTransition(CardState.Review, CardState.Relearning));
        assertTrue(CardStateTransitions.isValidTransition(CardState.Relearning, CardState.Relearning));
        assertTrue(CardStateTransitions.isValidTransition(CardState.Relearning, CardState.Review));
    }

    @Test
    public void testNoTransitionBackToNew() {
        for (CardState from : CardState.values()) {
            assertFalse(CardStateTransitions.isValidTransition(from, CardState.New), from + " -> New");
        }
    }

    @Test
    public void testDisallowedTransitions() {
        assertFalse(CardStateTransitions.isValidTransition(CardState.New, CardState.Relearning));
        assertFalse(CardStateTransitions.isValidTransition(CardState.Learning, CardState.Relearning));
        assertFalse(CardStateTransitions.isValidTransition(CardState.Review, CardState.Learning));
        assertFalse(CardStateTransitions.isValidTransition(CardState.Relearning, CardState.Learning));
    }

    @Test
    public void testNullStates() {
        assertFalse(CardStateTransitions.isValidTransition(null, CardState.Review));
        assertFalse(CardStateTransitions.isValidTransition(CardState.Review, null));
        assertFalse(CardStateTransitions.Review.canTransitionTo(null));
    }
}
