package com.gt.flashcard.scheduling;

import com.gt.flashcard.exception.InvalidGradeException;
import com.gt.flashcard.learningConfig.LearningConfigService;
import com.gt.flashcard.model.Card;
import com.gt.flashcard.model.CardState;
import com.gt.flashcard.model.Grade;
import com.gt.flashcard.model.LearningConfig;
import com.gt.flashcard.util.TestCards;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;

import static com.gt.flashcard.util.TestCards.NOW;
import static com.gt.flashcard.util.TestCards.TEST_CONFIG;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class CardStateMachineTests {

    @Mock private LearningConfigService learningConfigService;

    private CardStateMachine cardStateMachine;

    @BeforeEach
    public void setup() {
        cardStateMachine = new CardStateMachine(learningConfigService, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void testGradeUsesCurrentConfigAndClock() {
        LearningConfig config = new LearningConfig(List.of(5, 15), List.of(20), 2, 6, 10);
        when(learningConfigService.getLearningConfig()).thenReturn(config);

        Card graded = cardStateMachine.grade(TestCards.newCard("c1"), Grade.Good);

        assertEquals(CardState.Learning, graded.state());
        assertEquals(1, graded.currentStep());
        assertEquals(15, graded.interval());
        assertEquals(NOW.plus(Duration.ofMinutes(15)), graded.nextReviewDate());
        assertEquals(NOW, graded.lastReviewedAt());
    }

    @Test
    public void testGradeByName() {
        when(learningConfigService.getLearningConfig()).thenReturn(TEST_CONFIG);

        Card graded = cardStateMachine.grade(TestCards.reviewCard("c1", 6, 2.5, NOW), " AGAIN ");

        assertEquals(CardState.Relearning, graded.state());
        assertEquals(1, graded.lapses());
    }

    @Test
    public void testUnknownGradeNameRejected() {
        Card card = TestCards.newCard("c1");

        assertThrows(InvalidGradeException.class, () -> cardStateMachine.grade(card, "perfect"));
        assertThrows(InvalidGradeException.class, () -> cardStateMachine.grade(card, (String) null));
        verifyNoInteractions(learningConfigService);
    }

    @Test
    public void testNullGradeRejected() {
        Card card = TestCards.newCard("c1");

        assertThrows(InvalidGradeException.class, () -> cardStateMachine.grade(card, null, TEST_CONFIG, NOW));
    }

    @Test
    public void testEveryGradeFromEveryStateIsLegal() {
        List<Card> cards = List.of(
                TestCards.newCard("new"),
                TestCards.learningCard("learning", 1, NOW),
                TestCards.reviewCard("review", 6, 2.5, NOW),
                TestCards.card("relearning", CardState.Relearning, 0, 10, 2.3, NOW));

        for (Card card : cards) {
            for (Grade grade : Grade.values()) {
                Card graded = cardStateMachine.grade(card, grade, TEST_CONFIG, NOW);

                assertNotEquals(CardState.New, graded.state());
                assertTrue(CardStateTransitions.isValidTransition(card.state(), graded.state()));
                assertEquals(card.reviewCount() + 1, graded.reviewCount());
            }
        }
    }
}
