package com.gt.flashcard.reviewSession;

import com.gt.flashcard.model.Card;
import com.gt.flashcard.model.CardState;
import com.gt.flashcard.util.TestCards;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.gt.flashcard.util.TestCards.NOW;
import static org.junit.jupiter.api.Assertions.*;

public class ReviewQueuePrioritizerTests {

    private static final Card DUE_LEARNING = TestCards.learningCard("learning", 1, NOW.minus(Duration.ofMinutes(5)));
    private static final Card DUE_RELEARNING = TestCards.card("relearning", CardState.Relearning, 0, 10, 2.3, NOW.minus(Duration.ofMinutes(1)));
    private static final Card DUE_REVIEW = TestCards.reviewCard("review", 3, 2.5, NOW.minus(Duration.ofDays(1)));
    private static final Card DUE_NEW = Card.newCard("new", "front", "back", NOW.minus(Duration.ofHours(2)));
    private static final Card FUTURE_NEW = Card.newCard("futureNew", "front", "back", NOW.plus(Duration.ofHours(1)));
    private static final Card FUTURE_REVIEW = TestCards.reviewCard("futureReview", 3, 2.5, NOW.plus(Duration.ofDays(2)));
    private static final Card FUTURE_LEARNING = TestCards.learningCard("futureLearning", 0, NOW.plus(Duration.ofMinutes(1)));

    @Test
    public void testTierOrder() {
        List<Card> cards = new ArrayList<>(List.of(FUTURE_REVIEW, FUTURE_NEW, DUE_NEW, DUE_REVIEW, FUTURE_LEARNING, DUE_RELEARNING, DUE_LEARNING));

        for (int seed = 0; seed < 5; seed++) {
            Collections.shuffle(cards, new Random(seed));

            List<Card> prioritized = ReviewQueuePrioritizer.prioritize(cards, NOW);

            assertEquals(List.of("learning", "relearning", "review", "new", "futureNew", "futureLearning", "futureReview"),
                    prioritized.stream().map(Card::id).toList());
        }
    }

    @Test
    public void testGetTier() {
        assertEquals(ReviewQueuePrioritizer.QueueTier.UrgentDue, ReviewQueuePrioritizer.getTier(DUE_LEARNING, NOW));
        assertEquals(ReviewQueuePrioritizer.QueueTier.UrgentDue, ReviewQueuePrioritizer.getTier(DUE_RELEARNING, NOW));
        assertEquals(ReviewQueuePrioritizer.QueueTier.RegularDue, ReviewQueuePrioritizer.getTier(DUE_REVIEW, NOW));
        assertEquals(ReviewQueuePrioritizer.QueueTier.RegularDue, ReviewQueuePrioritizer.getTier(DUE_NEW, NOW));
        assertEquals(ReviewQueuePrioritizer.QueueTier.NotDueNew, ReviewQueuePrioritizer.getTier(FUTURE_NEW, NOW));
        assertEquals(ReviewQueuePrioritizer.QueueTier.Future, ReviewQueuePrioritizer.getTier(FUTURE_REVIEW, NOW));
        assertEquals(ReviewQueuePrioritizer.QueueTier.Future, ReviewQueuePrioritizer.getTier(FUTURE_LEARNING, NOW));
    }

    @Test
    public void testDueAtExactlyNowIsDue() {
        Card dueNow = TestCards.learningCard("dueNow", 0, NOW);

        assertEquals(ReviewQueuePrioritizer.QueueTier.UrgentDue, ReviewQueuePrioritizer.getTier(dueNow, NOW));
    }

    @Test
    public void testTiesBrokenById() {
        Card cardB = TestCards.reviewCard("b", 3, 2.5, NOW.minusSeconds(60));
        Card cardA = TestCards.reviewCard("a", 3, 2.5, NOW.minusSeconds(60));
        Card cardC = TestCards.reviewCard("c", 3, 2.5, NOW.minusSeconds(120));

        List<Card> prioritized = ReviewQueuePrioritizer.prioritize(List.of(cardB, cardA, cardC), NOW);

        assertEquals(List.of(cardC, cardA, cardB), prioritized);
    }

    @Test
    public void testPrioritizeEmpty() {
        assertTrue(ReviewQueuePrioritizer.prioritize(List.of(), NOW).isEmpty());
    }

    @Test
    public void testLimitNewCards() {
        Card new1 = Card.newCard("n1", "f", "b", NOW.minusSeconds(3));
        Card new2 = Card.newCard("n2", "f", "b", NOW.minusSeconds(2));
        Card new3 = Card.newCard("n3", "f", "b", NOW.minusSeconds(1));
        List<Card> cards = ReviewQueuePrioritizer.prioritize(List.of(new3, DUE_REVIEW, new1, DUE_LEARNING, new2), NOW);

        assertEquals(List.of(DUE_LEARNING, DUE_REVIEW, new1, new2), ReviewQueuePrioritizer.limitNewCards(cards, 2));
        assertEquals(List.of(DUE_LEARNING, DUE_REVIEW), ReviewQueuePrioritizer.limitNewCards(cards, 0));
        assertEquals(cards, ReviewQueuePrioritizer.limitNewCards(cards, 20));
    }
}
