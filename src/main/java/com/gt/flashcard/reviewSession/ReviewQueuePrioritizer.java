package com.gt.flashcard.reviewSession;

import com.gt.flashcard.model.Card;
import com.gt.flashcard.model.CardState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Orders cards for presentation. Cards are split into four tiers, concatenated in order:
 * <ol>
 *     <li>due learning and relearning cards</li>
 *     <li>due review and new cards</li>
 *     <li>new cards not yet due</li>
 *     <li>everything else not yet due</li>
 * </ol>
 * Within a tier, cards are ordered by next review date, then id.
 */
public final class ReviewQueuePrioritizer {

    static final Comparator<Card> TIER_ORDER = Comparator.comparing(Card::nextReviewDate).thenComparing(Card::id);

    private ReviewQueuePrioritizer() { }

    public static List<Card> prioritize(Collection<Card> cards, Instant now) {
        List<Card> urgentDue = new ArrayList<>();
        List<Card> regularDue = new ArrayList<>();
        List<Card> notDueNew = new ArrayList<>();
        List<Card> future = new ArrayList<>();

        for (Card card : cards) {
            switch (getTier(card, now)) {
                case UrgentDue -> urgentDue.add(card);
                case RegularDue -> regularDue.add(card);
                case NotDueNew -> notDueNew.add(card);
                case Future -> future.add(card);
            }
        }

        List<Card> prioritized = new ArrayList<>(cards.size());
        for (List<Card> tier : List.of(urgentDue, regularDue, notDueNew, future)) {
            tier.sort(TIER_ORDER);
            prioritized.addAll(tier);
        }

        return prioritized;
    }

    public static QueueTier getTier(Card card, Instant now) {
        if (card.isDue(now)) {
            return card.state().isStepped() ? QueueTier.UrgentDue : QueueTier.RegularDue;
        }

        return card.state() == CardState.New ? QueueTier.NotDueNew : QueueTier.Future;
    }

    /**
     * Keeps at most {@code newCardLimit} cards in {@link CardState#New}, preferring those that come first.
     * Cards in other states are never dropped.
     */
    public static List<Card> limitNewCards(List<Card> cards, int newCardLimit) {
        List<Card> limited = new ArrayList<>(cards.size());
        int newCardCnt = 0;

        for (Card card : cards) {
            if (card.state() != CardState.New) {
                limited.add(card);
            } else if (newCardCnt < newCardLimit) {
                limited.add(card);
                newCardCnt++;
            }
        }

        return limited;
    }

    public enum QueueTier {
        UrgentDue,
        RegularDue,
        NotDueNew,
        Future
    }
}
