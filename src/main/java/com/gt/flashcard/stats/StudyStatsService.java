package com.gt.flashcard.stats;

import com.gt.flashcard.card.CardDao;
import com.gt.flashcard.model.Card;
import com.gt.flashcard.model.CardState;
import com.gt.flashcard.model.StudyStats;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class StudyStatsService {

    private final CardDao cardDao;
    private final Clock clock;

    @Autowired
    public StudyStatsService(CardDao cardDao, Clock clock) {
        this.cardDao = cardDao;
        this.clock = clock;
    }

    public StudyStats computeStats() {
        return computeStats(clock.instant());
    }

    public StudyStats computeStats(Instant now) {
        return calculateStats(cardDao.loadAll(), now, clock.getZone());
    }

    /**
     * Read-only projection of the collection at {@code now}. A card counts as reviewed today when it was last graded
     * on the current calendar day in {@code zone}. Cards with no recorded grading instant fall back to having been
     * graded at least once and being next due today.
     */
    public static StudyStats calculateStats(List<Card> cards, Instant now, ZoneId zone) {
        LocalDate today = LocalDate.ofInstant(now, zone);

        int dueCnt = 0;
        int reviewedTodayCnt = 0;
        int reviewStateCnt = 0;
        Instant lastStudyDate = null;
        Map<CardState, Integer> dueByState = new EnumMap<>(CardState.class);
        for (CardState cardState : CardState.values()) {
            dueByState.put(cardState, 0);
        }

        for (Card card : cards) {
            if (card.isDue(now)) {
                dueCnt++;
                dueByState.merge(card.state(), 1, Integer::sum);
            }
            if (isReviewedOn(card, today, zone)) {
                reviewedTodayCnt++;
            }
            if (card.state() == CardState.Review) {
                reviewStateCnt++;
            }
            if (card.lastReviewedAt() != null && (lastStudyDate == null || card.lastReviewedAt().isAfter(lastStudyDate))) {
                lastStudyDate = card.lastReviewedAt();
            }
        }

        int masteryPercentage = cards.isEmpty() ? 0 : (int) Math.round(100.0 * reviewStateCnt / cards.size());

        return new StudyStats(cards.size(), dueCnt, reviewedTodayCnt, masteryPercentage, lastStudyDate,
                Collections.unmodifiableMap(dueByState));
    }

    private static boolean isReviewedOn(Card card, LocalDate day, ZoneId zone) {
        if (card.lastReviewedAt() != null) {
            return LocalDate.ofInstant(card.lastReviewedAt(), zone).equals(day);
        }

        return card.reviewCount() > 0 && LocalDate.ofInstant(card.nextReviewDate(), zone).equals(day);
    }
}
