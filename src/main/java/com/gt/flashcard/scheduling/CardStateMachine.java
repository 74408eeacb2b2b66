package com.gt.flashcard.scheduling;

import com.gt.flashcard.exception.InvalidGradeException;
import com.gt.flashcard.learningConfig.LearningConfigService;
import com.gt.flashcard.model.Card;
import com.gt.flashcard.model.Grade;
import com.gt.flashcard.model.LearningConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies grades to cards. Holds no per-card state; the returned card must be persisted by the caller.
 */
@Component
public class CardStateMachine {

    private static final Logger log = LoggerFactory.getLogger(CardStateMachine.class);

    private final LearningConfigService learningConfigService;
    private final Clock clock;

    @Autowired
    public CardStateMachine(LearningConfigService learningConfigService, Clock clock) {
        this.learningConfigService = learningConfigService;
        this.clock = clock;
    }

    public Card grade(Card card, Grade grade) {
        return grade(card, grade, learningConfigService.getLearningConfig(), clock.instant());
    }

    public Card grade(Card card, String gradeName) {
        return grade(card, Grade.fromGradeName(gradeName));
    }

    public Card grade(Card card, Grade grade, LearningConfig config, Instant now) {
        if (grade == null) {
            throw new InvalidGradeException("No grade supplied for card " + card.id());
        }

        Card gradedCard = IntervalCalculator.calculate(card, grade, config, now);

        if (!CardStateTransitions.isValidTransition(card.state(), gradedCard.state())) {
            String errMsg = "Grade " + grade + " produced illegal transition " + card.state() + " -> " + gradedCard.state() + " for card " + card.id();

            log.error(errMsg);
            throw new IllegalStateException(errMsg);
        }

        log.debug("Card {} graded {}: {} step {} interval {} -> {} step {} interval {}, due {}", card.id(), grade,
                card.state(), card.currentStep(), card.interval(),
                gradedCard.state(), gradedCard.currentStep(), gradedCard.interval(), gradedCard.nextReviewDate());

        return gradedCard;
    }
}
