package com.gt.flashcard.reviewSession;

import com.gt.flashcard.card.CardService;
import com.gt.flashcard.learningConfig.LearningConfigService;
import com.gt.flashcard.model.Card;
import com.gt.flashcard.model.SessionMode;
import com.gt.flashcard.scheduling.CardStateMachine;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Starts review sessions. At most one session is active; starting another ends the previous one first so that its
 * due check is cancelled before the new one is scheduled.
 * <p>
 * New cards answered in ended sessions count against {@code newCardsPerDay} for the rest of that calendar day, in the
 * clock's zone. The tally is held in memory and starts over when the service restarts.
 */
@Component
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    private final CardService cardService;
    private final CardStateMachine cardStateMachine;
    private final LearningConfigService learningConfigService;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration dueCheckInterval;

    private ReviewSession activeSession;
    private LocalDate newCardDay;
    private int newCardsStudied = 0;

    @Autowired
    public ReviewSessionService(CardService cardService,
                                CardStateMachine cardStateMachine,
                                LearningConfigService learningConfigService,
                                TaskScheduler taskScheduler,
                                Clock clock,
                                @Value("${flashcard.session.dueCheckIntervalSec:30}") int dueCheckIntervalSec) {
        this.cardService = cardService;
        this.cardStateMachine = cardStateMachine;
        this.learningConfigService = learningConfigService;
        this.taskScheduler = taskScheduler;
        this.clock = clock;

        this.dueCheckInterval = Duration.ofSeconds(dueCheckIntervalSec > 0 ? dueCheckIntervalSec : 30);
    }

    public synchronized ReviewSession startSession(SessionMode mode) {
        endSession();

        Instant now = clock.instant();
        List<Card> sessionCards = mode == SessionMode.Due ? cardService.loadDue(now) : cardService.loadAll();

        int newCardLimit = getRemainingNewCards(now, learningConfigService.getLearningConfig().newCardsPerDay());

        ReviewSession session = new ReviewSession(UUID.randomUUID().toString(), mode, cardService, cardStateMachine,
                taskScheduler, clock, dueCheckInterval, newCardLimit);
        session.start(sessionCards);
        activeSession = session;

        return session;
    }

    public synchronized Optional<ReviewSession> getActiveSession() {
        return Optional.ofNullable(activeSession);
    }

    @PreDestroy
    public synchronized void endSession() {
        if (activeSession != null) {
            activeSession.end();
            newCardsStudied += activeSession.getNewCardsAnswered();
            activeSession = null;
        }
    }

    private int getRemainingNewCards(Instant now, int newCardsPerDay) {
        LocalDate today = LocalDate.ofInstant(now, clock.getZone());
        if (!today.equals(newCardDay)) {
            newCardDay = today;
            newCardsStudied = 0;
        }

        int remainingNewCards = Math.max(0, newCardsPerDay - newCardsStudied);
        log.debug("{} of {} new cards left for {}", remainingNewCards, newCardsPerDay, today);

        return remainingNewCards;
    }
}
